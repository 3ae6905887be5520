package com.study.webflux.voice.infrastructure.resilience.circuit;

public record CircuitBreakerStatus(
	CircuitBreakerState state,
	boolean available,
	CircuitBreakerMetrics metrics
) {
}
