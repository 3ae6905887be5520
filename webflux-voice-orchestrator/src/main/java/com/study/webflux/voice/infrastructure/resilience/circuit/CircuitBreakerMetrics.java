package com.study.webflux.voice.infrastructure.resilience.circuit;

import java.time.Instant;

/**
 * 서킷 브레이커 누적 지표 사본입니다.
 */
public record CircuitBreakerMetrics(
	long totalRequests,
	long successfulRequests,
	long failedRequests,
	long rejectedRequests,
	Instant lastFailureTime,
	Instant lastSuccessTime,
	CircuitBreakerState state,
	int recentFailures
) {
}
