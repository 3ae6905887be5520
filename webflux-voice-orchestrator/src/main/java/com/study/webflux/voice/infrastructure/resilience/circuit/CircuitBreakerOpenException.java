package com.study.webflux.voice.infrastructure.resilience.circuit;

/**
 * 서킷이 열려 있어 요청이 거부되었을 때 발생합니다.
 */
public class CircuitBreakerOpenException extends RuntimeException {

	private final String serviceName;

	public CircuitBreakerOpenException(String serviceName) {
		super("Circuit breaker is OPEN for " + serviceName);
		this.serviceName = serviceName;
	}

	public String getServiceName() {
		return serviceName;
	}
}
