package com.study.webflux.voice.infrastructure.resilience.circuit;

import java.time.Instant;

/**
 * 서킷 브레이커 상태 전이 이벤트
 */
public class CircuitBreakerStateChangeEvent {
	private final String serviceName;
	private final CircuitBreakerState from;
	private final CircuitBreakerState to;
	private final Instant occurredAt;

	public CircuitBreakerStateChangeEvent(String serviceName, CircuitBreakerState from,
		CircuitBreakerState to, Instant occurredAt) {
		this.serviceName = serviceName;
		this.from = from;
		this.to = to;
		this.occurredAt = occurredAt;
	}

	public String getServiceName() {
		return serviceName;
	}

	public CircuitBreakerState getFrom() {
		return from;
	}

	public CircuitBreakerState getTo() {
		return to;
	}

	public Instant getOccurredAt() {
		return occurredAt;
	}

	@Override
	public String toString() {
		return String.format("CircuitBreakerStateChangeEvent{serviceName='%s', from=%s, to=%s, occurredAt=%s}",
			serviceName, from, to, occurredAt);
	}
}
