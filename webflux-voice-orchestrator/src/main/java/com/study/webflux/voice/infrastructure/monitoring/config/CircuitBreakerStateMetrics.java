package com.study.webflux.voice.infrastructure.monitoring.config;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreaker;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerStateChangeEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 서킷 브레이커 상태를 Micrometer 메트릭으로 내보냅니다.
 */
@Slf4j
@Component
public class CircuitBreakerStateMetrics {

	private final MeterRegistry meterRegistry;

	public CircuitBreakerStateMetrics(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;
	}

	/**
	 * 새로 생성된 브레이커의 상태 Gauge를 등록합니다.
	 */
	public void register(CircuitBreaker breaker) {
		// 0=CLOSED, 1=HALF_OPEN, 2=OPEN
		Gauge.builder("circuit.breaker.state", breaker, b -> switch (b.getState()) {
			case CLOSED -> 0;
			case HALF_OPEN -> 1;
			case OPEN -> 2;
		})
			.tag("service", breaker.getName())
			.description("Circuit breaker state (0=closed, 1=half-open, 2=open)")
			.register(meterRegistry);
	}

	public void recordTransition(CircuitBreakerStateChangeEvent event) {
		Counter.builder("circuit.breaker.transitions")
			.tag("service", event.getServiceName())
			.tag("to", event.getTo().name().toLowerCase())
			.description("Number of circuit breaker state transitions")
			.register(meterRegistry)
			.increment();
		log.info("서킷 브레이커 상태 변경 이벤트: {}", event);
	}
}
