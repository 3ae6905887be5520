package com.study.webflux.voice.infrastructure.resilience.circuit;

import java.time.Duration;

/**
 * 서킷 브레이커 설정
 *
 * @param failureThreshold
 *            OPEN 전이에 필요한 롤링 윈도우 내 실패 횟수
 * @param successThreshold
 *            HALF_OPEN에서 CLOSED 전이에 필요한 성공 횟수
 * @param timeout
 *            OPEN 상태 유지 시간
 * @param rollingWindow
 *            실패를 집계하는 시간 범위
 */
public record CircuitBreakerConfig(
	int failureThreshold,
	int successThreshold,
	Duration timeout,
	Duration rollingWindow
) {

	public CircuitBreakerConfig {
		if (failureThreshold <= 0) {
			throw new IllegalArgumentException("failureThreshold must be positive");
		}
		if (successThreshold <= 0) {
			throw new IllegalArgumentException("successThreshold must be positive");
		}
		if (timeout == null || timeout.isNegative()) {
			throw new IllegalArgumentException("timeout must not be negative");
		}
		if (rollingWindow == null || rollingWindow.isNegative() || rollingWindow.isZero()) {
			throw new IllegalArgumentException("rollingWindow must be positive");
		}
	}

	public static CircuitBreakerConfig defaults() {
		return new CircuitBreakerConfig(5, 2, Duration.ofSeconds(30), Duration.ofSeconds(60));
	}
}
