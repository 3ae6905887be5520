package com.study.webflux.voice.infrastructure.resilience.circuit;

/**
 * 서킷 브레이커 상태
 *
 * <p>
 * 서킷 브레이커는 3가지 상태를 가지며 다음과 같이 전이합니다:
 * <ul>
 * <li>CLOSED → OPEN: 롤링 윈도우 내 실패 횟수가 임계값에 도달</li>
 * <li>OPEN → HALF_OPEN: 타임아웃 경과 후 다음 요청 시</li>
 * <li>HALF_OPEN → CLOSED: 성공 횟수가 성공 임계값에 도달</li>
 * <li>HALF_OPEN → OPEN: 시험 요청 1회 실패</li>
 * </ul>
 */
public enum CircuitBreakerState {
	/**
	 * 정상 상태 - 모든 요청 허용
	 */
	CLOSED,

	/**
	 * 차단 상태 - 타임아웃 경과 전까지 요청 거부
	 */
	OPEN,

	/**
	 * 복구 시험 상태 - 요청을 허용하고 결과로 복구 여부 판단
	 */
	HALF_OPEN
}
