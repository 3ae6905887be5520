package com.study.webflux.voice.domain.monitoring.model;

import java.util.List;
import java.util.Map;

/**
 * @param totalViolations
 *            보관 중인 경보 수
 * @param violationsByStage
 *            보관 중인 경보의 단계별 수
 * @param stageViolations
 *            시작 이후 단계별 누적 위반 수 (경보를 만들지 않는 단계 포함)
 */
public record LatencyStats(
	LatencyThresholds thresholds,
	int totalViolations,
	Map<String, Long> violationsByStage,
	Map<String, Long> stageViolations,
	List<LatencyAlert> recentAlerts
) {
}
