package com.study.webflux.voice.domain.monitoring.model;

import java.time.Instant;

/**
 * SLA 임계값을 초과한 지연 기록입니다.
 */
public record LatencyAlert(
	String pipelineId,
	String sessionId,
	String stage,
	long actualMs,
	long thresholdMs,
	Instant timestamp
) {
}
