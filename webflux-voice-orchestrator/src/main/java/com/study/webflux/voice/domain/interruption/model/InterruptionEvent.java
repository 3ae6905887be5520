package com.study.webflux.voice.domain.interruption.model;

import java.time.Instant;

/**
 * 발생한 바지인(barge-in) 중단 한 건입니다. 분석 용도로만 보관합니다.
 */
public record InterruptionEvent(
	String pipelineId,
	String sessionId,
	Instant timestamp,
	InterruptionTrigger trigger,
	double confidence
) {
}
