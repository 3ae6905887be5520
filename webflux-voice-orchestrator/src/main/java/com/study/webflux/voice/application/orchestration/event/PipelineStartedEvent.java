package com.study.webflux.voice.application.orchestration.event;

import java.time.Instant;

public record PipelineStartedEvent(
	String pipelineId,
	String sessionId,
	Instant startedAt
) {
}
