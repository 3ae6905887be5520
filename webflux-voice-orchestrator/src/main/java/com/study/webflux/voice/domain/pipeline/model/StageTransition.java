package com.study.webflux.voice.domain.pipeline.model;

import java.time.Instant;

/** 이전 단계와 해당 단계를 벗어난 시각입니다. */
public record StageTransition(
	PipelineStage stage,
	Instant timestamp
) {
}
