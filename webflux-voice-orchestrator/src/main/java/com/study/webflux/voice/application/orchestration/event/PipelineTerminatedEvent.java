package com.study.webflux.voice.application.orchestration.event;

import com.study.webflux.voice.domain.pipeline.model.PipelineState;

/**
 * 파이프라인이 종료 단계에 도달했거나 종료 단계 전에 끝났을 때 한 번 발행됩니다.
 */
public record PipelineTerminatedEvent(
	PipelineState state
) {
}
