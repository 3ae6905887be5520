package com.study.webflux.voice.application.orchestration.dto;

import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "파이프라인 시작 Response")
public record StartPipelineResponse(
	@Schema(description = "파이프라인 ID", example = "pipeline-session-1-1734782400000")
	String pipelineId,

	@Schema(description = "세션 ID", example = "session-1")
	String sessionId,

	@Schema(description = "처리 결과", example = "started")
	String status,

	@Schema(description = "현재 단계", example = "AUDIO_CAPTURE")
	PipelineStage stage
) {
}
