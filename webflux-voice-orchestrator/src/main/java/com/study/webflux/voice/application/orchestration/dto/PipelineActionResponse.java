package com.study.webflux.voice.application.orchestration.dto;

import java.time.Instant;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "파이프라인 제어 결과")
public record PipelineActionResponse(
	@Schema(description = "파이프라인 ID")
	String pipelineId,

	@Schema(description = "처리 결과", example = "interrupted")
	String status,

	@Schema(description = "처리 시각", example = "2024-12-21T12:00:00Z")
	Instant timestamp
) {
}
