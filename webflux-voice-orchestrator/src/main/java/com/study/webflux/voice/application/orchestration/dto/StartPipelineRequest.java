package com.study.webflux.voice.application.orchestration.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "파이프라인 시작 Request")
public record StartPipelineRequest(
	@Schema(description = "세션 ID", example = "session-1")
	@NotBlank String sessionId,

	@Schema(description = "사용자 ID", example = "550e8400-e29b-41d4-a716-446655440000")
	@NotBlank String userId
) {
}
