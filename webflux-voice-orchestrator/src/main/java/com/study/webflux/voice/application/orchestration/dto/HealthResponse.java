package com.study.webflux.voice.application.orchestration.dto;

import java.time.Instant;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "다운스트림 서비스 상태")
public record HealthResponse(
	@Schema(description = "전체 상태", example = "healthy", allowableValues = {"healthy",
		"degraded"})
	String status,

	@Schema(description = "서비스별 상태")
	Map<String, Boolean> services,

	@Schema(description = "확인 시각")
	Instant timestamp
) {

	public boolean isHealthy() {
		return "healthy".equals(status);
	}
}
