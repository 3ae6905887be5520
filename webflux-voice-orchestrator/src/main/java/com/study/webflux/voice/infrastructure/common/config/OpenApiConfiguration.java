package com.study.webflux.voice.infrastructure.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;

/**
 * REST 제어 API 문서 설정입니다. 스트리밍 WebSocket({@code /stream})은 OpenAPI로 기술하지 않습니다.
 */
@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI voiceOrchestratorOpenApi(
		@Value("${spring.application.name:voice-orchestrator}") String applicationName,
		@Value("${server.port:8080}") int serverPort) {
		return new OpenAPI()
			.info(new Info()
				.title("Voice Pipeline Orchestration API")
				.description("Pipeline control, latency SLA, barge-in statistics and circuit breaker status for "
					+ applicationName)
				.version("1.0.0"))
			.addServersItem(new Server().url("http://localhost:" + serverPort)
				.description("local"));
	}

	@Bean
	public GroupedOpenApi orchestrationApiGroup() {
		return GroupedOpenApi.builder()
			.group("orchestration")
			.pathsToMatch("/api/orchestration/**")
			.build();
	}
}
