package com.study.webflux.voice.infrastructure.common.config;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.study.webflux.voice.application.streaming.VoiceStreamWebSocketHandler;

/**
 * 클라이언트 스트리밍 WebSocket 경로를 등록합니다. 어노테이션 컨트롤러보다 먼저 매칭되도록 우선순위를 높게 둡니다.
 */
@Configuration
public class WebSocketConfiguration {

	static final String STREAM_PATH = "/stream";

	@Bean
	public HandlerMapping voiceStreamHandlerMapping(VoiceStreamWebSocketHandler handler,
		WebFluxCorsConfiguration corsConfiguration) {
		SimpleUrlHandlerMapping mapping = new SimpleUrlHandlerMapping(Map.of(STREAM_PATH, handler),
			-1);
		corsConfiguration.getCorsConfiguration()
			.ifPresent(cors -> mapping.setCorsConfigurations(Map.of(STREAM_PATH, cors)));
		return mapping;
	}
}
