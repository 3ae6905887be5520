package com.study.webflux.voice.infrastructure.common.config;

import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * {@code web.cors.allowed-origins}가 설정된 경우에만 CORS를 적용합니다.
 *
 * <p>
 * 같은 설정을 REST API({@code /api/**})와 스트리밍 WebSocket 핸드셰이크({@code /stream})가 공유합니다.
 */
@Configuration
public class WebFluxCorsConfiguration implements WebFluxConfigurer {

	static final String API_PATH_PATTERN = "/api/**";
	private static final long MAX_AGE_SECONDS = 3600;

	private final CorsConfiguration corsConfiguration;

	public WebFluxCorsConfiguration(
		@Value("${web.cors.allowed-origins:}") List<String> allowedOrigins) {
		this.corsConfiguration = toCorsConfiguration(allowedOrigins);
	}

	static CorsConfiguration toCorsConfiguration(List<String> allowedOrigins) {
		List<String> origins = allowedOrigins.stream().map(String::trim)
			.filter(origin -> !origin.isBlank()).toList();
		if (origins.isEmpty()) {
			return null;
		}

		CorsConfiguration configuration = new CorsConfiguration();
		configuration.setAllowedOrigins(origins);
		configuration.setAllowedMethods(List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS"));
		configuration.addAllowedHeader(CorsConfiguration.ALL);
		configuration.setMaxAge(MAX_AGE_SECONDS);
		return configuration;
	}

	@Override
	public void addCorsMappings(CorsRegistry registry) {
		if (corsConfiguration == null) {
			return;
		}
		registry.addMapping(API_PATH_PATTERN).combine(corsConfiguration);
	}

	/** 허용 출처가 없으면 비어 있습니다. */
	public Optional<CorsConfiguration> getCorsConfiguration() {
		return Optional.ofNullable(corsConfiguration);
	}
}
