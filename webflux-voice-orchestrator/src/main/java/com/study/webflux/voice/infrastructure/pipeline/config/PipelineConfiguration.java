package com.study.webflux.voice.infrastructure.pipeline.config;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.pipeline.port.LlmStreamPort;
import com.study.webflux.voice.domain.pipeline.port.ServiceHealthPort;
import com.study.webflux.voice.domain.pipeline.port.SpeechRecognitionPort;
import com.study.webflux.voice.domain.pipeline.port.SpeechSynthesisPort;
import com.study.webflux.voice.infrastructure.monitoring.config.CircuitBreakerStateMetrics;
import com.study.webflux.voice.infrastructure.pipeline.adapter.asr.AsrGatewayWebSocketAdapter;
import com.study.webflux.voice.infrastructure.pipeline.adapter.health.DownstreamHealthProbe;
import com.study.webflux.voice.infrastructure.pipeline.adapter.llm.LlmRouterStreamAdapter;
import com.study.webflux.voice.infrastructure.pipeline.adapter.llm.SseEventDecoder;
import com.study.webflux.voice.infrastructure.pipeline.adapter.tts.TtsServiceStreamAdapter;
import com.study.webflux.voice.infrastructure.pipeline.config.properties.VoicePipelineProperties;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerConfig;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerManager;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

/** 다운스트림 어댑터와 파이프라인 공용 구성 요소를 등록합니다. */
@Configuration
public class PipelineConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/** 인터럽트 쿨다운 타이머용 스케줄러입니다. */
	@Bean
	public Scheduler interruptionScheduler() {
		return Schedulers.parallel();
	}

	@Bean
	public CircuitBreakerManager circuitBreakerManager(VoicePipelineProperties properties,
		Clock clock,
		CircuitBreakerStateMetrics circuitBreakerStateMetrics) {
		var circuitBreaker = properties.getCircuitBreaker();
		CircuitBreakerConfig config = new CircuitBreakerConfig(circuitBreaker.getFailureThreshold(),
			circuitBreaker.getSuccessThreshold(),
			circuitBreaker.getTimeout(),
			circuitBreaker.getRollingWindow());

		CircuitBreakerManager manager = new CircuitBreakerManager(config, clock);
		manager.setRegistrationListener(circuitBreakerStateMetrics::register);
		manager.setStateChangeListener(circuitBreakerStateMetrics::recordTransition);
		return manager;
	}

	/**
	 * 응답 타임아웃이 종단 간 지연 예산으로 설정된 다운스트림 WebClient 빌더입니다.
	 */
	private WebClient.Builder downstreamWebClientBuilder(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties) {
		HttpClient httpClient = HttpClient.create()
			.responseTimeout(properties.getRequestTimeout());
		return webClientBuilder.clone()
			.clientConnector(new ReactorClientHttpConnector(httpClient));
	}

	@Bean
	public SseEventDecoder sseEventDecoder(ObjectMapper objectMapper) {
		return new SseEventDecoder(objectMapper);
	}

	@Bean
	public LlmStreamPort llmStreamPort(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties,
		SseEventDecoder sseEventDecoder) {
		return new LlmRouterStreamAdapter(downstreamWebClientBuilder(webClientBuilder, properties),
			properties.getServices().getLlmRouterUrl(),
			sseEventDecoder);
	}

	@Bean
	public SpeechSynthesisPort speechSynthesisPort(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties) {
		return new TtsServiceStreamAdapter(downstreamWebClientBuilder(webClientBuilder, properties),
			properties.getServices().getTtsServiceUrl());
	}

	@Bean
	public SpeechRecognitionPort speechRecognitionPort(VoicePipelineProperties properties,
		ObjectMapper objectMapper) {
		return new AsrGatewayWebSocketAdapter(new ReactorNettyWebSocketClient(),
			properties.getServices().getAsrGatewayUrl(),
			properties.getRecognition().getPath(),
			objectMapper);
	}

	@Bean
	public ServiceHealthPort serviceHealthPort(WebClient.Builder webClientBuilder,
		VoicePipelineProperties properties) {
		var services = properties.getServices();
		Map<String, String> serviceUrls = new LinkedHashMap<>();
		serviceUrls.put("asr", services.getAsrGatewayUrl());
		serviceUrls.put("llm", services.getLlmRouterUrl());
		serviceUrls.put("rag", services.getRagServiceUrl());
		serviceUrls.put("tts", services.getTtsServiceUrl());
		return new DownstreamHealthProbe(webClientBuilder, serviceUrls,
			properties.getHealthCheckTimeout());
	}
}
