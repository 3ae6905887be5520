package com.study.webflux.voice.infrastructure.pipeline.adapter.llm;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.model.CompletionRequest;
import com.study.webflux.voice.domain.pipeline.model.LlmStreamEvent;
import com.study.webflux.voice.domain.pipeline.port.LlmStreamPort;
import com.study.webflux.voice.infrastructure.pipeline.adapter.DataBufferBytes;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * LLM 라우터 {@code POST /complete/stream} 어댑터
 *
 * <p>
 * 응답 상태가 정상이면 헤더 수신 시점에 완료되고, 본문은 {@link SseEventDecoder}로 지연 해석합니다. 4xx/5xx 응답은 Mono
 * 오류로 전달되어 서킷 브레이커 실패로 기록됩니다.
 */
@Slf4j
public class LlmRouterStreamAdapter implements LlmStreamPort {

	private final WebClient webClient;
	private final SseEventDecoder decoder;

	public LlmRouterStreamAdapter(WebClient.Builder webClientBuilder, String baseUrl,
		SseEventDecoder decoder) {
		this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
		this.decoder = decoder;
	}

	@Override
	public Mono<Flux<LlmStreamEvent>> openStream(CompletionRequest request) {
		return webClient.post()
			.uri("/complete/stream")
			.contentType(MediaType.APPLICATION_JSON)
			.accept(MediaType.TEXT_EVENT_STREAM)
			.bodyValue(request)
			.retrieve()
			.toEntityFlux(DataBuffer.class)
			.map(entity -> {
				log.debug("LLM 스트림 응답 수신: status={}", entity.getStatusCode());
				Flux<DataBuffer> body = entity.getBody() == null ? Flux.empty() : entity.getBody();
				return decoder.decode(body.map(DataBufferBytes::toBytes));
			});
	}
}
