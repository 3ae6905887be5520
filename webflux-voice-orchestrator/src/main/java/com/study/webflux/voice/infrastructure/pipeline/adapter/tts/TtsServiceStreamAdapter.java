package com.study.webflux.voice.infrastructure.pipeline.adapter.tts;

import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.model.SynthesisRequest;
import com.study.webflux.voice.domain.pipeline.port.SpeechSynthesisPort;
import com.study.webflux.voice.infrastructure.pipeline.adapter.DataBufferBytes;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * TTS 서비스 {@code POST /synthesize/stream} 어댑터
 */
@Slf4j
public class TtsServiceStreamAdapter implements SpeechSynthesisPort {

	private final WebClient webClient;

	public TtsServiceStreamAdapter(WebClient.Builder webClientBuilder, String baseUrl) {
		this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
	}

	@Override
	public Mono<Flux<byte[]>> openStream(SynthesisRequest request) {
		log.debug("음성 합성 요청: textLength={}, voice={}", request.text().length(), request.voice());
		return webClient.post()
			.uri("/synthesize/stream")
			.contentType(MediaType.APPLICATION_JSON)
			.accept(MediaType.APPLICATION_OCTET_STREAM, MediaType.ALL)
			.bodyValue(request)
			.retrieve()
			.toEntityFlux(DataBuffer.class)
			.map(entity -> {
				Flux<DataBuffer> body = entity.getBody() == null ? Flux.empty() : entity.getBody();
				return body.map(DataBufferBytes::toBytes);
			});
	}
}
