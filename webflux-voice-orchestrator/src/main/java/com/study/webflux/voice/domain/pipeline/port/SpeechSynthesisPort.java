package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.SynthesisRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 음성 합성 스트리밍 포트입니다. 응답 헤더 수신 시 오디오 청크 스트림을 내보냅니다.
 */
public interface SpeechSynthesisPort {

	Mono<Flux<byte[]>> openStream(SynthesisRequest request);
}
