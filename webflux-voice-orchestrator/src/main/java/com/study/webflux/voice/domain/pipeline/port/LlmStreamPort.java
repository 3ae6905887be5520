package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.CompletionRequest;
import com.study.webflux.voice.domain.pipeline.model.LlmStreamEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * LLM 라우터 스트리밍 포트입니다.
 */
public interface LlmStreamPort {

	/**
	 * 스트리밍 완성을 요청합니다.
	 *
	 * <p>
	 * 반환된 Mono는 응답 헤더가 정상 수신되면 완료되며, 내부 Flux는 본문을 지연 해석하는 일회성 이벤트 시퀀스입니다. 구독을 취소하면
	 * 연결이 해제됩니다.
	 */
	Mono<Flux<LlmStreamEvent>> openStream(CompletionRequest request);
}
