package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;

/**
 * LLM 라우터 스트리밍 요청입니다.
 */
public record CompletionRequest(
	List<CompletionMessage> messages,
	double temperature,
	int maxTokens
) {

	public CompletionRequest {
		if (messages == null || messages.isEmpty()) {
			throw new IllegalArgumentException("messages cannot be empty");
		}
		messages = List.copyOf(messages);
	}
}
