package com.study.webflux.voice.domain.pipeline.model;

import java.time.Instant;

/**
 * 파이프라인 대화 이력의 한 턴입니다.
 */
public record ConversationMessage(
	MessageRole role,
	String content,
	Instant timestamp
) {

	public ConversationMessage {
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (content == null) {
			throw new IllegalArgumentException("content cannot be null");
		}
	}
}
