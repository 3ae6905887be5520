package com.study.webflux.voice.domain.pipeline.model;

public record CompletionMessage(
	String role,
	String content
) {

	public static CompletionMessage from(ConversationMessage message) {
		return new CompletionMessage(message.role().wireName(), message.content());
	}
}
