package com.study.webflux.voice.domain.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 대화 이력 발화자입니다. LLM 라우터 요청의 {@code role} 값으로 그대로 전송됩니다.
 */
public enum MessageRole {
	SYSTEM("system"),
	USER("user"),
	ASSISTANT("assistant");

	private final String wireName;

	MessageRole(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String wireName() {
		return wireName;
	}
}
