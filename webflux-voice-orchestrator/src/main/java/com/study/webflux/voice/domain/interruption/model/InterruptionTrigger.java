package com.study.webflux.voice.domain.interruption.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InterruptionTrigger {
	VAD("vad"),
	MANUAL("manual"),
	TIMEOUT("timeout");

	private final String value;

	InterruptionTrigger(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}
}
