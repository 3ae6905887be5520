package com.study.webflux.voice.application.streaming;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 클라이언트 제어 메시지입니다. {@code confidence}, {@code duration}은 vad 메시지에서만 사용합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamControlMessage(
	String type,
	Double confidence,
	Long duration
) {
}
