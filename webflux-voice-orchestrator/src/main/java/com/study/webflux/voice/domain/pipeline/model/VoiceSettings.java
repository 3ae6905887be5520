package com.study.webflux.voice.domain.pipeline.model;

/**
 * 음성 합성 요청에 사용할 음성과 속도입니다.
 */
public record VoiceSettings(
	String voice,
	double speed
) {

	public VoiceSettings {
		if (voice == null || voice.isBlank()) {
			throw new IllegalArgumentException("voice cannot be blank");
		}
		if (speed <= 0) {
			throw new IllegalArgumentException("speed must be positive");
		}
	}
}
