package com.study.webflux.voice.domain.pipeline.model;

/**
 * 음성 인식 세션을 여는 데 필요한 정보입니다.
 */
public record RecognitionRequest(
	String pipelineId,
	String languageCode,
	int sampleRate
) {
}
