package com.study.webflux.voice.domain.pipeline.model;

public record RecognitionTranscript(
	String text,
	boolean isFinal,
	Double confidence
) {
}
