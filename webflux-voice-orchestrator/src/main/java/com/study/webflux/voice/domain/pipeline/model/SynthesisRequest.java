package com.study.webflux.voice.domain.pipeline.model;

public record SynthesisRequest(
	String text,
	String voice,
	double speed
) {

	public SynthesisRequest {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
	}
}
