package com.study.webflux.voice.application.orchestration.service;

public class PipelineNotFoundException extends RuntimeException {

	public PipelineNotFoundException(String pipelineId) {
		super("Pipeline not found: " + pipelineId);
	}
}
