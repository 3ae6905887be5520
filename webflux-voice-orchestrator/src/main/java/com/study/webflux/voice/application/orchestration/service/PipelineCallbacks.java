package com.study.webflux.voice.application.orchestration.service;

import java.util.function.Consumer;

import lombok.Builder;
import lombok.Getter;

import com.study.webflux.voice.domain.pipeline.model.PipelineSnapshot;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;

/**
 * 파이프라인 하나에 등록되는 이벤트 구독 묶음입니다. 지정하지 않은 항목은 아무 동작도 하지 않습니다.
 */
@Getter
@Builder
public class PipelineCallbacks {

	@Builder.Default
	private final Consumer<String> onTranscriptPartial = text -> {
	};

	@Builder.Default
	private final Consumer<String> onTranscriptFinal = text -> {
	};

	@Builder.Default
	private final Consumer<String> onLlmChunk = chunk -> {
	};

	@Builder.Default
	private final Consumer<byte[]> onTtsChunk = audio -> {
	};

	@Builder.Default
	private final Consumer<PipelineState> onComplete = state -> {
	};

	@Builder.Default
	private final Consumer<Throwable> onError = error -> {
	};

	@Builder.Default
	private final Runnable onInterrupt = () -> {
	};

	@Builder.Default
	private final Consumer<PipelineSnapshot> onEnd = snapshot -> {
	};

	public static PipelineCallbacks none() {
		return PipelineCallbacks.builder().build();
	}
}
