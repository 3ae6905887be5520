package com.study.webflux.voice.domain.pipeline.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 음성 파이프라인의 처리 단계를 정의합니다.
 *
 * <p>
 * 정상 흐름은 다음 순서로만 전진합니다.
 * <ul>
 * <li>IDLE → AUDIO_CAPTURE → ASR_PROCESSING → LLM_PROCESSING → TTS_SYNTHESIS → AUDIO_PLAYBACK →
 * COMPLETED</li>
 * <li>TTS_SYNTHESIS → COMPLETED: 음성 합성 불가 시 텍스트 전용 응답으로 종료</li>
 * </ul>
 * ERROR, INTERRUPTED는 종료되지 않은 모든 단계에서 진입할 수 있는 종료 단계입니다.
 */
public enum PipelineStage {
	/** 파이프라인 생성 직후 상태입니다. */
	IDLE,

	/** 클라이언트 오디오를 수신 대기합니다. */
	AUDIO_CAPTURE,

	/** 음성 인식 게이트웨이로 오디오를 전달합니다. */
	ASR_PROCESSING,

	/** LLM 응답을 스트리밍합니다. */
	LLM_PROCESSING,

	/**
	 * 예약된 단계입니다. 검색은 LLM 라우터 내부에서 수행되므로 어떤 전이도 이 단계로 진입하지 않습니다.
	 */
	RAG_RETRIEVAL,

	/** 음성 합성을 요청합니다. */
	TTS_SYNTHESIS,

	/** 합성된 오디오를 클라이언트로 스트리밍합니다. */
	AUDIO_PLAYBACK,

	COMPLETED,

	ERROR,

	INTERRUPTED;

	private static final Map<PipelineStage, Set<PipelineStage>> FORWARD_EDGES = Map.of(
		IDLE, EnumSet.of(AUDIO_CAPTURE),
		AUDIO_CAPTURE, EnumSet.of(ASR_PROCESSING),
		ASR_PROCESSING, EnumSet.of(LLM_PROCESSING),
		LLM_PROCESSING, EnumSet.of(TTS_SYNTHESIS),
		TTS_SYNTHESIS, EnumSet.of(AUDIO_PLAYBACK, COMPLETED),
		AUDIO_PLAYBACK, EnumSet.of(COMPLETED));

	public boolean isTerminal() {
		return this == COMPLETED || this == ERROR || this == INTERRUPTED;
	}

	/**
	 * 정상 흐름에서 대상 단계로 전진할 수 있는지 확인합니다.
	 */
	public boolean canAdvanceTo(PipelineStage target) {
		return FORWARD_EDGES.getOrDefault(this, Set.of()).contains(target);
	}
}
