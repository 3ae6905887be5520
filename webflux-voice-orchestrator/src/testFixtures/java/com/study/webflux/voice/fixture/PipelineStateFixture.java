package com.study.webflux.voice.fixture;

import java.time.Clock;

import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;

public final class PipelineStateFixture {

	public static final String DEFAULT_SESSION_ID = "session-1";
	public static final String DEFAULT_USER_ID = "user-1";

	private PipelineStateFixture() {
	}

	public static PipelineState create(Clock clock) {
		return new PipelineState(DEFAULT_SESSION_ID, DEFAULT_USER_ID, clock);
	}

	public static PipelineState create(String sessionId, Clock clock) {
		return new PipelineState(sessionId, DEFAULT_USER_ID, clock);
	}

	/**
	 * 정상 흐름을 따라 대상 단계까지 전이한 상태를 만듭니다.
	 */
	public static PipelineState advancedTo(PipelineStage target, Clock clock) {
		PipelineState state = create(clock);
		for (PipelineStage stage : new PipelineStage[] {PipelineStage.AUDIO_CAPTURE,
			PipelineStage.ASR_PROCESSING, PipelineStage.LLM_PROCESSING,
			PipelineStage.TTS_SYNTHESIS, PipelineStage.AUDIO_PLAYBACK,
			PipelineStage.COMPLETED}) {
			state.transitionTo(stage);
			if (stage == target) {
				return state;
			}
		}
		return state;
	}
}
