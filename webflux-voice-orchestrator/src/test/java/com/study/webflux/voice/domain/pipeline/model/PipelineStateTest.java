package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;
import java.util.Map;

import com.study.webflux.voice.fixture.MutableClock;
import com.study.webflux.voice.fixture.PipelineStateFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateTest {

	private MutableClock clock;

	@BeforeEach
	void setUp() {
		clock = MutableClock.create();
	}

	@Test
	@DisplayName("생성 직후 IDLE 단계이며 ID에 세션과 시작 시각이 포함된다")
	void create_initialState() {
		PipelineState state = PipelineStateFixture.create(clock);

		assertThat(state.getStage()).isEqualTo(PipelineStage.IDLE);
		assertThat(state.getId())
			.isEqualTo("pipeline-session-1-" + MutableClock.DEFAULT_START.toEpochMilli());
		assertThat(state.canProceed()).isTrue();
		assertThat(state.getMetrics().startTime()).isEqualTo(MutableClock.DEFAULT_START);
	}

	@Test
	@DisplayName("빈 세션 ID로는 생성할 수 없다")
	void create_blankSession_throws() {
		assertThatThrownBy(() -> new PipelineState(" ", "user-1", clock))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("정상 흐름 전이마다 이전 단계 진입 이후의 지연을 기록한다")
	void transitionTo_recordsStageLatencies() {
		PipelineState state = PipelineStateFixture.create(clock);

		state.transitionTo(PipelineStage.AUDIO_CAPTURE);
		clock.advanceMillis(40);
		state.transitionTo(PipelineStage.ASR_PROCESSING);
		clock.advanceMillis(300);
		state.transitionTo(PipelineStage.LLM_PROCESSING);
		clock.advanceMillis(200);
		state.transitionTo(PipelineStage.TTS_SYNTHESIS);
		clock.advanceMillis(80);
		state.transitionTo(PipelineStage.AUDIO_PLAYBACK);
		clock.advanceMillis(500);
		state.transitionTo(PipelineStage.COMPLETED);

		PipelineMetrics metrics = state.getMetrics();
		assertThat(metrics.audioToAsrLatency()).isEqualTo(40);
		assertThat(metrics.asrToLlmLatency()).isEqualTo(300);
		assertThat(metrics.llmToTtsLatency()).isEqualTo(200);
		assertThat(metrics.ttsToClientLatency()).isEqualTo(80);
		assertThat(metrics.totalLatency()).isEqualTo(1120);
		assertThat(state.getSnapshot().stageHistory()).extracting(StageTransition::stage)
			.containsExactly(PipelineStage.IDLE,
				PipelineStage.AUDIO_CAPTURE,
				PipelineStage.ASR_PROCESSING,
				PipelineStage.LLM_PROCESSING,
				PipelineStage.TTS_SYNTHESIS,
				PipelineStage.AUDIO_PLAYBACK);
	}

	@Test
	@DisplayName("정상 흐름을 건너뛰는 전이는 거부한다")
	void transitionTo_skippingStage_throws() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.AUDIO_CAPTURE, clock);

		assertThatThrownBy(() -> state.transitionTo(PipelineStage.LLM_PROCESSING))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("AUDIO_CAPTURE -> LLM_PROCESSING");
		assertThat(state.getStage()).isEqualTo(PipelineStage.AUDIO_CAPTURE);
	}

	@Test
	@DisplayName("예약된 RAG_RETRIEVAL 단계로는 전이할 수 없다")
	void transitionTo_ragRetrieval_throws() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.LLM_PROCESSING, clock);

		assertThatThrownBy(() -> state.transitionTo(PipelineStage.RAG_RETRIEVAL))
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("음성 합성 단계에서 재생 없이 완료할 수 있다")
	void transitionTo_ttsSynthesisToCompleted() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.TTS_SYNTHESIS, clock);

		state.transitionTo(PipelineStage.COMPLETED);

		assertThat(state.getStage()).isEqualTo(PipelineStage.COMPLETED);
		assertThat(state.getMetrics().ttsToClientLatency()).isNull();
	}

	@Test
	@DisplayName("종료 단계 이후에는 어떤 전이도 허용하지 않는다")
	void transitionTo_afterTerminal_throws() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.COMPLETED, clock);

		assertThatThrownBy(() -> state.transitionTo(PipelineStage.AUDIO_CAPTURE))
			.isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("terminal");
		assertThat(state.tryTransitionTo(PipelineStage.AUDIO_CAPTURE)).isFalse();
		assertThat(state.canProceed()).isFalse();
	}

	@Test
	@DisplayName("첫 토큰 지연은 처음 한 번만 기록된다")
	void markFirstToken_isIdempotent() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.LLM_PROCESSING, clock);
		clock.advanceMillis(420);
		state.markFirstToken();
		clock.advanceMillis(300);
		state.markFirstToken();

		assertThat(state.getMetrics().firstTokenLatency()).isEqualTo(420);
	}

	@Test
	@DisplayName("중단하면 INTERRUPTED 단계가 되고 두 번째 중단은 무시된다")
	void interrupt_isIdempotent() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.LLM_PROCESSING, clock);

		assertThat(state.interrupt()).isTrue();
		assertThat(state.interrupt()).isFalse();

		assertThat(state.getStage()).isEqualTo(PipelineStage.INTERRUPTED);
		assertThat(state.isInterrupted()).isTrue();
		assertThat(state.canProceed()).isFalse();
		assertThat(state.tryTransition(PipelineStage.LLM_PROCESSING, PipelineStage.TTS_SYNTHESIS))
			.isFalse();
	}

	@Test
	@DisplayName("먼저 기록된 종료 원인이 유지된다")
	void setError_afterInterrupt_keepsFirstCause() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.ASR_PROCESSING, clock);
		state.interrupt();

		assertThat(state.setError(new IllegalStateException("late failure"))).isFalse();
		assertThat(state.getStage()).isEqualTo(PipelineStage.INTERRUPTED);
		assertThat(state.getError()).isEmpty();
	}

	@Test
	@DisplayName("오류가 기록되면 스냅샷에 메시지가 포함된다")
	void setError_exposedInSnapshot() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.ASR_PROCESSING, clock);

		assertThat(state.setError(new IllegalStateException("gateway down"))).isTrue();

		PipelineSnapshot snapshot = state.getSnapshot();
		assertThat(snapshot.stage()).isEqualTo(PipelineStage.ERROR);
		assertThat(snapshot.error()).isEqualTo("gateway down");
	}

	@Test
	@DisplayName("부분 전사만 부분 전사 수에 포함된다")
	void updateTranscript_countsPartialsOnly() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.ASR_PROCESSING, clock);

		state.updateTranscript("hel", false);
		state.updateTranscript("hello", false);
		state.updateTranscript("hello world", true);

		assertThat(state.getMetrics().asrPartialCount()).isEqualTo(2);
		assertThat(state.getCurrentTranscript()).isEqualTo("hello world");
	}

	@Test
	@DisplayName("응답 청크를 누적하고 토큰 수를 센다")
	void appendResponse_accumulates() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.LLM_PROCESSING, clock);

		state.appendResponse("Hello");
		state.appendResponse(", ");
		state.appendResponse("world");

		assertThat(state.getCurrentResponse()).isEqualTo("Hello, world");
		assertThat(state.getMetrics().llmTokenCount()).isEqualTo(3);
	}

	@Test
	@DisplayName("재생한 오디오 청크 수를 센다")
	void recordTtsChunk_counts() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.AUDIO_PLAYBACK, clock);

		state.recordTtsChunk();
		state.recordTtsChunk();

		assertThat(state.getMetrics().ttsChunkCount()).isEqualTo(2);
	}

	@Test
	@DisplayName("음성 설정을 저장하고 잘못된 설정은 거부한다")
	void setVoiceSettings_storesSettings() {
		PipelineState state = PipelineStateFixture.create(clock);
		assertThat(state.getVoiceSettings()).isEmpty();

		state.setVoiceSettings(new VoiceSettings("narrator", 1.2));

		assertThat(state.getVoiceSettings()).contains(new VoiceSettings("narrator", 1.2));
		assertThatThrownBy(() -> new VoiceSettings(" ", 1.0))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new VoiceSettings("narrator", 0))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("최근 대화 이력은 오래된 순서로 지정한 개수만 반환한다")
	void recentHistory_returnsLastTurns() {
		PipelineState state = PipelineStateFixture.create(clock);
		for (int i = 1; i <= 7; i++) {
			state.addToHistory(i % 2 == 1 ? MessageRole.USER : MessageRole.ASSISTANT, "m" + i);
		}

		List<ConversationMessage> recent = state.recentHistory(5);

		assertThat(recent).extracting(ConversationMessage::content)
			.containsExactly("m3", "m4", "m5", "m6", "m7");
	}

	@Test
	@DisplayName("검색 문맥과 근거 정보를 저장한다")
	void setRetrievalContext_andGrounding() {
		PipelineState state = PipelineStateFixture.create(clock);

		state.setRetrievalContext(List.of(Map.of("id", "doc-1")), List.of("[1] doc-1"));
		state.setGrounding(Map.of("score", 0.9));

		assertThat(state.getRetrievalContext()).hasValueSatisfying(context -> {
			assertThat(context.documents()).hasSize(1);
			assertThat(context.citations()).containsExactly("[1] doc-1");
		});
		assertThat(state.getGrounding()).containsEntry("score", 0.9);
		assertThat(state.getSnapshot().hasRetrievalContext()).isTrue();
	}

	@Test
	@DisplayName("종료 보고는 한 번만 허용된다")
	void markTerminationReported_once() {
		PipelineState state = PipelineStateFixture.create(clock);

		assertThat(state.markTerminationReported()).isTrue();
		assertThat(state.markTerminationReported()).isFalse();
	}
}
