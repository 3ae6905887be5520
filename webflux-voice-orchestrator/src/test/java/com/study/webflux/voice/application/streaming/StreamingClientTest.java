package com.study.webflux.voice.application.streaming;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.application.interruption.service.InterruptionHandler;
import com.study.webflux.voice.application.orchestration.service.PipelineCallbacks;
import com.study.webflux.voice.application.orchestration.service.PipelineNotFoundException;
import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.fixture.MutableClock;
import com.study.webflux.voice.fixture.PipelineStateFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StreamingClientTest {

	private static final String SESSION_ID = "session-1";
	private static final String USER_ID = "user-1";

	@Mock
	private PipelineOrchestrator orchestrator;

	@Mock
	private InterruptionHandler interruptionHandler;

	private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
	private final MutableClock clock = MutableClock.create();
	private StreamingClient client;

	@BeforeEach
	void setUp() {
		client = new StreamingClient(SESSION_ID, USER_ID, orchestrator, interruptionHandler,
			objectMapper, clock);
	}

	private PipelineState givenStartedPipeline() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.AUDIO_CAPTURE, clock);
		when(orchestrator.startPipeline(eq(SESSION_ID), eq(USER_ID), any(PipelineCallbacks.class)))
			.thenReturn(state);
		return state;
	}

	private PipelineCallbacks capturedCallbacks() {
		ArgumentCaptor<PipelineCallbacks> captor = ArgumentCaptor.forClass(PipelineCallbacks.class);
		verify(orchestrator).startPipeline(eq(SESSION_ID), eq(USER_ID), captor.capture());
		return captor.getValue();
	}

	/** 연결을 닫고 지금까지 보낸 텍스트 메시지를 JSON으로 읽습니다. */
	private List<JsonNode> drainMessages() {
		client.disconnect();
		return client.frames()
			.filter(frame -> !frame.isAudio())
			.map(frame -> {
				try {
					return objectMapper.readTree(frame.text());
				} catch (Exception e) {
					throw new IllegalStateException(e);
				}
			})
			.collectList()
			.block();
	}

	private static List<String> types(List<JsonNode> messages) {
		return messages.stream().map(message -> message.get("type").asText()).toList();
	}

	@Test
	@DisplayName("연결 시 세션/사용자 ID와 타임스탬프를 담은 connected 메시지를 보낸다")
	void connect_sendsConnected() {
		client.connect();

		List<JsonNode> messages = drainMessages();

		assertThat(types(messages)).containsExactly("connected");
		JsonNode connected = messages.get(0);
		assertThat(connected.get("sessionId").asText()).isEqualTo(SESSION_ID);
		assertThat(connected.get("userId").asText()).isEqualTo(USER_ID);
		assertThat(connected.get("timestamp").asLong()).isEqualTo(clock.millis());
	}

	@Test
	@DisplayName("start 메시지로 파이프라인을 시작하고 ID와 단계를 알린다")
	void start_sendsPipelineStarted() {
		PipelineState state = givenStartedPipeline();

		client.onText("{\"type\":\"start\"}");

		assertThat(client.getPipelineId()).isEqualTo(state.getId());
		List<JsonNode> messages = drainMessages();
		assertThat(types(messages)).containsExactly("pipeline-started");
		assertThat(messages.get(0).get("pipelineId").asText()).isEqualTo(state.getId());
		assertThat(messages.get(0).get("stage").asText()).isEqualTo("AUDIO_CAPTURE");
	}

	@Test
	@DisplayName("활성 파이프라인이 있을 때 start를 다시 받으면 이전 파이프라인을 종료한다")
	void start_twice_endsPreviousPipeline() {
		PipelineState first = givenStartedPipeline();
		client.onText("{\"type\":\"start\"}");

		client.onText("{\"type\":\"start\"}");

		verify(orchestrator).endPipeline(first.getId());
	}

	@Test
	@DisplayName("파이프라인 시작 실패 시 error 메시지를 보낸다")
	void start_failure_sendsError() {
		when(orchestrator.startPipeline(anyString(), anyString(), any(PipelineCallbacks.class)))
			.thenThrow(new IllegalStateException("recognition unavailable"));

		client.onText("{\"type\":\"start\"}");

		assertThat(client.getPipelineId()).isNull();
		List<JsonNode> messages = drainMessages();
		assertThat(types(messages)).containsExactly("error");
		assertThat(messages.get(0).get("message").asText()).isEqualTo("recognition unavailable");
	}

	@Test
	@DisplayName("stop 메시지로 파이프라인을 종료하고 pipeline-stopped를 보낸다")
	void stop_endsPipeline() {
		PipelineState state = givenStartedPipeline();
		client.onText("{\"type\":\"start\"}");

		client.onText("{\"type\":\"stop\"}");

		verify(orchestrator).endPipeline(state.getId());
		assertThat(client.getPipelineId()).isNull();
		assertThat(types(drainMessages())).containsExactly("pipeline-started", "pipeline-stopped");
	}

	@Test
	@DisplayName("ping에는 pong으로 응답한다")
	void ping_sendsPong() {
		client.onText("{\"type\":\"ping\"}");

		assertThat(types(drainMessages())).containsExactly("pong");
	}

	@Test
	@DisplayName("JSON이 아닌 텍스트는 error 메시지로 응답한다")
	void invalidJson_sendsError() {
		client.onText("not-json");

		List<JsonNode> messages = drainMessages();
		assertThat(types(messages)).containsExactly("error");
		assertThat(messages.get(0).get("message").asText()).isEqualTo("Failed to process message");
	}

	@Test
	@DisplayName("알 수 없는 메시지 타입은 무시한다")
	void unknownType_isIgnored() {
		client.onText("{\"type\":\"dance\",\"extra\":1}");

		assertThat(drainMessages()).isEmpty();
	}

	@Test
	@DisplayName("interrupt 메시지는 수동 중단으로 위임한다")
	void interrupt_delegatesToManualInterrupt() {
		PipelineState state = givenStartedPipeline();
		client.onText("{\"type\":\"start\"}");

		client.onText("{\"type\":\"interrupt\"}");

		verify(interruptionHandler).manualInterrupt(state.getId(), SESSION_ID);
	}

	@Test
	@DisplayName("vad 메시지는 신뢰도와 지속 시간을 중단 핸들러에 전달한다")
	void vad_delegatesToHandler() {
		PipelineState state = givenStartedPipeline();
		client.onText("{\"type\":\"start\"}");

		client.onText("{\"type\":\"vad\",\"confidence\":0.85,\"duration\":400}");

		verify(interruptionHandler).handleVAD(state.getId(), SESSION_ID, 0.85, 400L);
	}

	@Test
	@DisplayName("파이프라인이 없으면 interrupt와 vad를 무시한다")
	void interruptAndVad_withoutPipeline_areIgnored() {
		client.onText("{\"type\":\"interrupt\"}");
		client.onText("{\"type\":\"vad\",\"confidence\":0.9,\"duration\":500}");

		verify(interruptionHandler, never()).manualInterrupt(anyString(), anyString());
		verify(interruptionHandler, never()).handleVAD(anyString(), anyString(), anyDouble(),
			anyLong());
	}

	@Test
	@DisplayName("오디오는 현재 파이프라인으로 전달한다")
	void audio_forwardsToPipeline() {
		PipelineState state = givenStartedPipeline();
		byte[] audio = new byte[] {1, 2, 3};
		when(orchestrator.processAudioChunk(state.getId(), audio)).thenReturn(Mono.empty());
		client.onText("{\"type\":\"start\"}");

		StepVerifier.create(client.onAudio(audio)).verifyComplete();

		verify(orchestrator).processAudioChunk(state.getId(), audio);
	}

	@Test
	@DisplayName("파이프라인 없이 받은 오디오나 종료된 파이프라인 오류는 흘려보낸다")
	void audio_withoutPipelineOrAfterEnd_completes() {
		StepVerifier.create(client.onAudio(new byte[] {1})).verifyComplete();
		verify(orchestrator, never()).processAudioChunk(anyString(), any());

		PipelineState state = givenStartedPipeline();
		when(orchestrator.processAudioChunk(eq(state.getId()), any()))
			.thenReturn(Mono.error(new PipelineNotFoundException(state.getId())));
		client.onText("{\"type\":\"start\"}");

		StepVerifier.create(client.onAudio(new byte[] {1})).verifyComplete();
	}

	@Test
	@DisplayName("파이프라인 이벤트를 클라이언트 메시지와 오디오 프레임으로 변환한다")
	void callbacks_areTranslatedToFrames() {
		PipelineState state = givenStartedPipeline();
		client.onText("{\"type\":\"start\"}");
		PipelineCallbacks callbacks = capturedCallbacks();

		callbacks.getOnTranscriptPartial().accept("hel");
		callbacks.getOnTranscriptFinal().accept("hello");
		callbacks.getOnLlmChunk().accept("Hi");
		callbacks.getOnTtsChunk().accept(new byte[] {9, 9});
		callbacks.getOnComplete().accept(state);
		callbacks.getOnError().accept(new IllegalStateException("boom"));
		callbacks.getOnInterrupt().run();

		client.disconnect();
		List<StreamFrame> frames = client.frames().collectList().block();

		assertThat(frames).filteredOn(StreamFrame::isAudio).singleElement()
			.satisfies(frame -> assertThat(frame.audio()).containsExactly(9, 9));
		List<JsonNode> messages = frames.stream()
			.filter(frame -> !frame.isAudio())
			.map(frame -> {
				try {
					return objectMapper.readTree(frame.text());
				} catch (Exception e) {
					throw new IllegalStateException(e);
				}
			})
			.toList();
		assertThat(types(messages)).containsExactly("pipeline-started", "transcript",
			"transcript", "llm-response", "complete", "error", "interrupted");
		assertThat(messages.get(1).get("isFinal").asBoolean()).isFalse();
		assertThat(messages.get(2).get("text").asText()).isEqualTo("hello");
		assertThat(messages.get(2).get("isFinal").asBoolean()).isTrue();
		assertThat(messages.get(3).get("chunk").asText()).isEqualTo("Hi");
		assertThat(messages.get(4).has("metrics")).isTrue();
		assertThat(messages.get(4).get("sources").isArray()).isTrue();
		assertThat(messages.get(5).get("message").asText()).isEqualTo("boom");
	}

	@Test
	@DisplayName("연결 종료 시 활성 파이프라인과 세션 중단 기록을 정리하고 프레임 스트림을 완료한다")
	void disconnect_endsPipelineAndCompletes() {
		PipelineState state = givenStartedPipeline();
		when(orchestrator.endPipeline(state.getId())).thenReturn(Optional.empty());
		client.onText("{\"type\":\"start\"}");

		client.disconnect();

		verify(orchestrator).endPipeline(state.getId());
		verify(interruptionHandler).clearSessionHistory(SESSION_ID);
		assertThat(client.getPipelineId()).isNull();
		StepVerifier.create(client.frames())
			.expectNextCount(1)
			.verifyComplete();
	}
}
