package com.study.webflux.voice.application.streaming;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.application.interruption.service.InterruptionHandler;
import com.study.webflux.voice.application.orchestration.service.PipelineCallbacks;
import com.study.webflux.voice.application.orchestration.service.PipelineNotFoundException;
import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.domain.pipeline.model.RetrievalContext;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 스트리밍 WebSocket 클라이언트 하나의 세션 상태입니다.
 *
 * <p>
 * 제어 메시지와 오디오는 수신 순서대로 처리되고, 파이프라인 이벤트는 {@link #frames()}로 내보냅니다. 클라이언트는 한 번에
 * 하나의 파이프라인만 가집니다.
 */
@Slf4j
public class StreamingClient {

	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	@Getter
	private final String sessionId;
	@Getter
	private final String userId;
	private final PipelineOrchestrator orchestrator;
	private final InterruptionHandler interruptionHandler;
	private final ObjectMapper objectMapper;
	private final Clock clock;
	private final Sinks.Many<StreamFrame> outbound = Sinks.many().unicast().onBackpressureBuffer();

	private volatile String pipelineId;

	public StreamingClient(String sessionId, String userId, PipelineOrchestrator orchestrator,
		InterruptionHandler interruptionHandler, ObjectMapper objectMapper, Clock clock) {
		this.sessionId = sessionId;
		this.userId = userId;
		this.orchestrator = orchestrator;
		this.interruptionHandler = interruptionHandler;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public void connect() {
		Map<String, Object> connected = message("connected");
		connected.put("sessionId", sessionId);
		connected.put("userId", userId);
		send(connected);
	}

	/**
	 * 텍스트 프레임을 제어 메시지로 해석해 처리합니다.
	 */
	public void onText(String payload) {
		StreamControlMessage control;
		try {
			control = objectMapper.readValue(payload, StreamControlMessage.class);
		} catch (JsonProcessingException e) {
			log.warn("제어 메시지 해석 실패: sessionId={}, error={}", sessionId, e.getOriginalMessage());
			sendError("Failed to process message");
			return;
		}

		String type = control.type() == null ? "" : control.type();
		log.debug("제어 메시지 수신: sessionId={}, type={}", sessionId, type);
		switch (type) {
			case "start" -> startPipeline();
			case "stop" -> stopPipeline();
			case "interrupt" -> interrupt();
			case "vad" -> handleVad(control);
			case "ping" -> send(message("pong"));
			default -> log.warn("알 수 없는 제어 메시지: sessionId={}, type={}", sessionId, type);
		}
	}

	/**
	 * 오디오 청크를 현재 파이프라인으로 전달합니다. 처리 오류는 로그만 남깁니다.
	 */
	public Mono<Void> onAudio(byte[] audio) {
		String current = pipelineId;
		if (current == null) {
			log.warn("활성 파이프라인 없이 오디오 수신: sessionId={}", sessionId);
			return Mono.empty();
		}
		return orchestrator.processAudioChunk(current, audio)
			.onErrorResume(PipelineNotFoundException.class, e -> {
				log.warn("종료된 파이프라인으로 오디오 수신: {}", current);
				return Mono.empty();
			})
			.onErrorResume(e -> {
				log.error("오디오 처리 실패: pipelineId={}", current, e);
				return Mono.empty();
			});
	}

	/**
	 * 연결 종료 시 활성 파이프라인과 세션의 중단 기록을 정리하고 전송 스트림을 닫습니다.
	 */
	public void disconnect() {
		String current = pipelineId;
		pipelineId = null;
		if (current != null) {
			orchestrator.endPipeline(current);
		}
		interruptionHandler.clearSessionHistory(sessionId);
		outbound.tryEmitComplete();
		log.info("스트리밍 클라이언트 연결 종료: sessionId={}", sessionId);
	}

	public Flux<StreamFrame> frames() {
		return outbound.asFlux();
	}

	public String getPipelineId() {
		return pipelineId;
	}

	private void startPipeline() {
		String previous = pipelineId;
		if (previous != null) {
			log.info("새 파이프라인 시작 전 이전 파이프라인 종료: {}", previous);
			orchestrator.endPipeline(previous);
		}

		PipelineState state;
		try {
			state = orchestrator.startPipeline(sessionId, userId, callbacks());
		} catch (RuntimeException e) {
			log.error("파이프라인 시작 실패: sessionId={}", sessionId, e);
			sendError(e.getMessage());
			return;
		}
		pipelineId = state.getId();

		Map<String, Object> started = message("pipeline-started");
		started.put("pipelineId", state.getId());
		started.put("stage", state.getStage());
		send(started);
	}

	private void stopPipeline() {
		String current = pipelineId;
		if (current == null) {
			return;
		}
		pipelineId = null;
		orchestrator.endPipeline(current);
		send(message("pipeline-stopped"));
	}

	private void interrupt() {
		String current = pipelineId;
		if (current != null) {
			interruptionHandler.manualInterrupt(current, sessionId);
		}
	}

	private void handleVad(StreamControlMessage control) {
		String current = pipelineId;
		if (current == null) {
			return;
		}
		double confidence = control.confidence() == null ? 0.0 : control.confidence();
		long duration = control.duration() == null ? 0L : control.duration();
		interruptionHandler.handleVAD(current, sessionId, confidence, duration);
	}

	private PipelineCallbacks callbacks() {
		return PipelineCallbacks.builder()
			.onTranscriptPartial(text -> sendTranscript(text, false))
			.onTranscriptFinal(text -> sendTranscript(text, true))
			.onLlmChunk(chunk -> {
				Map<String, Object> response = message("llm-response");
				response.put("chunk", chunk);
				send(response);
			})
			.onTtsChunk(audio -> emit(StreamFrame.audio(audio)))
			.onComplete(state -> {
				Map<String, Object> complete = message("complete");
				complete.put("metrics", state.getMetrics());
				complete.put("sources", state.getRetrievalContext()
					.map(RetrievalContext::citations)
					.orElse(List.of()));
				send(complete);
			})
			.onError(error -> sendError(error.getMessage()))
			.onInterrupt(() -> send(message("interrupted")))
			.build();
	}

	private void sendTranscript(String text, boolean isFinal) {
		Map<String, Object> transcript = message("transcript");
		transcript.put("text", text);
		transcript.put("isFinal", isFinal);
		send(transcript);
	}

	private void sendError(String error) {
		Map<String, Object> message = message("error");
		message.put("message", error);
		send(message);
	}

	private Map<String, Object> message(String type) {
		Map<String, Object> message = new LinkedHashMap<>();
		message.put("type", type);
		return message;
	}

	private void send(Map<String, Object> message) {
		message.put("timestamp", clock.millis());
		try {
			emit(StreamFrame.text(objectMapper.writeValueAsString(message)));
		} catch (JsonProcessingException e) {
			log.error("클라이언트 메시지 직렬화 실패: sessionId={}, type={}", sessionId,
				message.get("type"), e);
		}
	}

	private void emit(StreamFrame frame) {
		outbound.emitNext(frame, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
	}
}
