package com.study.webflux.voice.application.orchestration.service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.study.webflux.voice.application.orchestration.event.PipelineStartedEvent;
import com.study.webflux.voice.application.orchestration.event.PipelineTerminatedEvent;
import com.study.webflux.voice.domain.pipeline.model.CompletionMessage;
import com.study.webflux.voice.domain.pipeline.model.CompletionRequest;
import com.study.webflux.voice.domain.pipeline.model.LlmStreamEvent;
import com.study.webflux.voice.domain.pipeline.model.MessageRole;
import com.study.webflux.voice.domain.pipeline.model.PipelineSnapshot;
import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.domain.pipeline.model.RecognitionRequest;
import com.study.webflux.voice.domain.pipeline.model.RecognitionTranscript;
import com.study.webflux.voice.domain.pipeline.model.SynthesisRequest;
import com.study.webflux.voice.domain.pipeline.model.VoiceSettings;
import com.study.webflux.voice.domain.pipeline.port.LlmStreamPort;
import com.study.webflux.voice.domain.pipeline.port.RecognitionConnection;
import com.study.webflux.voice.domain.pipeline.port.RecognitionException;
import com.study.webflux.voice.domain.pipeline.port.RecognitionListener;
import com.study.webflux.voice.domain.pipeline.port.ServiceHealthPort;
import com.study.webflux.voice.domain.pipeline.port.SpeechRecognitionPort;
import com.study.webflux.voice.domain.pipeline.port.SpeechSynthesisPort;
import com.study.webflux.voice.infrastructure.pipeline.config.properties.VoicePipelineProperties;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerManager;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerStatus;
import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 음성 파이프라인 오케스트레이터
 *
 * <p>
 * 활성 파이프라인 맵, 파이프라인별 음성 인식 연결, 서비스별 서킷 브레이커를 소유하고 모든 단계 전이를 구동합니다.
 *
 * <h3>처리 흐름</h3>
 * <ul>
 * <li>첫 오디오 청크: ASR_PROCESSING 전이 후 음성 인식 연결을 열고 전달</li>
 * <li>최종 전사: LLM_PROCESSING 전이 후 {@value #LLM_SERVICE} 브레이커를 거쳐 응답 스트리밍</li>
 * <li>LLM 종료: TTS_SYNTHESIS 전이 후 {@value #TTS_SERVICE} 브레이커를 거쳐 음성 합성</li>
 * <li>오디오 스트림 종료: COMPLETED</li>
 * </ul>
 *
 * <p>
 * 취소는 협력적입니다. 각 스트림 루프는 이벤트마다 {@link PipelineState#canProceed()}를 확인하고 false면 구독을 끊어
 * 다운스트림 연결을 해제합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

	public static final String LLM_SERVICE = "llm-router";
	public static final String TTS_SERVICE = "tts-service";

	private final SpeechRecognitionPort speechRecognitionPort;
	private final LlmStreamPort llmStreamPort;
	private final SpeechSynthesisPort speechSynthesisPort;
	private final ServiceHealthPort serviceHealthPort;
	private final CircuitBreakerManager circuitBreakerManager;
	private final ApplicationEventPublisher eventPublisher;
	private final VoicePipelineProperties properties;
	private final Clock clock;

	private final Map<String, PipelineState> activePipelines = new ConcurrentHashMap<>();
	private final Map<String, PipelineCallbacks> subscriptions = new ConcurrentHashMap<>();
	private final Map<String, RecognitionConnection> recognitionConnections = new ConcurrentHashMap<>();
	private final Map<String, Disposable> responseStreams = new ConcurrentHashMap<>();

	/**
	 * 새 파이프라인을 만들고 AUDIO_CAPTURE로 전이합니다.
	 */
	public PipelineState startPipeline(String sessionId, String userId,
		PipelineCallbacks callbacks) {
		PipelineState state = new PipelineState(sessionId, userId, clock);
		VoicePipelineProperties.Tts tts = properties.getTts();
		state.setVoiceSettings(new VoiceSettings(tts.getDefaultVoice(), tts.getDefaultSpeed()));

		if (activePipelines.putIfAbsent(state.getId(), state) != null) {
			throw new IllegalStateException("Pipeline already exists: " + state.getId());
		}
		subscriptions.put(state.getId(), callbacks == null ? PipelineCallbacks.none() : callbacks);
		state.transitionTo(PipelineStage.AUDIO_CAPTURE);

		eventPublisher.publishEvent(
			new PipelineStartedEvent(state.getId(), sessionId, clock.instant()));
		log.info("파이프라인 시작: pipelineId={}, sessionId={}, userId={}",
			state.getId(),
			sessionId,
			userId);
		return state;
	}

	/**
	 * 오디오 청크를 음성 인식 게이트웨이로 전달합니다.
	 *
	 * <p>
	 * 진행할 수 없는 파이프라인의 청크는 조용히 버립니다. 첫 청크는 연결을 연 뒤 전달되며, 연결 실패는 파이프라인 오류로 처리되고
	 * 호출자에게 전파되지 않습니다. 호출자는 같은 파이프라인의 청크를 순서대로 넘겨야 합니다.
	 *
	 * @throws PipelineNotFoundException
	 *             활성 파이프라인이 없는 경우 (Mono 오류)
	 */
	public Mono<Void> processAudioChunk(String pipelineId, byte[] audio) {
		return Mono.defer(() -> {
			PipelineState state = activePipelines.get(pipelineId);
			if (state == null) {
				return Mono.error(new PipelineNotFoundException(pipelineId));
			}
			if (!state.canProceed()) {
				log.debug("진행 불가 파이프라인의 오디오 청크 폐기: {}", pipelineId);
				return Mono.empty();
			}

			if (state.tryTransition(PipelineStage.AUDIO_CAPTURE, PipelineStage.ASR_PROCESSING)) {
				return openRecognition(state)
					.doOnNext(connection -> connection.sendAudio(audio))
					.then();
			}

			RecognitionConnection connection = recognitionConnections.get(pipelineId);
			if (connection == null || !connection.isOpen()) {
				log.warn("음성 인식 연결이 없어 오디오 청크 폐기: {}", pipelineId);
				return Mono.empty();
			}
			connection.sendAudio(audio);
			return Mono.empty();
		});
	}

	private Mono<RecognitionConnection> openRecognition(PipelineState state) {
		VoicePipelineProperties.Recognition recognition = properties.getRecognition();
		RecognitionRequest request = new RecognitionRequest(state.getId(),
			recognition.getLanguageCode(),
			recognition.getSampleRate());

		return speechRecognitionPort
			.connect(request, new PipelineRecognitionListener(state.getId()))
			.timeout(recognition.getConnectTimeout())
			.flatMap(connection -> {
				recognitionConnections.put(state.getId(), connection);
				if (!state.canProceed()) {
					recognitionConnections.remove(state.getId());
					connection.close();
					return Mono.<RecognitionConnection>empty();
				}
				log.debug("음성 인식 연결 수립: {}", state.getId());
				return Mono.just(connection);
			})
			.onErrorResume(error -> {
				failPipeline(state, new RecognitionException(
					"Failed to connect to recognition gateway: " + error.getMessage(), error));
				return Mono.empty();
			});
	}

	/**
	 * 최종 전사를 기록하고 LLM 응답 스트리밍을 시작합니다. ASR_PROCESSING 단계가 아니면 무시합니다.
	 */
	public Mono<Void> processFinalTranscript(String pipelineId, String transcript) {
		return Mono.defer(() -> {
			PipelineState state = activePipelines.get(pipelineId);
			if (state == null || !state.canProceed()) {
				return Mono.empty();
			}
			if (!state.tryTransition(PipelineStage.ASR_PROCESSING, PipelineStage.LLM_PROCESSING)) {
				log.debug("ASR 단계가 아니므로 최종 전사 무시: pipelineId={}, stage={}",
					pipelineId,
					state.getStage());
				return Mono.empty();
			}
			state.updateTranscript(transcript, true);
			state.addToHistory(MessageRole.USER, transcript);

			return streamLlmResponse(state).onErrorResume(error -> {
				failPipeline(state, error);
				return Mono.empty();
			});
		});
	}

	private Mono<Void> streamLlmResponse(PipelineState state) {
		VoicePipelineProperties.Llm llm = properties.getLlm();
		List<CompletionMessage> messages = state.recentHistory(llm.getHistoryTurns()).stream()
			.map(CompletionMessage::from)
			.toList();
		CompletionRequest request = new CompletionRequest(messages, llm.getTemperature(),
			llm.getMaxTokens());

		return circuitBreakerManager.getBreaker(LLM_SERVICE)
			.execute(() -> llmStreamPort.openStream(request), error -> llmFallback(state, error))
			.flatMap(events -> consumeLlmStream(state, events));
	}

	/**
	 * LLM 이벤트를 소비합니다. 종료 이벤트를 받거나 파이프라인이 진행 불가가 되면 즉시 구독을 끊습니다.
	 */
	private Mono<Void> consumeLlmStream(PipelineState state, Flux<LlmStreamEvent> events) {
		AtomicBoolean doneReceived = new AtomicBoolean();
		return events
			.takeUntil(LlmStreamEvent::done)
			.takeWhile(event -> state.canProceed())
			.doOnNext(event -> {
				applyLlmEvent(state, event);
				if (event.done()) {
					doneReceived.set(true);
				}
			})
			.then(Mono.defer(() -> {
				if (!state.canProceed()) {
					log.debug("LLM 스트림 중단됨: {}", state.getId());
					return Mono.empty();
				}
				if (!doneReceived.get()) {
					log.warn("LLM 스트림이 종료 표시 없이 끝나 누적 응답으로 합성 진행: {}", state.getId());
				}
				state.addToHistory(MessageRole.ASSISTANT, state.getCurrentResponse());
				return synthesizeSpeech(state);
			}));
	}

	private void applyLlmEvent(PipelineState state, LlmStreamEvent event) {
		if (!state.canProceed()) {
			return;
		}
		if (event.hasContent()) {
			state.appendResponse(event.content());
			state.markFirstToken();
			dispatchCallback(state.getId(),
				callbacks -> callbacks.getOnLlmChunk().accept(event.content()));
		}
		if (event.done()) {
			if (!event.sources().isEmpty() || !event.citations().isEmpty()) {
				state.setRetrievalContext(event.sources(), event.citations());
			}
			if (!event.grounding().isEmpty()) {
				state.setGrounding(event.grounding());
			}
		}
	}

	private Mono<Flux<LlmStreamEvent>> llmFallback(PipelineState state, Throwable cause) {
		return Mono.defer(() -> {
			if (!state.canProceed()) {
				return Mono.empty();
			}
			log.warn("LLM 라우터 사용 불가, 대체 응답으로 진행: pipelineId={}, cause={}",
				state.getId(),
				cause.getMessage());
			String message = properties.getLlm().getFallbackMessage();
			state.appendResponse(message);
			state.addToHistory(MessageRole.ASSISTANT, message);
			return synthesizeSpeech(state).then(Mono.<Flux<LlmStreamEvent>>empty());
		});
	}

	/**
	 * 누적 응답을 음성으로 합성합니다.
	 */
	private Mono<Void> synthesizeSpeech(PipelineState state) {
		return Mono.defer(() -> {
			if (!state.tryTransitionTo(PipelineStage.TTS_SYNTHESIS)) {
				return Mono.empty();
			}
			VoicePipelineProperties.Tts tts = properties.getTts();
			VoiceSettings voice = state.getVoiceSettings()
				.orElseGet(() -> new VoiceSettings(tts.getDefaultVoice(), tts.getDefaultSpeed()));
			SynthesisRequest request = new SynthesisRequest(state.getCurrentResponse(),
				voice.voice(),
				voice.speed());

			return circuitBreakerManager.getBreaker(TTS_SERVICE)
				.execute(() -> speechSynthesisPort.openStream(request),
					error -> ttsFallback(state, error))
				.flatMap(audio -> streamAudio(state, audio));
		});
	}

	private Mono<Flux<byte[]>> ttsFallback(PipelineState state, Throwable cause) {
		return Mono.defer(() -> {
			log.warn("TTS 서비스 사용 불가, 텍스트 응답으로 완료: pipelineId={}, cause={}",
				state.getId(),
				cause.getMessage());
			if (state.tryTransitionTo(PipelineStage.COMPLETED)) {
				completePipeline(state);
			}
			return Mono.empty();
		});
	}

	private Mono<Void> streamAudio(PipelineState state, Flux<byte[]> audio) {
		if (!state.tryTransition(PipelineStage.TTS_SYNTHESIS, PipelineStage.AUDIO_PLAYBACK)) {
			discard(state.getId(), audio);
			return Mono.empty();
		}

		return audio
			.takeWhile(chunk -> state.canProceed())
			.doOnNext(chunk -> {
				state.recordTtsChunk();
				dispatchCallback(state.getId(),
					callbacks -> callbacks.getOnTtsChunk().accept(chunk));
			})
			.then(Mono.<Void>fromRunnable(() -> {
				if (state.tryTransitionTo(PipelineStage.COMPLETED)) {
					completePipeline(state);
				}
			}))
			.onErrorResume(error -> {
				failPipeline(state, error);
				return Mono.empty();
			});
	}

	/**
	 * 파이프라인을 중단합니다. 없거나 이미 종료된 파이프라인이면 아무 동작도 하지 않습니다.
	 */
	public void interruptPipeline(String pipelineId) {
		PipelineState state = activePipelines.get(pipelineId);
		if (state == null) {
			log.debug("중단 대상 파이프라인 없음: {}", pipelineId);
			return;
		}
		if (!state.interrupt()) {
			log.debug("이미 종료된 파이프라인 중단 요청 무시: {}", pipelineId);
			return;
		}

		log.info("파이프라인 중단: {}", pipelineId);
		dispatchCallback(pipelineId, callbacks -> callbacks.getOnInterrupt().run());
		closeRecognition(pipelineId);
		Disposable stream = responseStreams.remove(pipelineId);
		if (stream != null) {
			stream.dispose();
		}
		reportTermination(state);
	}

	/**
	 * 파이프라인을 종료하고 활성 목록에서 제거합니다.
	 *
	 * @return 최종 스냅샷, 파이프라인이 없으면 empty
	 */
	public Optional<PipelineSnapshot> endPipeline(String pipelineId) {
		PipelineState state = activePipelines.remove(pipelineId);
		if (state == null) {
			return Optional.empty();
		}

		RecognitionConnection connection = recognitionConnections.remove(pipelineId);
		if (connection != null && connection.isOpen()) {
			connection.stop();
		}
		Disposable stream = responseStreams.remove(pipelineId);
		if (stream != null) {
			stream.dispose();
		}

		PipelineSnapshot snapshot = state.getSnapshot();
		dispatchCallback(pipelineId, callbacks -> callbacks.getOnEnd().accept(snapshot));
		subscriptions.remove(pipelineId);
		reportTermination(state);

		log.info("파이프라인 종료: pipelineId={}, stage={}", pipelineId, snapshot.stage());
		return Optional.of(snapshot);
	}

	/**
	 * 다운스트림 서비스 상태를 확인합니다. 서킷 브레이커 상태는 참고하지 않습니다.
	 */
	public Mono<Map<String, Boolean>> healthCheck() {
		return serviceHealthPort.probeAll();
	}

	public Optional<PipelineState> getPipelineState(String pipelineId) {
		return Optional.ofNullable(activePipelines.get(pipelineId));
	}

	public List<PipelineState> getActivePipelines() {
		return List.copyOf(activePipelines.values());
	}

	public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
		return circuitBreakerManager.getHealthStatus();
	}

	public void resetCircuitBreakers() {
		circuitBreakerManager.resetAll();
	}

	/**
	 * 모든 연결과 스트림을 정리합니다. 파이프라인 상태는 보존되지 않습니다.
	 */
	@PreDestroy
	public void shutdown() {
		log.info("오케스트레이터 종료: 활성 파이프라인 {}개 폐기", activePipelines.size());
		recognitionConnections.values().forEach(RecognitionConnection::close);
		recognitionConnections.clear();
		responseStreams.values().forEach(Disposable::dispose);
		responseStreams.clear();
		activePipelines.clear();
		subscriptions.clear();
	}

	private void completePipeline(PipelineState state) {
		log.info("파이프라인 완료: pipelineId={}, totalLatency={}ms",
			state.getId(),
			state.getMetrics().totalLatency());
		dispatchCallback(state.getId(), callbacks -> callbacks.getOnComplete().accept(state));
		reportTermination(state);
	}

	private void failPipeline(PipelineState state, Throwable error) {
		if (!state.setError(error)) {
			log.debug("이미 종료된 파이프라인 오류 무시: pipelineId={}, error={}",
				state.getId(),
				error.getMessage());
			return;
		}
		log.error("파이프라인 오류: {}", state.getId(), error);
		dispatchCallback(state.getId(), callbacks -> callbacks.getOnError().accept(error));
		closeRecognition(state.getId());
		reportTermination(state);
	}

	private void closeRecognition(String pipelineId) {
		RecognitionConnection connection = recognitionConnections.remove(pipelineId);
		if (connection != null && connection.isOpen()) {
			connection.close();
		}
	}

	private void reportTermination(PipelineState state) {
		if (state.markTerminationReported()) {
			eventPublisher.publishEvent(new PipelineTerminatedEvent(state));
		}
	}

	private void dispatchCallback(String pipelineId, Consumer<PipelineCallbacks> action) {
		PipelineCallbacks callbacks = subscriptions.get(pipelineId);
		if (callbacks == null) {
			return;
		}
		try {
			action.accept(callbacks);
		} catch (RuntimeException e) {
			log.error("파이프라인 {} 구독자 처리 실패", pipelineId, e);
		}
	}

	private void discard(String pipelineId, Flux<?> body) {
		body.subscribe(ignored -> {
		}, error -> log.debug("폐기된 응답 본문 오류: pipelineId={}, error={}",
			pipelineId,
			error.getMessage())).dispose();
	}

	/**
	 * 파이프라인 하나의 음성 인식 메시지를 처리합니다.
	 */
	private final class PipelineRecognitionListener implements RecognitionListener {

		private final String pipelineId;

		private PipelineRecognitionListener(String pipelineId) {
			this.pipelineId = pipelineId;
		}

		@Override
		public void onTranscript(RecognitionTranscript transcript) {
			PipelineState state = activePipelines.get(pipelineId);
			if (state == null || !state.canProceed()) {
				return;
			}

			if (!transcript.isFinal()) {
				state.updateTranscript(transcript.text(), false);
				dispatchCallback(pipelineId,
					callbacks -> callbacks.getOnTranscriptPartial().accept(transcript.text()));
				return;
			}

			if (state.getStage() != PipelineStage.ASR_PROCESSING) {
				log.debug("추가 최종 전사 무시: pipelineId={}, stage={}", pipelineId, state.getStage());
				return;
			}
			dispatchCallback(pipelineId,
				callbacks -> callbacks.getOnTranscriptFinal().accept(transcript.text()));

			Disposable stream = processFinalTranscript(pipelineId, transcript.text())
				.doFinally(signal -> responseStreams.remove(pipelineId))
				.subscribe();
			if (!stream.isDisposed()) {
				responseStreams.put(pipelineId, stream);
			}
		}

		@Override
		public void onStatus(String status) {
			log.debug("음성 인식 상태: pipelineId={}, status={}", pipelineId, status);
		}

		@Override
		public void onError(Throwable error) {
			PipelineState state = activePipelines.get(pipelineId);
			if (state != null) {
				failPipeline(state, error);
			}
		}

		@Override
		public void onClosed() {
			recognitionConnections.remove(pipelineId);
			log.debug("음성 인식 연결 종료: {}", pipelineId);
		}
	}
}
