package com.study.webflux.voice.domain.pipeline.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 음성 세션 하나의 파이프라인 상태입니다.
 *
 * <p>
 * 단계, 누적 전사/응답 텍스트, 대화 이력, 검색 컨텍스트, 타이밍 지표를 보관합니다. 모든 변경은 인스턴스 모니터로 직렬화되며 비동기
 * 후속 작업은 {@link #canProceed()}로 취소 여부를 확인해야 합니다.
 *
 * <h3>지연 측정</h3>
 * <ul>
 * <li>ASR_PROCESSING 진입: 파이프라인 시작부터 경과 시간 (audioToAsr)</li>
 * <li>LLM_PROCESSING 진입: ASR 단계 진입부터 경과 시간 (asrToLlm)</li>
 * <li>TTS_SYNTHESIS 진입: LLM 단계 진입부터 경과 시간 (llmToTts)</li>
 * <li>AUDIO_PLAYBACK 진입: TTS 단계 진입부터 경과 시간 (ttsToClient)</li>
 * <li>COMPLETED 진입: 파이프라인 시작부터 경과 시간 (total)</li>
 * </ul>
 */
public class PipelineState {

	private final String id;
	private final String sessionId;
	private final String userId;
	private final Clock clock;
	private final Instant startTime;

	private PipelineStage stage = PipelineStage.IDLE;
	private Instant stageEnteredAt;
	private final List<StageTransition> stageHistory = new ArrayList<>();

	private final List<ConversationMessage> history = new ArrayList<>();
	private String currentTranscript = "";
	private String currentResponse = "";
	private RetrievalContext retrievalContext;
	private Map<String, Object> grounding = Map.of();
	private String intent;
	private VoiceSettings voiceSettings;

	private Long audioToAsrLatency;
	private Long asrToLlmLatency;
	private Long llmToTtsLatency;
	private Long ttsToClientLatency;
	private Long firstTokenLatency;
	private Long totalLatency;
	private int asrPartialCount;
	private int llmTokenCount;
	private int ttsChunkCount;

	private boolean interrupted;
	private Throwable error;
	private final AtomicBoolean terminationReported = new AtomicBoolean();

	public PipelineState(String sessionId, String userId, Clock clock) {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId cannot be blank");
		}
		if (userId == null || userId.isBlank()) {
			throw new IllegalArgumentException("userId cannot be blank");
		}
		this.sessionId = sessionId;
		this.userId = userId;
		this.clock = clock;
		this.startTime = clock.instant();
		this.stageEnteredAt = startTime;
		this.id = "pipeline-" + sessionId + "-" + startTime.toEpochMilli();
	}

	/**
	 * 대상 단계로 전이하고 해당 경계의 지연을 기록합니다.
	 *
	 * @throws IllegalStateException 종료 단계이거나 허용되지 않은 전이인 경우
	 */
	public synchronized void transitionTo(PipelineStage target) {
		if (stage.isTerminal()) {
			throw new IllegalStateException(
				"Pipeline " + id + " is already terminal (" + stage + ")");
		}
		if (!stage.canAdvanceTo(target)) {
			throw new IllegalStateException(
				"Illegal transition " + stage + " -> " + target + " for pipeline " + id);
		}

		Instant now = clock.instant();
		PipelineStage previous = stage;
		stageHistory.add(new StageTransition(previous, now));

		switch (target) {
			case ASR_PROCESSING -> audioToAsrLatency = elapsed(startTime, now);
			case LLM_PROCESSING -> asrToLlmLatency = elapsed(stageEnteredAt, now);
			case TTS_SYNTHESIS -> llmToTtsLatency = elapsed(stageEnteredAt, now);
			case AUDIO_PLAYBACK -> ttsToClientLatency = elapsed(stageEnteredAt, now);
			case COMPLETED -> totalLatency = elapsed(startTime, now);
			default -> {
			}
		}

		stage = target;
		stageEnteredAt = now;
	}

	/**
	 * 진행 가능한 경우에만 전이합니다.
	 *
	 * @return 전이했으면 true, 이미 중단/종료되었으면 false
	 */
	public synchronized boolean tryTransitionTo(PipelineStage target) {
		if (!canProceed()) {
			return false;
		}
		transitionTo(target);
		return true;
	}

	/**
	 * 현재 단계가 기대 단계와 같을 때만 전이합니다.
	 */
	public synchronized boolean tryTransition(PipelineStage expected, PipelineStage target) {
		if (stage != expected || !canProceed()) {
			return false;
		}
		transitionTo(target);
		return true;
	}

	/** 첫 토큰 지연을 한 번만 기록합니다. */
	public synchronized void markFirstToken() {
		if (firstTokenLatency == null) {
			firstTokenLatency = elapsed(startTime, clock.instant());
		}
	}

	public synchronized boolean canProceed() {
		return !interrupted && stage != PipelineStage.ERROR && stage != PipelineStage.COMPLETED;
	}

	/**
	 * 파이프라인을 중단 상태로 만듭니다.
	 *
	 * @return 이번 호출로 중단되었으면 true
	 */
	public synchronized boolean interrupt() {
		if (stage.isTerminal()) {
			return false;
		}
		stageHistory.add(new StageTransition(stage, clock.instant()));
		interrupted = true;
		stage = PipelineStage.INTERRUPTED;
		stageEnteredAt = clock.instant();
		return true;
	}

	/**
	 * 파이프라인을 오류 상태로 만듭니다. 먼저 기록된 종료 원인이 유지됩니다.
	 *
	 * @return 이번 호출로 오류 상태가 되었으면 true
	 */
	public synchronized boolean setError(Throwable cause) {
		if (stage.isTerminal()) {
			return false;
		}
		stageHistory.add(new StageTransition(stage, clock.instant()));
		error = cause;
		stage = PipelineStage.ERROR;
		stageEnteredAt = clock.instant();
		return true;
	}

	public synchronized void updateTranscript(String transcript, boolean isFinal) {
		currentTranscript = transcript == null ? "" : transcript;
		if (!isFinal) {
			asrPartialCount++;
		}
	}

	public synchronized void appendResponse(String chunk) {
		currentResponse = currentResponse + chunk;
		llmTokenCount++;
	}

	public synchronized void recordTtsChunk() {
		ttsChunkCount++;
	}

	public synchronized void addToHistory(MessageRole role, String content) {
		history.add(new ConversationMessage(role, content, clock.instant()));
	}

	public synchronized void setRetrievalContext(List<Map<String, Object>> documents,
		List<String> citations) {
		retrievalContext = new RetrievalContext(documents, citations);
	}

	public synchronized void setGrounding(Map<String, Object> grounding) {
		this.grounding = grounding == null
			? Map.of()
			: Collections.unmodifiableMap(new LinkedHashMap<>(grounding));
	}

	public synchronized void setIntent(String intent) {
		this.intent = intent;
	}

	public synchronized void setVoiceSettings(VoiceSettings voiceSettings) {
		this.voiceSettings = voiceSettings;
	}

	public synchronized PipelineMetrics getMetrics() {
		return new PipelineMetrics(startTime,
			audioToAsrLatency,
			asrToLlmLatency,
			llmToTtsLatency,
			ttsToClientLatency,
			firstTokenLatency,
			totalLatency,
			asrPartialCount,
			llmTokenCount,
			ttsChunkCount);
	}

	public synchronized PipelineSnapshot getSnapshot() {
		return new PipelineSnapshot(id,
			sessionId,
			userId,
			stage,
			getMetrics(),
			currentTranscript.length(),
			currentResponse.length(),
			history.size(),
			retrievalContext != null,
			interrupted,
			error == null ? null : error.getMessage(),
			List.copyOf(stageHistory));
	}

	/**
	 * 종료 보고를 한 번만 허용합니다.
	 *
	 * @return 처음 호출된 경우 true
	 */
	public boolean markTerminationReported() {
		return terminationReported.compareAndSet(false, true);
	}

	/**
	 * 최근 대화 이력을 오래된 순서로 반환합니다.
	 */
	public synchronized List<ConversationMessage> recentHistory(int turns) {
		int from = Math.max(0, history.size() - turns);
		return List.copyOf(history.subList(from, history.size()));
	}

	public String getId() {
		return id;
	}

	public String getSessionId() {
		return sessionId;
	}

	public String getUserId() {
		return userId;
	}

	public synchronized PipelineStage getStage() {
		return stage;
	}

	public synchronized boolean isInterrupted() {
		return interrupted;
	}

	public synchronized Optional<Throwable> getError() {
		return Optional.ofNullable(error);
	}

	public synchronized String getCurrentTranscript() {
		return currentTranscript;
	}

	public synchronized String getCurrentResponse() {
		return currentResponse;
	}

	public synchronized List<ConversationMessage> getHistory() {
		return List.copyOf(history);
	}

	public synchronized Optional<RetrievalContext> getRetrievalContext() {
		return Optional.ofNullable(retrievalContext);
	}

	public synchronized Map<String, Object> getGrounding() {
		return grounding;
	}

	public synchronized Optional<String> getIntent() {
		return Optional.ofNullable(intent);
	}

	public synchronized Optional<VoiceSettings> getVoiceSettings() {
		return Optional.ofNullable(voiceSettings);
	}

	private static long elapsed(Instant from, Instant to) {
		return Duration.between(from, to).toMillis();
	}
}
