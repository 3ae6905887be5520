package com.study.webflux.voice.application.streaming;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.UUID;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.application.interruption.service.InterruptionHandler;
import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import reactor.core.publisher.Mono;

/**
 * {@code /stream?sessionId=&userId=} 클라이언트 스트리밍 채널입니다. 텍스트 프레임은 제어 메시지, 바이너리 프레임은 오디오
 * 청크로 처리합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoiceStreamWebSocketHandler implements WebSocketHandler {

	private final PipelineOrchestrator orchestrator;
	private final InterruptionHandler interruptionHandler;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	@Override
	public Mono<Void> handle(WebSocketSession session) {
		MultiValueMap<String, String> params = UriComponentsBuilder
			.fromUri(session.getHandshakeInfo().getUri())
			.build()
			.getQueryParams();
		String userId = decode(params.getFirst("userId"));
		if (userId == null || userId.isBlank()) {
			log.warn("userId 없는 스트리밍 연결 거부: {}", session.getId());
			return session.close(CloseStatus.POLICY_VIOLATION.withReason("Missing userId"));
		}
		String sessionId = decode(params.getFirst("sessionId"));
		if (sessionId == null || sessionId.isBlank()) {
			sessionId = "session-" + UUID.randomUUID();
		}

		StreamingClient client = new StreamingClient(sessionId, userId, orchestrator,
			interruptionHandler, objectMapper, clock);
		log.info("스트리밍 클라이언트 연결: sessionId={}, userId={}", sessionId, userId);
		client.connect();

		Mono<Void> outbound = session
			.send(client.frames().map(frame -> frame.toMessage(session)));
		// 페이로드는 수신 즉시 복사합니다. 대기열에 쌓인 프레임 버퍼는 처리 전에 해제될 수 있습니다.
		Mono<Void> inbound = session.receive()
			.filter(message -> message.getType() == WebSocketMessage.Type.TEXT
				|| message.getType() == WebSocketMessage.Type.BINARY)
			.map(VoiceStreamWebSocketHandler::toFrame)
			.concatMap(frame -> dispatch(client, frame))
			.doOnError(error -> log.error("스트리밍 수신 오류: sessionId={}", client.getSessionId(),
				error))
			.doFinally(signal -> client.disconnect())
			.then();
		return Mono.when(outbound, inbound);
	}

	private static StreamFrame toFrame(WebSocketMessage message) {
		if (message.getType() == WebSocketMessage.Type.TEXT) {
			return StreamFrame.text(message.getPayloadAsText());
		}
		DataBuffer payload = message.getPayload();
		byte[] audio = new byte[payload.readableByteCount()];
		payload.read(audio);
		return StreamFrame.audio(audio);
	}

	private Mono<Void> dispatch(StreamingClient client, StreamFrame frame) {
		if (frame.isAudio()) {
			return client.onAudio(frame.audio());
		}
		client.onText(frame.text());
		return Mono.empty();
	}

	private static String decode(String value) {
		return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
	}
}
