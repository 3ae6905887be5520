package com.study.webflux.voice.infrastructure.pipeline.adapter.asr;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.pipeline.model.RecognitionRequest;
import com.study.webflux.voice.domain.pipeline.model.RecognitionTranscript;
import com.study.webflux.voice.domain.pipeline.port.RecognitionConnection;
import com.study.webflux.voice.domain.pipeline.port.RecognitionException;
import com.study.webflux.voice.domain.pipeline.port.RecognitionListener;
import com.study.webflux.voice.domain.pipeline.port.SpeechRecognitionPort;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 음성 인식 게이트웨이 스트리밍 WebSocket 어댑터
 *
 * <p>
 * 연결이 열리면 {@code {action:"start", languageCode, sampleRate}} 제어 프레임을 보내고, 이후 오디오는 바이너리
 * 프레임으로 전달합니다. 서버 프레임은 다음과 같이 처리합니다.
 * <ul>
 * <li>transcript: 부분/최종 전사 전달</li>
 * <li>status: 상태 로그</li>
 * <li>error: {@link RecognitionException}으로 전달</li>
 * </ul>
 * 해석할 수 없는 프레임은 로그를 남기고 건너뜁니다. 게이트웨이가 정상(1000) 또는 going away(1001) 이외의
 * 코드로 연결을 닫으면 {@link RecognitionException}을 전달한 뒤 연결 종료를 알립니다.
 */
@Slf4j
public class AsrGatewayWebSocketAdapter implements SpeechRecognitionPort {

	private static final Duration CLOSE_STATUS_TIMEOUT = Duration.ofSeconds(1);

	private final WebSocketClient webSocketClient;
	private final URI streamUri;
	private final ObjectMapper objectMapper;

	public AsrGatewayWebSocketAdapter(WebSocketClient webSocketClient, String gatewayUrl,
		String path, ObjectMapper objectMapper) {
		this.webSocketClient = webSocketClient;
		this.streamUri = URI.create(toWebSocketUrl(gatewayUrl) + path);
		this.objectMapper = objectMapper;
	}

	static String toWebSocketUrl(String httpUrl) {
		if (httpUrl.startsWith("https://")) {
			return "wss://" + httpUrl.substring("https://".length());
		}
		if (httpUrl.startsWith("http://")) {
			return "ws://" + httpUrl.substring("http://".length());
		}
		return httpUrl;
	}

	@Override
	public Mono<RecognitionConnection> connect(RecognitionRequest request,
		RecognitionListener listener) {
		return Mono.defer(() -> {
			Sinks.One<RecognitionConnection> opened = Sinks.one();
			AsrGatewayConnection connection = new AsrGatewayConnection(request.pipelineId(),
				objectMapper);
			AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

			Disposable session = webSocketClient.execute(streamUri, webSocketSession -> {
				Map<String, Object> start = new LinkedHashMap<>();
				start.put("action", "start");
				start.put("languageCode", request.languageCode());
				start.put("sampleRate", request.sampleRate());
				connection.sendControl(start);
				connection.markOpen();
				opened.tryEmitValue(connection);

				Mono<Void> outbound = webSocketSession
					.send(connection.frames().map(frame -> frame.toMessage(webSocketSession)))
					.then(webSocketSession.close());
				Mono<Void> inbound = webSocketSession.receive()
					.filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
					.map(WebSocketMessage::getPayloadAsText)
					.doOnNext(payload -> dispatch(request.pipelineId(), payload, listener))
					.doFinally(signal -> connection.close())
					.then();
				Mono<Void> closed = webSocketSession.closeStatus()
					.timeout(CLOSE_STATUS_TIMEOUT, Mono.empty())
					.doOnNext(closeStatus::set)
					.then();
				return Mono.when(outbound, inbound).then(closed);
			}).subscribe(ignored -> {
			}, error -> {
				connection.close();
				RecognitionException failure = new RecognitionException(
					"Recognition connection failed: " + error.getMessage(), error);
				if (opened.tryEmitError(failure).isFailure()) {
					listener.onError(failure);
				}
			}, () -> {
				connection.close();
				if (opened.tryEmitError(new RecognitionException(
					"Recognition connection closed before opening")).isSuccess()) {
					return;
				}
				CloseStatus status = closeStatus.get();
				if (status != null && !isNormalClosure(status)) {
					log.error("음성 인식 연결 비정상 종료: pipelineId={}, code={}, reason={}",
						request.pipelineId(),
						status.getCode(),
						status.getReason());
					listener.onError(new RecognitionException(
						"Recognition connection closed abnormally: code=" + status.getCode()
							+ (status.getReason() == null ? "" : ", reason=" + status.getReason())));
				}
				listener.onClosed();
			});

			return opened.asMono().doOnCancel(session::dispose);
		});
	}

	static boolean isNormalClosure(CloseStatus status) {
		return status.getCode() == CloseStatus.NORMAL.getCode()
			|| status.getCode() == CloseStatus.GOING_AWAY.getCode();
	}

	private void dispatch(String pipelineId, String payload, RecognitionListener listener) {
		AsrServerMessage message;
		try {
			message = objectMapper.readValue(payload, AsrServerMessage.class);
		} catch (JsonProcessingException e) {
			log.error("음성 인식 프레임 해석 실패, 건너뜀: pipelineId={}, payload={}", pipelineId, payload, e);
			return;
		}

		try {
			switch (message.type() == null ? "" : message.type()) {
				case "transcript" -> {
					if (message.transcript() != null) {
						listener.onTranscript(new RecognitionTranscript(message.transcript(),
							message.isFinal(),
							message.confidence()));
					}
				}
				case "status" -> listener.onStatus(message.status());
				case "error" -> listener.onError(new RecognitionException(message.errorMessage()));
				default -> log.debug("알 수 없는 음성 인식 프레임: pipelineId={}, type={}",
					pipelineId,
					message.type());
			}
		} catch (RuntimeException e) {
			log.error("음성 인식 메시지 처리 실패: pipelineId={}", pipelineId, e);
		}
	}
}
