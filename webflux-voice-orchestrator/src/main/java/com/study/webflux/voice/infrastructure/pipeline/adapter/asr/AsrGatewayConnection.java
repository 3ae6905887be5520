package com.study.webflux.voice.infrastructure.pipeline.adapter.asr;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.pipeline.port.RecognitionConnection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 음성 인식 게이트웨이 WebSocket 연결 하나입니다. 전송 프레임은 소켓이 열릴 때까지 싱크에 쌓입니다.
 */
@Slf4j
class AsrGatewayConnection implements RecognitionConnection {

	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	private final String pipelineId;
	private final ObjectMapper objectMapper;
	private final Sinks.Many<OutboundFrame> outbound = Sinks.many().unicast().onBackpressureBuffer();
	private final AtomicBoolean open = new AtomicBoolean();

	AsrGatewayConnection(String pipelineId, ObjectMapper objectMapper) {
		this.pipelineId = pipelineId;
		this.objectMapper = objectMapper;
	}

	@Override
	public void sendAudio(byte[] audio) {
		if (!open.get()) {
			log.debug("닫힌 음성 인식 연결로 오디오 전송 무시: {}", pipelineId);
			return;
		}
		outbound.emitNext(OutboundFrame.audio(audio), Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
	}

	void sendControl(Map<String, Object> control) {
		try {
			String json = objectMapper.writeValueAsString(control);
			outbound.emitNext(OutboundFrame.control(json),
				Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize recognition control frame", e);
		}
	}

	@Override
	public void stop() {
		if (open.get()) {
			sendControl(Map.of("action", "stop"));
		}
		close();
	}

	@Override
	public void close() {
		open.set(false);
		outbound.tryEmitComplete();
	}

	@Override
	public boolean isOpen() {
		return open.get();
	}

	void markOpen() {
		open.set(true);
	}

	Flux<OutboundFrame> frames() {
		return outbound.asFlux();
	}
}
