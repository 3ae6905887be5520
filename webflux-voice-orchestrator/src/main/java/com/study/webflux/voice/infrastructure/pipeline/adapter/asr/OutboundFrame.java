package com.study.webflux.voice.infrastructure.pipeline.adapter.asr;

import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

/** 전송 대기 중인 제어(텍스트) 또는 오디오(바이너리) 프레임입니다. */
record OutboundFrame(
	String text,
	byte[] audio
) {

	static OutboundFrame control(String json) {
		return new OutboundFrame(json, null);
	}

	static OutboundFrame audio(byte[] audio) {
		return new OutboundFrame(null, audio);
	}

	WebSocketMessage toMessage(WebSocketSession session) {
		if (text != null) {
			return session.textMessage(text);
		}
		return session.binaryMessage(factory -> factory.wrap(audio));
	}
}
