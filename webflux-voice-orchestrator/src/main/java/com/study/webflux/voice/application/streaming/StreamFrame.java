package com.study.webflux.voice.application.streaming;

import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

/** 클라이언트와 주고받는 JSON(텍스트) 또는 오디오(바이너리) 프레임입니다. */
public record StreamFrame(
	String text,
	byte[] audio
) {

	public static StreamFrame text(String json) {
		return new StreamFrame(json, null);
	}

	public static StreamFrame audio(byte[] audio) {
		return new StreamFrame(null, audio);
	}

	public boolean isAudio() {
		return audio != null;
	}

	WebSocketMessage toMessage(WebSocketSession session) {
		if (text != null) {
			return session.textMessage(text);
		}
		return session.binaryMessage(factory -> factory.wrap(audio));
	}
}
