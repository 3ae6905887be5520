package com.study.webflux.voice.infrastructure.pipeline.adapter.llm;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.pipeline.model.LlmStreamEvent;
import reactor.core.publisher.Flux;

/**
 * LLM 라우터의 {@code data: {...}} 줄 단위 스트림을 이벤트로 해석합니다.
 *
 * <p>
 * 네트워크 청크 경계는 줄 경계와 무관하므로 구독마다 부분 줄 버퍼를 유지하며 바이트 단위로 줄을 나눕니다. 멀티바이트 UTF-8 문자가
 * 청크 사이에서 잘려도 안전합니다. 해석할 수 없는 줄은 로그를 남기고 건너뜁니다.
 */
@Slf4j
public class SseEventDecoder {

	private static final String DATA_PREFIX = "data:";
	private static final String DONE_SENTINEL = "[DONE]";

	private final ObjectMapper objectMapper;

	public SseEventDecoder(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 바이트 청크를 이벤트 시퀀스로 변환합니다. 원본 Flux가 한 번만 구독 가능하면 결과도 마찬가지입니다.
	 */
	public Flux<LlmStreamEvent> decode(Flux<byte[]> chunks) {
		return lines(chunks).concatMapIterable(this::parseLine);
	}

	/**
	 * 바이트 청크를 완성된 줄로 변환합니다. 스트림 끝의 개행 없는 줄도 내보냅니다.
	 */
	public Flux<String> lines(Flux<byte[]> chunks) {
		return Flux.defer(() -> {
			LineBuffer buffer = new LineBuffer();
			return chunks.concatMapIterable(buffer::feed)
				.concatWith(Flux.defer(() -> Flux.fromIterable(buffer.flush())));
		});
	}

	List<LlmStreamEvent> parseLine(String line) {
		if (!line.startsWith(DATA_PREFIX)) {
			return List.of();
		}
		String data = line.substring(DATA_PREFIX.length()).trim();
		if (data.isEmpty() || DONE_SENTINEL.equals(data)) {
			return List.of();
		}

		try {
			StreamPayload payload = objectMapper.readValue(data, StreamPayload.class);
			return List.of(new LlmStreamEvent(payload.content(),
				Boolean.TRUE.equals(payload.done()),
				payload.sources(),
				payload.citations(),
				payload.grounding()));
		} catch (JsonProcessingException e) {
			log.error("LLM 스트림 줄 해석 실패, 건너뜀: {}", data, e);
			return List.of();
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record StreamPayload(
		String content,
		Boolean done,
		List<Map<String, Object>> sources,
		List<String> citations,
		Map<String, Object> grounding
	) {
	}

	/**
	 * 구독 하나의 부분 줄 상태입니다.
	 */
	private static final class LineBuffer {

		private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

		List<String> feed(byte[] chunk) {
			List<String> lines = new ArrayList<>();
			for (byte b : chunk) {
				if (b == '\n') {
					lines.add(drain());
				} else {
					pending.write(b);
				}
			}
			return lines;
		}

		List<String> flush() {
			if (pending.size() == 0) {
				return List.of();
			}
			return List.of(drain());
		}

		private String drain() {
			String line = pending.toString(StandardCharsets.UTF_8);
			pending.reset();
			if (line.endsWith("\r")) {
				return line.substring(0, line.length() - 1);
			}
			return line;
		}
	}
}
