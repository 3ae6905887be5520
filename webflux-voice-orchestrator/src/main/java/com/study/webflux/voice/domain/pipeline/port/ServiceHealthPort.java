package com.study.webflux.voice.domain.pipeline.port;

import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * 다운스트림 서비스 상태를 확인합니다.
 */
public interface ServiceHealthPort {

	/** 서비스 이름별 정상 여부를 반환합니다. */
	Mono<Map<String, Boolean>> probeAll();
}
