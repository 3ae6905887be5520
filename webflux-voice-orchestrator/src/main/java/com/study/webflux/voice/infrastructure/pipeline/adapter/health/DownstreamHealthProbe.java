package com.study.webflux.voice.infrastructure.pipeline.adapter.health;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.voice.domain.pipeline.port.ServiceHealthPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 다운스트림 서비스의 {@code GET /healthz}를 병렬로 확인합니다. 2xx 응답만 정상으로 봅니다.
 */
@Slf4j
public class DownstreamHealthProbe implements ServiceHealthPort {

	private final WebClient webClient;
	private final Map<String, String> serviceUrls;
	private final Duration timeout;

	/**
	 * @param serviceUrls
	 *            서비스 이름별 기본 URL. 결과 맵은 이 순서를 따릅니다.
	 */
	public DownstreamHealthProbe(WebClient.Builder webClientBuilder,
		Map<String, String> serviceUrls,
		Duration timeout) {
		this.webClient = webClientBuilder.clone().build();
		this.serviceUrls = new LinkedHashMap<>(serviceUrls);
		this.timeout = timeout;
	}

	@Override
	public Mono<Map<String, Boolean>> probeAll() {
		return Flux.fromIterable(serviceUrls.entrySet())
			.flatMap(entry -> probe(entry.getValue())
				.map(healthy -> Map.entry(entry.getKey(), healthy)))
			.collectMap(Map.Entry::getKey, Map.Entry::getValue)
			.map(results -> {
				Map<String, Boolean> ordered = new LinkedHashMap<>();
				serviceUrls.keySet().forEach(name -> ordered.put(name, results.getOrDefault(name, false)));
				return ordered;
			});
	}

	private Mono<Boolean> probe(String baseUrl) {
		return webClient.get()
			.uri(baseUrl + "/healthz")
			.retrieve()
			.toBodilessEntity()
			.map(response -> response.getStatusCode().is2xxSuccessful())
			.timeout(timeout)
			.onErrorResume(error -> {
				log.warn("헬스 체크 실패: url={}, error={}", baseUrl, error.getMessage());
				return Mono.just(false);
			});
	}
}
