package com.study.webflux.voice.infrastructure.monitoring.config;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.study.webflux.voice.application.monitoring.service.LatencyMonitor;
import com.study.webflux.voice.application.orchestration.event.PipelineStartedEvent;
import com.study.webflux.voice.application.orchestration.event.PipelineTerminatedEvent;

/**
 * 파이프라인 수명 주기 이벤트를 수신하여 지연 모니터링을 시작/종료합니다.
 */
@Component
public class LatencyMonitoringEventListener {

	private final LatencyMonitor latencyMonitor;

	public LatencyMonitoringEventListener(LatencyMonitor latencyMonitor) {
		this.latencyMonitor = latencyMonitor;
	}

	@EventListener
	public void handleStarted(PipelineStartedEvent event) {
		latencyMonitor.startMonitoring(event.pipelineId(), event.sessionId());
	}

	@EventListener
	public void handleTerminated(PipelineTerminatedEvent event) {
		latencyMonitor.stopMonitoring(event.state());
	}
}
