package com.study.webflux.voice.application.orchestration.dto;

import java.util.List;

import com.study.webflux.voice.domain.pipeline.model.PipelineSnapshot;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "활성 파이프라인 목록")
public record ActivePipelinesResponse(
	@Schema(description = "활성 파이프라인 수")
	int count,

	@Schema(description = "파이프라인 스냅샷")
	List<PipelineSnapshot> pipelines
) {
}
