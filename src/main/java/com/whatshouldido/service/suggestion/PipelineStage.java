package com.whatshouldido.service.suggestion;

/** 추천 파이프라인 단계 (실행 순서대로) */
public enum PipelineStage {
    VALIDATE_INTENT,
    BUILD_CONTEXT,
    ADMIT,
    FETCH_CANDIDATES,
    LOAD_EXCLUSIONS,
    FILTER_BY_INTENT,
    SCORE_AND_PERSONALIZE,
    EXPLAIN,
    BUILD_ROUTE_IF_NEEDED,
    ASSEMBLE
}
