package com.whatshouldido.service.suggestion;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class StageObservation {

    public enum Outcome { SUCCESS, DEGRADED, SKIPPED, FAILED }

    private PipelineStage stage;
    private long durationMs;
    private Outcome outcome;
}
