package com.whatshouldido.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionMeta {
    private Instant generatedAt;
    @Builder.Default
    private String source = "IntentOrchestrator";
    private double diversityFactor;
    private boolean usedAI;
    private boolean usedPersonalization;
    private boolean usedContextEngine;
    private boolean usedVariabilityEngine;
    private String timeOfDay;
    private String weather;
    private String season;
}
