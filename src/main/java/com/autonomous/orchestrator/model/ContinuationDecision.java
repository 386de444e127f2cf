package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ContinuationDecision {
    public static final String INSUFFICIENT_DATA = "insufficient_data";
    public static final String QUALITY_IMPROVING = "quality_improving";

    private final boolean shouldContinue;
    private final String reason;
}
