package com.autonomous.orchestrator.workflow;

import java.util.OptionalDouble;

@FunctionalInterface
public interface QualityProbe {

    QualityProbe NONE = iteration -> OptionalDouble.empty();

    OptionalDouble measureCoverage(int iteration);
}
