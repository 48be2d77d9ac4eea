package com.fieldpilot.lifecycle.recurrence;

/** Counts from one generator pass (one series or all of them). */
public record GenerationSummary(int seriesProcessed, int instancesCreated, int duplicatesSkipped,
                                int jobsMaterialized, int seriesFailed) {

    public static GenerationSummary empty() {
        return new GenerationSummary(0, 0, 0, 0, 0);
    }

    public GenerationSummary plus(GenerationSummary other) {
        return new GenerationSummary(
                seriesProcessed + other.seriesProcessed,
                instancesCreated + other.instancesCreated,
                duplicatesSkipped + other.duplicatesSkipped,
                jobsMaterialized + other.jobsMaterialized,
                seriesFailed + other.seriesFailed);
    }
}
