package org.sporkfed.syncengine.model;

import java.util.List;

public record PushProcessingResult(
        boolean processed,
        String message,
        List<RuleOutcome> outcomes
) {
    public static PushProcessingResult ignored(String message) {
        return new PushProcessingResult(false, message, List.of());
    }

    public static PushProcessingResult processed(List<RuleOutcome> outcomes) {
        return new PushProcessingResult(true, "Processed " + outcomes.size() + " rule(s)", List.copyOf(outcomes));
    }

    public long count(RuleOutcome outcome) {
        return outcomes.stream().filter(o -> o == outcome).count();
    }
}
