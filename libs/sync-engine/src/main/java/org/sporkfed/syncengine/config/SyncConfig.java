package org.sporkfed.syncengine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncConfig(
        String version,
        List<SyncRule> rules
) {
    public static final String VERSION_1 = "1";

    public SyncConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static SyncConfig empty() {
        return new SyncConfig(VERSION_1, List.of());
    }
}
