package com.psl.orchestrator.quality;

import java.util.Locale;

public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
