package tech.grantlens.platform.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a risk finding.
 */
public enum RiskLevel {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
