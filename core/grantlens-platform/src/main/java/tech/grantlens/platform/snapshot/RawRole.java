package tech.grantlens.platform.snapshot;

import java.util.Objects;

/**
 * A role as captured by the collector.
 */
public record RawRole(String name) {

    public RawRole {
        Objects.requireNonNull(name, "name must not be null");
    }
}
