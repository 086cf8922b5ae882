package tech.grantlens.platform.diff;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An entity present in both snapshots under the same key but with different contents.
 */
public record ModifiedEntry<T>(
    @JsonProperty("old") T oldValue,
    @JsonProperty("new") T newValue
) {}
