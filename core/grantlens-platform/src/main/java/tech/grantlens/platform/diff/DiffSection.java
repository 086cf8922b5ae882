package tech.grantlens.platform.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Differences for one entity category.
 *
 * @param added entities only in the newer snapshot, in its declaration order
 * @param removed entities only in the older snapshot, in its declaration order
 * @param modified entities in both with different contents, in the older snapshot's order
 */
public record DiffSection<T>(List<T> added, List<T> removed, List<ModifiedEntry<T>> modified) {

    public DiffSection {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        modified = List.copyOf(modified);
    }

    @JsonProperty("added_count")
    public int addedCount() {
        return added.size();
    }

    @JsonProperty("removed_count")
    public int removedCount() {
        return removed.size();
    }

    @JsonProperty("modified_count")
    public int modifiedCount() {
        return modified.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }
}
