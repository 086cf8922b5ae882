package tech.grantlens.platform.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * JSON (de)serialization of captured raw entities for the snapshot table's jsonb column.
 *
 * Uses the application ObjectMapper, so stored documents carry the same snake_case
 * property names as the API.
 */
@ApplicationScoped
public class RawEntitiesCodec {

    @Inject
    ObjectMapper objectMapper;

    public RawEntitiesCodec() {
    }

    public RawEntitiesCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(RawEntities rawEntities) {
        try {
            return objectMapper.writeValueAsString(rawEntities);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize raw entities", e);
        }
    }

    public RawEntities read(String snapshotId, String json) {
        if (json == null || json.isBlank()) {
            return RawEntities.empty();
        }
        try {
            return objectMapper.readValue(json, RawEntities.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored raw entities of snapshot " + snapshotId + " are not readable", e);
        }
    }
}
