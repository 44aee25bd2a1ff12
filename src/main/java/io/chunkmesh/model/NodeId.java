package io.chunkmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Fixed-width (16 byte) identifier of a mesh peer. Human-readable node names map onto a
 * deterministic name-based UUID so every node derives the same id for the same name.
 */
public record NodeId(UUID value) {
    public NodeId {
        Objects.requireNonNull(value, "value");
    }

    public static NodeId random() {
        return new NodeId(UUID.randomUUID());
    }

    public static NodeId of(String nameOrUuid) {
        if (nameOrUuid == null || nameOrUuid.isBlank()) {
            throw new IllegalArgumentException("Node id must not be blank");
        }
        String trimmed = nameOrUuid.trim();
        try {
            return new NodeId(UUID.fromString(trimmed));
        } catch (IllegalArgumentException notUuid) {
            return new NodeId(UUID.nameUUIDFromBytes(("chunkmesh-node:" + trimmed).getBytes(StandardCharsets.UTF_8)));
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }
}
