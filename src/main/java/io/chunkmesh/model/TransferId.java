package io.chunkmesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/**
 * Mesh-wide identifier of one end-to-end binary send. Generated by the originator from a random
 * 128-bit UUID, so independently created ids do not collide.
 */
public record TransferId(UUID value) {
    public TransferId {
        Objects.requireNonNull(value, "value");
    }

    public static TransferId random() {
        return new TransferId(UUID.randomUUID());
    }

    public static TransferId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Transfer id must not be blank");
        }
        return new TransferId(UUID.fromString(raw.trim()));
    }

    public String shortId() {
        return value.toString().substring(0, 8);
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toString();
    }
}
