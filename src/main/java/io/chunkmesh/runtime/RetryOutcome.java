package io.chunkmesh.runtime;

import io.chunkmesh.model.TransferId;

import java.util.List;

public record RetryOutcome(List<TransferId> retried, int framesWritten, List<TransferId> abandoned) {

    public static RetryOutcome empty() {
        return new RetryOutcome(List.of(), 0, List.of());
    }
}
