package io.chunkmesh.runtime;

import io.chunkmesh.model.TransferId;

public record SendOutcome(TransferId transferId, int totalChunks, int framesWritten) {
}
