package io.chunkmesh.model;

public enum TransferStatus {
    PENDING,
    FAILED
}
