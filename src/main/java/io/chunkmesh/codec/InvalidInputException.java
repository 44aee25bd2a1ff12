package io.chunkmesh.codec;

/**
 * A fragmentation request that can never succeed (non-positive MTU, empty payload, too many
 * chunks). Fatal to the single call; never retried.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
