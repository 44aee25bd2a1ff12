package io.chunkmesh.codec;

/**
 * A frame that cannot be decoded or is inconsistent with its transfer (index out of range,
 * disagreeing chunk count, truncated envelope). Receivers log and drop such frames.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
