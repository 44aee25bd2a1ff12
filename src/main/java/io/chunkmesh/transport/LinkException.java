package io.chunkmesh.transport;

import java.io.IOException;

/**
 * A link write or read failed. Transient from the engine's point of view: the frame stays
 * unacknowledged and the normal retry path re-emits it.
 */
public class LinkException extends IOException {

    public LinkException(String message) {
        super(message);
    }

    public LinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
