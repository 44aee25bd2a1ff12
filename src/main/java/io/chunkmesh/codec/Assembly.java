package io.chunkmesh.codec;

/**
 * Outcome of {@link ChunkCodec#tryAssemble}: either the complete payload or the number of chunk
 * indices still missing.
 */
public record Assembly(boolean complete, byte[] bytes, int missing) {

    public static Assembly complete(byte[] bytes) {
        return new Assembly(true, bytes, 0);
    }

    public static Assembly incomplete(int missing) {
        return new Assembly(false, null, missing);
    }
}
