package io.instree.codec;

/** A tree document that cannot be represented as a valid {@link io.instree.core.InstanceTree}. */
public final class TreeFormatException extends RuntimeException {

    public TreeFormatException(String message) {
        super(message);
    }

    public TreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
