package org.zeno.runtime;

/**
 * Raised by the runtime bridge when a Zeno program panics or a native primitive fails.
 */
public class ZenoPanicException extends RuntimeException {

    public ZenoPanicException(String message) {
        super(message);
    }

    public ZenoPanicException(String message, Throwable cause) {
        super(message, cause);
    }
}
