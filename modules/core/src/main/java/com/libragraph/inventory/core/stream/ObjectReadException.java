package com.libragraph.inventory.core.stream;

import java.io.IOException;

/**
 * An I/O failure of the object body itself, as opposed to a decoding error
 * raised by a codec sitting on top of it.
 */
class ObjectReadException extends IOException {

    ObjectReadException(IOException cause) {
        super(cause.getMessage(), cause);
    }

    /** True when {@code e} or one of its causes came from the object body. */
    static boolean isTransport(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ObjectReadException) {
                return true;
            }
        }
        return false;
    }
}
