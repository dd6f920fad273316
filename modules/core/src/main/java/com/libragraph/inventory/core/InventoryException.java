package com.libragraph.inventory.core;

/**
 * Base class for failures surfaced by inventory resolution and scanning.
 */
public abstract class InventoryException extends RuntimeException {

    protected InventoryException(String message) {
        super(message);
    }

    protected InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
