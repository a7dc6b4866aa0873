package edu.virginia.lib.dataone.inventory;

/**
 * Thrown when an inventory, or the part of it a call would operate on, is not in a
 * state that can be processed: missing columns, a package without exactly one metadata
 * record, child packages that have not been created yet.  Nothing has been modified when
 * this is thrown.
 */
public class InventoryValidationException extends RuntimeException {

    public InventoryValidationException(String message) {
        super(message);
    }

    public InventoryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
