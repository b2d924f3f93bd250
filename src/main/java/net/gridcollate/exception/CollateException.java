package net.gridcollate.exception;

/**
 * Base type for failures raised while collating an image tree into grid batches.
 *
 * <p>Subclasses state whether the failure is recovered locally (per image or per
 * subcategory) or aborts the whole run.</p>
 */
public class CollateException extends RuntimeException {

    private final boolean fatal;

    public CollateException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    /** Whether the run must stop when this failure surfaces. */
    public boolean isFatal() {
        return fatal;
    }
}
