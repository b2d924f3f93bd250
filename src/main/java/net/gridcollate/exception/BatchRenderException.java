package net.gridcollate.exception;

import java.nio.file.Path;

/**
 * The primary grid image for a batch could not be written.
 * RECOVERABLE at subcategory level: the batch is abandoned and its images are retried next run.
 */
public class BatchRenderException extends CollateException {

    public BatchRenderException(Path target, Throwable cause) {
        super("Failed to write grid image " + target, false, cause);
    }
}
