package net.gridcollate.exception;

import java.nio.file.Path;

/**
 * The input root is missing or cannot be listed.
 * FATAL: there is nothing to collate.
 */
public class InputTreeException extends CollateException {

    public InputTreeException(Path root, String reason, Throwable cause) {
        super("Input tree " + root + " is not usable: " + reason, true, cause);
    }
}
