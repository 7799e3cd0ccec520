package com.largomodo.dicomextract.core.workspace;

import java.io.IOException;
import java.util.List;

/**
 * Exception thrown when staged partial files cannot be removed.
 * <p>
 * Accumulates every deletion failure as a suppressed exception so the full cause chain
 * survives into the log.
 */
public class CleanupException extends RuntimeException {

    /**
     * @param message  description of the cleanup context
     * @param failures IOExceptions raised while deleting staged files
     */
    public CleanupException(String message, List<IOException> failures) {
        super(message);
        for (IOException failure : failures) {
            addSuppressed(failure);
        }
    }
}
