package org.sporkfed.syncengine.service;

/**
 * The sync branch could not be based on the default branch because its tip could not be read.
 */
public class BranchResetException extends RuntimeException {

    public BranchResetException(String message, Throwable cause) {
        super(message, cause);
    }
}
