package org.sporkfed.vcsclient;

/**
 * Base exception for failed calls against a hosting API.
 */
public class VcsClientException extends RuntimeException {

    public VcsClientException(String message) {
        super(message);
    }

    public VcsClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
