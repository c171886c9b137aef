package org.sporkfed.vcsclient.github;

import org.sporkfed.vcsclient.VcsClientException;

public class GitHubException extends VcsClientException {

    private final String operation;
    private final int statusCode;
    private final String responseBody;

    public GitHubException(String message) {
        super(message);
        this.operation = null;
        this.statusCode = -1;
        this.responseBody = null;
    }

    public GitHubException(String operation, int statusCode, String responseBody) {
        super(String.format("GitHub API error during %s: HTTP %d - %s", operation, statusCode, responseBody));
        this.operation = operation;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    /**
     * GitHub answers 422 for validation failures, including an already open pull request
     * for the same head and base, and a reference that already exists.
     */
    public boolean isUnprocessable() {
        return statusCode == 422;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isRateLimited() {
        return statusCode == 403 && responseBody != null && responseBody.contains("rate limit");
    }
}
