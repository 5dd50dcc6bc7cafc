package com.buildsync.client;

/**
 * Thrown when a build project API call fails: a non-2xx status, an I/O error, or a response body
 * that lacks the expected content. {@link #getStatusCode()} is {@code -1} when no response was received.
 */
public final class BuildApiException extends RuntimeException {

    private final String method;
    private final String uri;
    private final int statusCode;
    private final String responseBody;

    public BuildApiException(String method, String uri, int statusCode, String responseBody) {
        super(String.format("%s %s failed with status %d: %s", method, uri, statusCode, responseBody));
        this.method = method;
        this.uri = uri;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public BuildApiException(String method, String uri, String message, Throwable cause) {
        super(String.format("%s %s failed: %s", method, uri, message), cause);
        this.method = method;
        this.uri = uri;
        this.statusCode = -1;
        this.responseBody = null;
    }

    public String getMethod() {
        return method;
    }

    public String getUri() {
        return uri;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
