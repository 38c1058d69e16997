package io.upgradejourney.client;

/**
 * Exception thrown when the service under test rejects or fails a request.
 */
public class ServiceClientException extends Exception {

    private final int statusCode;

    public ServiceClientException(String message) {
        this(message, -1);
    }

    public ServiceClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ServiceClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when the failure was not an HTTP response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
