package com.ivamare.interactions.exception;

/**
 * Thrown when the follow-up webhook endpoint rejects a delivery.
 */
public class FollowupDeliveryException extends InteractionsException {

    private final int statusCode;
    private final String responseBody;

    public FollowupDeliveryException(int statusCode, String responseBody) {
        super("Follow-up delivery failed with status " + statusCode
            + (responseBody != null && !responseBody.isBlank() ? ": " + responseBody : ""));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
