package com.example.campaign.delivery.transport;

/**
 * The gateway could not be reached, timed out or answered 5xx. Counted by the circuit breaker.
 */
public class PushGatewayUnavailableException extends RuntimeException {

    public PushGatewayUnavailableException(String message) {
        super(message);
    }

    public PushGatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
