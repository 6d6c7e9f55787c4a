package com.example.campaign.delivery.transport;

public enum PushOutcome {
    DELIVERED,
    /** The subscription no longer exists; the subscriber must be deactivated. */
    GONE,
    /** The message itself was refused; retrying will not help. */
    REJECTED,
    TRANSIENT
}
