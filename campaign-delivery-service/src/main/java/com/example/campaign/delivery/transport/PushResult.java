package com.example.campaign.delivery.transport;

import lombok.Value;

@Value
public class PushResult {

    PushOutcome outcome;
    String detail;

    public static PushResult delivered() {
        return new PushResult(PushOutcome.DELIVERED, null);
    }

    public static PushResult gone(String detail) {
        return new PushResult(PushOutcome.GONE, detail);
    }

    public static PushResult rejected(String detail) {
        return new PushResult(PushOutcome.REJECTED, detail);
    }

    public static PushResult transientFailure(String detail) {
        return new PushResult(PushOutcome.TRANSIENT, detail);
    }
}
