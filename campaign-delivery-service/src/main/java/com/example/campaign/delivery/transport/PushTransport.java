package com.example.campaign.delivery.transport;

import com.example.campaign.shared.model.Subscriber;

/**
 * Sends one notification to one subscription. Implementations classify every failure into a
 * {@link PushResult} rather than throwing.
 */
public interface PushTransport {

    PushResult send(Subscriber subscriber, PushPayload payload);
}
