package io.workline.core.outbox;

/**
 * Sends one webhook request. Implementations report every failure, timeouts included, as a
 * {@link DeliveryResponse} rather than throwing.
 */
public interface WebhookTransport {
    DeliveryResponse send(DeliveryRequest request);
}
