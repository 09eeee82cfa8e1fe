package com.aigreentick.services.otprelay.service;

/**
 * Outbound side of the chat transport.
 */
public interface SubscriberNotifier {

    /**
     * Deliver {@code text} to the chat. Delivery failures are logged, never thrown.
     *
     * @return true if the transport accepted the message
     */
    boolean notify(long subscriberId, String text);
}
