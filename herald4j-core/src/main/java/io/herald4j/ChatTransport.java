package io.herald4j;

import io.herald4j.core.OutboundMessage;

/**
 * Outbound side of the chat platform.
 */
public interface ChatTransport {

    /**
     * Check that the destination exists and is reachable by the bot.
     */
    void resolve(String destination) throws TransportException;

    void send(String destination, OutboundMessage message) throws TransportException;

    /**
     * Whether the user may manage schedules in the destination. Anonymous administrators count.
     */
    boolean isAdmin(String userId, String destination) throws TransportException;
}
