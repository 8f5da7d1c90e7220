package com.anonrelay.transport;

/**
 * Outbound side of the chat network the relay is attached to.
 */
public interface ChatTransport {

    /**
     * Delivers a text message to a chat.
     *
     * @param chatId chat session of the receiving user
     * @param text   message text
     * @return the transport's id for the delivered message
     * @throws TransportException if the message could not be delivered
     */
    long sendMessage(long chatId, String text);
}
