package com.aigreentick.services.groupcast.transport.service;

import java.util.List;

import com.aigreentick.services.groupcast.group.model.Group;
import com.aigreentick.services.groupcast.transport.dto.DeliveryReceipt;
import com.aigreentick.services.groupcast.transport.dto.MessageContent;
import com.aigreentick.services.groupcast.transport.dto.SessionCredentials;
import com.aigreentick.services.groupcast.transport.dto.StateEvent;

import reactor.core.publisher.Flux;

/**
 * The session with the chat network.
 * Allows switching between real and mock implementations via Spring profiles.
 */
public interface MessagingTransport {

    /**
     * Opens a session. Nothing happens until the returned stream is subscribed;
     * disposing the subscription stops listening but does not log out.
     */
    Flux<StateEvent> connect(SessionCredentials credentials);

    /**
     * Sends one message. Blocks until the network acknowledges or the transport times out.
     */
    DeliveryReceipt sendMessage(String destinationId, MessageContent content);

    List<Group> listDestinations();

    /**
     * Ends the session on the network side; a new pairing is needed afterwards.
     */
    void logout();

    /**
     * Drops the connection, keeping the session resumable.
     */
    void close();
}
