package com.anonrelay.actor;

import com.anonrelay.config.RelayConfig;
import com.anonrelay.config.ThreadPoolFactory;
import com.anonrelay.model.ThreadIdGenerator;
import com.anonrelay.persistence.EventService;
import com.anonrelay.transport.ChatTransport;

import java.util.Random;

/**
 * Collaborators shared by every user actor of one relay.
 */
public record ActorContext(
        EventService eventService,
        ChatTransport transport,
        HandleDirectory directory,
        ThreadIdGenerator threadIds,
        RelayConfig config,
        ThreadPoolFactory threadPoolFactory,
        Random random) {
}
