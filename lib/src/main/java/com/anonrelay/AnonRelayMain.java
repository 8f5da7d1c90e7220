package com.anonrelay;

import com.anonrelay.config.RelayConfig;
import com.anonrelay.config.ThreadPoolFactory;
import com.anonrelay.dispatch.CommandDispatcher;
import com.anonrelay.dispatch.CommandDispatcherBuilder;
import com.anonrelay.persistence.EventService;
import com.anonrelay.persistence.FileEventJournal;
import com.anonrelay.transport.ConsoleTransport;
import com.anonrelay.transport.IncomingMessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Starts a relay on the configured event log with the console transport attached.
 *
 * <p>Startup order: replay the whole log, open it for append, start the event writer,
 * start every replayed actor, then admit traffic. A corrupt log aborts before anything
 * is started.
 */
public final class AnonRelayMain {
    private static final Logger logger = LoggerFactory.getLogger(AnonRelayMain.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private AnonRelayMain() {
    }

    public static void main(String[] args) throws IOException {
        RelayConfig config = RelayConfig.load();
        logger.info("Starting relay on event log {}", config.getLogPath());

        CommandDispatcherBuilder builder = CommandDispatcherBuilder.fromEventLog(config.getLogPath(), config);
        ThreadPoolFactory threadPoolFactory = new ThreadPoolFactory();
        builder.withThreadPoolFactory(threadPoolFactory);

        EventService eventService = new EventService(
                FileEventJournal.open(config.getLogPath(), config.isLogFsync()),
                config.getMaxEventBatch(),
                threadPoolFactory.createEventServiceThreadFactory()).start();

        ConsoleTransport transport = new ConsoleTransport(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        builder.chats().forEach(transport::registerChat);
        transport.resumeAfter(builder.maxMessageId());

        CommandDispatcher dispatcher = builder.build(eventService, transport);
        try {
            transport.run(new IncomingMessageHandler(dispatcher, transport));
        } finally {
            dispatcher.shutdown(SHUTDOWN_TIMEOUT);
            eventService.close();
            logger.info("Relay stopped");
        }
    }
}
