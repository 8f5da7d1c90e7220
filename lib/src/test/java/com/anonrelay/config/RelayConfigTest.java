package com.anonrelay.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(RelayConfig.OPERATOR_LOGIN);
    }

    @Test
    void defaults() {
        RelayConfig config = RelayConfig.defaults();

        assertEquals(Path.of("./events.log"), config.getLogPath());
        assertFalse(config.isLogFsync());
        assertEquals(100, config.getMailboxCapacity());
        assertEquals(1000, config.getMaxEventBatch());
        assertEquals("relay_admin", config.getOperatorLogin());
        assertEquals(Duration.ZERO, config.getPeerReplyTimeout());
        assertEquals(Duration.ZERO, config.getCommandPause());
    }

    @Test
    void readsEveryKeyFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("anonrelay.log.path", " /var/lib/relay/events.log ");
        properties.setProperty("anonrelay.log.fsync", "true");
        properties.setProperty("anonrelay.mailbox.capacity", "16");
        properties.setProperty("anonrelay.events.max-batch", "50");
        properties.setProperty("anonrelay.operator.login", "ops");
        properties.setProperty("anonrelay.peer.reply-timeout-ms", "2500");
        properties.setProperty("anonrelay.command.pause-ms", "1000");

        RelayConfig config = RelayConfig.fromProperties(properties);

        assertEquals(Path.of("/var/lib/relay/events.log"), config.getLogPath());
        assertTrue(config.isLogFsync());
        assertEquals(16, config.getMailboxCapacity());
        assertEquals(50, config.getMaxEventBatch());
        assertEquals("ops", config.getOperatorLogin());
        assertEquals(Duration.ofMillis(2500), config.getPeerReplyTimeout());
        assertEquals(Duration.ofSeconds(1), config.getCommandPause());
    }

    @Test
    void missingKeysKeepDefaults() {
        Properties properties = new Properties();
        properties.setProperty("anonrelay.mailbox.capacity", "8");

        RelayConfig config = RelayConfig.fromProperties(properties);

        assertEquals(8, config.getMailboxCapacity());
        assertEquals("relay_admin", config.getOperatorLogin());
    }

    @Test
    void malformedNumberNamesTheKey() {
        Properties properties = new Properties();
        properties.setProperty("anonrelay.events.max-batch", "lots");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> RelayConfig.fromProperties(properties));
        assertTrue(error.getMessage().contains("anonrelay.events.max-batch"));
    }

    @Test
    void builderRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.builder().mailboxCapacity(0).build());
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.builder().maxEventBatch(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.builder().operatorLogin("").build());
        assertThrows(IllegalArgumentException.class,
                () -> RelayConfig.builder().peerReplyTimeout(Duration.ofMillis(-1)).build());
    }

    @Test
    void systemPropertiesOverrideResource() {
        System.setProperty(RelayConfig.OPERATOR_LOGIN, "night_shift");

        RelayConfig config = RelayConfig.load();

        assertEquals("night_shift", config.getOperatorLogin());
        assertEquals(100, config.getMailboxCapacity());
    }
}
