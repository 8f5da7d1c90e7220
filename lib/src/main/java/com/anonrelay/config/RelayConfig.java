package com.anonrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Relay settings. Immutable; build one with {@link #builder()} or load it with
 * {@link #load()}.
 *
 * <p>Keys, all under the {@code anonrelay.} prefix:
 * <ul>
 *   <li>{@code log.path}: event log file, default {@code ./events.log}</li>
 *   <li>{@code log.fsync}: force the log to the device on every append, default false</li>
 *   <li>{@code mailbox.capacity}: capacity of every actor mailbox, default 100</li>
 *   <li>{@code events.max-batch}: events coalesced into one write, default 1000</li>
 *   <li>{@code operator.login}: the only login allowed to broadcast, default {@code relay_admin}</li>
 *   <li>{@code peer.reply-timeout-ms}: bound on waiting for a peer actor, 0 waits forever</li>
 *   <li>{@code command.pause-ms}: pause after each owner command, default 0</li>
 * </ul>
 */
public final class RelayConfig {
    private static final Logger logger = LoggerFactory.getLogger(RelayConfig.class);

    public static final String RESOURCE_NAME = "anonrelay.properties";
    public static final String PREFIX = "anonrelay.";

    public static final String LOG_PATH = PREFIX + "log.path";
    public static final String LOG_FSYNC = PREFIX + "log.fsync";
    public static final String MAILBOX_CAPACITY = PREFIX + "mailbox.capacity";
    public static final String EVENTS_MAX_BATCH = PREFIX + "events.max-batch";
    public static final String OPERATOR_LOGIN = PREFIX + "operator.login";
    public static final String PEER_REPLY_TIMEOUT_MS = PREFIX + "peer.reply-timeout-ms";
    public static final String COMMAND_PAUSE_MS = PREFIX + "command.pause-ms";

    private final Path logPath;
    private final boolean logFsync;
    private final int mailboxCapacity;
    private final int maxEventBatch;
    private final String operatorLogin;
    private final Duration peerReplyTimeout;
    private final Duration commandPause;

    private RelayConfig(Builder builder) {
        this.logPath = builder.logPath;
        this.logFsync = builder.logFsync;
        this.mailboxCapacity = builder.mailboxCapacity;
        this.maxEventBatch = builder.maxEventBatch;
        this.operatorLogin = builder.operatorLogin;
        this.peerReplyTimeout = builder.peerReplyTimeout;
        this.commandPause = builder.commandPause;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RelayConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath, if present, and applies
     * {@code anonrelay.*} system properties on top.
     */
    public static RelayConfig load() {
        Properties properties = new Properties();
        try (InputStream in = RelayConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        RelayConfig config = fromProperties(properties);
        logger.info("Loaded configuration: {}", config);
        return config;
    }

    /**
     * Builds a configuration from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is malformed
     */
    public static RelayConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(LOG_PATH)) != null) {
            builder.logPath(Path.of(value.trim()));
        }
        if ((value = properties.getProperty(LOG_FSYNC)) != null) {
            builder.logFsync(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(MAILBOX_CAPACITY)) != null) {
            builder.mailboxCapacity(parseInt(MAILBOX_CAPACITY, value));
        }
        if ((value = properties.getProperty(EVENTS_MAX_BATCH)) != null) {
            builder.maxEventBatch(parseInt(EVENTS_MAX_BATCH, value));
        }
        if ((value = properties.getProperty(OPERATOR_LOGIN)) != null) {
            builder.operatorLogin(value.trim());
        }
        if ((value = properties.getProperty(PEER_REPLY_TIMEOUT_MS)) != null) {
            builder.peerReplyTimeout(Duration.ofMillis(parseInt(PEER_REPLY_TIMEOUT_MS, value)));
        }
        if ((value = properties.getProperty(COMMAND_PAUSE_MS)) != null) {
            builder.commandPause(Duration.ofMillis(parseInt(COMMAND_PAUSE_MS, value)));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isLogFsync() {
        return logFsync;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public int getMaxEventBatch() {
        return maxEventBatch;
    }

    public String getOperatorLogin() {
        return operatorLogin;
    }

    /**
     * @return how long to wait for a peer actor's reply; zero means no bound
     */
    public Duration getPeerReplyTimeout() {
        return peerReplyTimeout;
    }

    public Duration getCommandPause() {
        return commandPause;
    }

    @Override
    public String toString() {
        return "RelayConfig{logPath=" + logPath
                + ", logFsync=" + logFsync
                + ", mailboxCapacity=" + mailboxCapacity
                + ", maxEventBatch=" + maxEventBatch
                + ", operatorLogin=" + operatorLogin
                + ", peerReplyTimeout=" + peerReplyTimeout
                + ", commandPause=" + commandPause + "}";
    }

    public static final class Builder {
        private Path logPath = Path.of("./events.log");
        private boolean logFsync = false;
        private int mailboxCapacity = 100;
        private int maxEventBatch = 1000;
        private String operatorLogin = "relay_admin";
        private Duration peerReplyTimeout = Duration.ZERO;
        private Duration commandPause = Duration.ZERO;

        private Builder() {
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder logFsync(boolean logFsync) {
            this.logFsync = logFsync;
            return this;
        }

        public Builder mailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
            return this;
        }

        public Builder maxEventBatch(int maxEventBatch) {
            this.maxEventBatch = maxEventBatch;
            return this;
        }

        public Builder operatorLogin(String operatorLogin) {
            this.operatorLogin = operatorLogin;
            return this;
        }

        public Builder peerReplyTimeout(Duration peerReplyTimeout) {
            this.peerReplyTimeout = peerReplyTimeout;
            return this;
        }

        public Builder commandPause(Duration commandPause) {
            this.commandPause = commandPause;
            return this;
        }

        public RelayConfig build() {
            if (logPath == null) {
                throw new IllegalArgumentException("logPath is required");
            }
            if (mailboxCapacity <= 0) {
                throw new IllegalArgumentException("mailbox capacity must be positive");
            }
            if (maxEventBatch <= 0) {
                throw new IllegalArgumentException("max event batch must be positive");
            }
            if (operatorLogin == null || operatorLogin.isEmpty()) {
                throw new IllegalArgumentException("operator login is required");
            }
            if (peerReplyTimeout.isNegative() || commandPause.isNegative()) {
                throw new IllegalArgumentException("durations must not be negative");
            }
            return new RelayConfig(this);
        }
    }
}
