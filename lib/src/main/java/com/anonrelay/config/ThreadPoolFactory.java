package com.anonrelay.config;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the named threads the relay runs on. Every user actor gets its own platform
 * thread, named after the login so that logs and thread dumps identify it; the event
 * writer runs on a single thread of its own.
 */
public class ThreadPoolFactory {
    private static final String DEFAULT_ACTOR_PREFIX = "actor";
    private static final String DEFAULT_EVENT_SERVICE_NAME = "event-service";

    private String actorThreadPrefix = DEFAULT_ACTOR_PREFIX;
    private String eventServiceThreadName = DEFAULT_EVENT_SERVICE_NAME;
    private boolean daemon = true;
    private final AtomicInteger created = new AtomicInteger();

    /**
     * Thread factory for the actor of the given login. Threads are named
     * {@code <prefix>-<login>}.
     */
    public ThreadFactory createActorThreadFactory(String login) {
        return namedThreadFactory(actorThreadPrefix + "-" + login);
    }

    public ThreadFactory createEventServiceThreadFactory() {
        return namedThreadFactory(eventServiceThreadName);
    }

    private ThreadFactory namedThreadFactory(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(daemon);
            created.incrementAndGet();
            return thread;
        };
    }

    /**
     * @return how many threads this factory has handed out
     */
    public int getCreatedThreads() {
        return created.get();
    }

    public String getActorThreadPrefix() {
        return actorThreadPrefix;
    }

    public ThreadPoolFactory setActorThreadPrefix(String actorThreadPrefix) {
        this.actorThreadPrefix = actorThreadPrefix;
        return this;
    }

    public String getEventServiceThreadName() {
        return eventServiceThreadName;
    }

    public ThreadPoolFactory setEventServiceThreadName(String eventServiceThreadName) {
        this.eventServiceThreadName = eventServiceThreadName;
        return this;
    }

    public boolean isDaemon() {
        return daemon;
    }

    public ThreadPoolFactory setDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }
}
