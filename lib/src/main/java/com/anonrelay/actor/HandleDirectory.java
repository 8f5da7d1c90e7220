package com.anonrelay.actor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Login to {@link UserHandle} directory shared by all actors and the dispatcher.
 *
 * <p>Lookups and listings take the read lock and run concurrently. The only mutation is
 * {@link #insertIfAbsent(UserHandle)}, so an entry once published is never replaced or
 * removed.
 */
public class HandleDirectory {

    private final Map<String, UserHandle> handles = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Optional<UserHandle> get(String login) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(handles.get(login));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a point-in-time copy of all handles
     */
    public List<UserHandle> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(handles.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Publishes a handle unless one is already registered for its login.
     *
     * @return true if the handle was added
     */
    public boolean insertIfAbsent(UserHandle handle) {
        lock.writeLock().lock();
        try {
            return handles.putIfAbsent(handle.login(), handle) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return handles.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
