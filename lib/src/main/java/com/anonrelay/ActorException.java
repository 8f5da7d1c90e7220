package com.anonrelay;

/**
 * Internal consistency violation inside the actor runtime: a mailbox closed under a
 * live sender, an actor loop that died, a reply that will never arrive.
 *
 * <p>Never rendered to users. Whoever observes one lets it propagate, and it ends the
 * process.
 */
public class ActorException extends RuntimeException {

    /** Login of the actor where the violation was detected, or null. */
    private final String actorId;

    public ActorException(String message, String actorId) {
        super(message);
        this.actorId = actorId;
    }

    public ActorException(String message, Throwable cause, String actorId) {
        super(message, cause);
        this.actorId = actorId;
    }

    /**
     * @return the actor id, or null if not specified
     */
    public String getActorId() {
        return actorId;
    }
}
