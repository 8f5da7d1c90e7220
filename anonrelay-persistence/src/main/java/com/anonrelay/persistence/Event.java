package com.anonrelay.persistence;

import com.anonrelay.model.AnonymityMode;
import com.anonrelay.model.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An append-only fact about the actor population. The event log is the only source of
 * truth for recovery; every variant names the login whose actor it belongs to.
 *
 * <p>On disk each event is one JSON object keyed by its variant name, for example
 * {@code {"UserStopped":{"login":"alice"}}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Event.UserConnected.class, name = "UserConnected"),
        @JsonSubTypes.Type(value = Event.ThreadStarted.class, name = "ThreadStarted"),
        @JsonSubTypes.Type(value = Event.ThreadMessageReceived.class, name = "ThreadMessageReceived"),
        @JsonSubTypes.Type(value = Event.ThreadTerminated.class, name = "ThreadTerminated"),
        @JsonSubTypes.Type(value = Event.UserBanned.class, name = "UserBanned"),
        @JsonSubTypes.Type(value = Event.UserUnbanned.class, name = "UserUnbanned"),
        @JsonSubTypes.Type(value = Event.UserStopped.class, name = "UserStopped"),
        @JsonSubTypes.Type(value = Event.UserStarted.class, name = "UserStarted")
})
public sealed interface Event permits Event.UserConnected, Event.ThreadStarted, Event.ThreadMessageReceived,
        Event.ThreadTerminated, Event.UserBanned, Event.UserUnbanned, Event.UserStopped, Event.UserStarted {

    /**
     * @return the login of the actor that owns this fact
     */
    String owner();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive fold over the event variants. Adding a variant breaks every visitor
     * at compile time.
     */
    interface Visitor<R> {
        R visitUserConnected(UserConnected event);

        R visitThreadStarted(ThreadStarted event);

        R visitThreadMessageReceived(ThreadMessageReceived event);

        R visitThreadTerminated(ThreadTerminated event);

        R visitUserBanned(UserBanned event);

        R visitUserUnbanned(UserUnbanned event);

        R visitUserStopped(UserStopped event);

        R visitUserStarted(UserStarted event);
    }

    record UserConnected(
            @JsonProperty("user") User user,
            @JsonProperty("chat_id") long chatId) implements Event {

        @Override
        public String owner() {
            return user.login();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserConnected(this);
        }
    }

    record ThreadStarted(
            @JsonProperty("login") String login,
            @JsonProperty("other_login") String otherLogin,
            @JsonProperty("my_thread_id") String myThreadId,
            @JsonProperty("other_thread_id") String otherThreadId,
            @JsonProperty("anon_mode") AnonymityMode anonMode) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThreadStarted(this);
        }
    }

    record ThreadMessageReceived(
            @JsonProperty("login") String login,
            @JsonProperty("message_id") long messageId,
            @JsonProperty("thread_id") String threadId) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThreadMessageReceived(this);
        }
    }

    record ThreadTerminated(
            @JsonProperty("login") String login,
            @JsonProperty("other_login") String otherLogin,
            @JsonProperty("my_thread_id") String myThreadId,
            @JsonProperty("other_thread_id") String otherThreadId) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitThreadTerminated(this);
        }
    }

    /**
     * {@code bannedUserThreadId} is the banned side's mirror endpoint. Older logs
     * do not carry it, in which case it is null.
     */
    record UserBanned(
            @JsonProperty("login") String login,
            @JsonProperty("banned_login") String bannedLogin,
            @JsonProperty("banned_thread_id") String bannedThreadId,
            @JsonProperty("banned_user_thread_id") @JsonInclude(JsonInclude.Include.NON_NULL) String bannedUserThreadId)
            implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserBanned(this);
        }
    }

    record UserUnbanned(
            @JsonProperty("login") String login,
            @JsonProperty("unbanned_login") String unbannedLogin) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserUnbanned(this);
        }
    }

    record UserStopped(@JsonProperty("login") String login) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserStopped(this);
        }
    }

    record UserStarted(@JsonProperty("login") String login) implements Event {

        @Override
        public String owner() {
            return login;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUserStarted(this);
        }
    }
}
