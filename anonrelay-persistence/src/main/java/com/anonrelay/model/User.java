package com.anonrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A chat user as seen by the relay. The login is the only routing key.
 *
 * @param login     unique, stable identity
 * @param firstName display first name
 * @param lastName  display last name, or null
 */
public record User(
        @JsonProperty("login") String login,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName) {

    public User {
        Objects.requireNonNull(login, "login");
        Objects.requireNonNull(firstName, "firstName");
    }

    /**
     * Formats the user for directory listings: {@code First [Last] @login}.
     */
    public String displayName() {
        if (lastName != null) {
            return firstName + " " + lastName + " @" + login;
        }
        return firstName + " @" + login;
    }
}
