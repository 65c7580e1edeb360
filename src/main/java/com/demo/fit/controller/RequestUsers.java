package com.demo.fit.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;

/** The caller's email is the user id everywhere in the engine. */
final class RequestUsers {

    private RequestUsers() {}

    static String userId(String email) {
        if (email == null || email.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "user_email required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
