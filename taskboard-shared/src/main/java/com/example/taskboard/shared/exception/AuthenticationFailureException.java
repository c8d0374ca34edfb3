package com.example.taskboard.shared.exception;

/**
 * The credential presented at connection time was missing, invalid or expired, or
 * could not be checked at all. The message is sent to the client verbatim, so it
 * must never carry verifier internals.
 */
public class AuthenticationFailureException extends RuntimeException {

    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
