package com.example.taskboard.shared.exception;

import lombok.Getter;

/**
 * An external capability (identity verification, project membership) failed to
 * answer. Callers convert this into the nearest client-facing error with a generic
 * message.
 */
@Getter
public class CollaboratorUnavailableException extends RuntimeException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, Throwable cause) {
        super(collaborator + " is unavailable: " + cause.getMessage(), cause);
        this.collaborator = collaborator;
    }
}
