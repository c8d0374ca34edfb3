package com.example.taskboard.shared.collaborator;

import com.example.taskboard.shared.exception.AuthenticationFailureException;

/**
 * Turns a bearer credential into the identity it was issued for.
 * <p>
 * Implementations may block; callers run them off the event loop.
 */
public interface IdentityVerifier {

    /**
     * @param credential the raw bearer credential, never {@code null}
     * @return the verified identity
     * @throws AuthenticationFailureException if the credential is invalid, expired or of the wrong kind
     */
    UserIdentity verify(String credential);
}
