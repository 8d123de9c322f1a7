package com.koni.energy.infrastructure.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

import java.util.UUID;

/**
 * Resolves the owner id carried in the {@code sub} claim of a bearer token.
 */
public final class AuthenticatedOwner {

    private AuthenticatedOwner() {
    }

    /**
     * @throws InvalidBearerTokenException if the token has no subject or it is not a UUID
     */
    public static UUID idOf(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null) {
            throw new InvalidBearerTokenException("Token has no subject");
        }
        try {
            return UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException e) {
            throw new InvalidBearerTokenException("Token subject is not a user id", e);
        }
    }
}
