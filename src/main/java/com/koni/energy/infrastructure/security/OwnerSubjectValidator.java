package com.koni.energy.infrastructure.security;

import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

/**
 * Rejects tokens whose subject is not a user id, so that they fail with 401 at the
 * resource server filter.
 */
public class OwnerSubjectValidator implements OAuth2TokenValidator<Jwt> {

    private static final OAuth2Error INVALID_SUBJECT =
            new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, "Token subject is not a user id", null);

    @Override
    public OAuth2TokenValidatorResult validate(Jwt jwt) {
        try {
            AuthenticatedOwner.idOf(jwt);
            return OAuth2TokenValidatorResult.success();
        } catch (InvalidBearerTokenException e) {
            return OAuth2TokenValidatorResult.failure(INVALID_SUBJECT);
        }
    }
}
