package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.exception.AuthenticationException;

/**
 * Resolves a bearer credential to the user it was issued to.
 */
public interface TokenVerifier {

    /**
     * @throws AuthenticationException if the token is missing, malformed, forged or expired
     */
    AuthenticatedUser verify(String token);
}
