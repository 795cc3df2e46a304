package com.librarycatalog.exception;

import org.springframework.security.core.AuthenticationException;

/**
 * The identity provider step failed, timed out or was denied. Extends
 * {@link AuthenticationException} so the login filter routes it to the
 * failure handler.
 */
public class ProviderExchangeException extends AuthenticationException {

    public ProviderExchangeException(String message) {
        super(message);
    }

    public ProviderExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
