package tech.yump.vaultsecrets.auth;

import tech.yump.vaultsecrets.core.VaultRequestException;

/**
 * AppRole login against the store failed.
 */
public class VaultAuthenticationException extends VaultRequestException {

    public VaultAuthenticationException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    public VaultAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

    public VaultAuthenticationException(String message) {
        super(message);
    }
}
