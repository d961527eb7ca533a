package tech.yump.vaultsecrets.client;

import tech.yump.vaultsecrets.core.VaultSecretsException;

/**
 * Thrown when a read is attempted without a valid token. No request is sent.
 */
public class NotAuthenticatedException extends VaultSecretsException {

    public NotAuthenticatedException(String message) {
        super(message);
    }
}
