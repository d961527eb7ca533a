package tech.yump.vaultsecrets.core;

/**
 * Base exception for every failure raised while bootstrapping, authenticating against,
 * or reading from the secret store.
 */
public class VaultSecretsException extends RuntimeException {

    public VaultSecretsException(String message) {
        super(message);
    }

    public VaultSecretsException(String message, Throwable cause) {
        super(message, cause);
    }
}
