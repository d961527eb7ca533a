package tech.yump.vaultsecrets.bootstrap;

import tech.yump.vaultsecrets.core.VaultSecretsException;

/**
 * The bootstrap credentials could not be retrieved or parsed.
 */
public class BootstrapException extends VaultSecretsException {

    public BootstrapException(String message) {
        super(message);
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
