package tech.yump.vaultsecrets.client;

import tech.yump.vaultsecrets.core.VaultRequestException;

public class SecretNotFoundException extends VaultRequestException {

    private final String path;

    public SecretNotFoundException(String path, Throwable cause) {
        super("Secret not found: " + path, 404, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
