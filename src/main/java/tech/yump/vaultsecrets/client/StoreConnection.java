package tech.yump.vaultsecrets.client;

import org.springframework.util.StringUtils;

import java.net.URI;

/**
 * Address and KV mount of the secret store. Every endpoint URI the client talks to is
 * derived from here.
 *
 * @param address    Base address of the store, without trailing slash (e.g. "https://vault.example.com").
 * @param mountPoint Mount of the KV v2 engine (e.g. "dx_mysticat").
 */
public record StoreConnection(String address, String mountPoint) {

    public StoreConnection {
        if (!StringUtils.hasText(address)) {
            throw new IllegalArgumentException("Store address is required.");
        }
        if (!StringUtils.hasText(mountPoint)) {
            throw new IllegalArgumentException("Mount point is required.");
        }
        address = address.trim().replaceAll("/+$", "");
        mountPoint = mountPoint.trim();
    }

    /**
     * Resolves an API path relative to {@code /v1/}.
     */
    public URI apiUri(String relativePath) {
        return URI.create(address + "/v1/" + stripLeadingSlashes(relativePath));
    }

    public URI dataUri(String secretPath) {
        return apiUri(mountPoint + "/data/" + stripLeadingSlashes(secretPath));
    }

    public URI metadataUri(String secretPath) {
        return apiUri(mountPoint + "/metadata/" + stripLeadingSlashes(secretPath));
    }

    private static String stripLeadingSlashes(String path) {
        return path.replaceAll("^/+", "");
    }
}
