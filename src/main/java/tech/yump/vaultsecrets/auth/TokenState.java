package tech.yump.vaultsecrets.auth;

/**
 * Lifecycle of the store token. {@link #AUTHENTICATED} and {@link #EXPIRING_SOON} both
 * count as authenticated; the latter only triggers renewal.
 */
public enum TokenState {
    UNAUTHENTICATED,
    AUTHENTICATED,
    EXPIRING_SOON,
    EXPIRED
}
