package tech.yump.vaultsecrets.core;

/**
 * Maps a caller to the store path of its secrets.
 */
@FunctionalInterface
public interface SecretPathResolver {

    String resolve(CallerContext context);

    static SecretPathResolver fixed(String path) {
        return context -> path;
    }
}
