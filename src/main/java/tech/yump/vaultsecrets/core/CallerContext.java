package tech.yump.vaultsecrets.core;

/**
 * Identity of the code asking for secrets.
 *
 * @param serviceName Name of the calling service; second segment of the default secret path.
 * @param runtimeName Name of the runtime the caller runs in. {@value #SIMULATE_RUNTIME} skips the store entirely.
 */
public record CallerContext(String serviceName, String runtimeName) {

    public static final String SIMULATE_RUNTIME = "simulate";

    public boolean isSimulated() {
        return SIMULATE_RUNTIME.equals(runtimeName);
    }
}
