package tech.yump.vaultsecrets.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.vaultsecrets.core.CallerContext;
import tech.yump.vaultsecrets.core.SecretsManager;
import tech.yump.vaultsecrets.core.SecretsOptions;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Loads the service secrets before the request reaches its handler.
 *
 * <p>On success the secrets are exposed as the request attribute {@value #SECRETS_ATTR} and,
 * when enabled, as JVM system properties. On failure the handler is not invoked and the
 * client gets an empty 502 with a fixed {@value #ERROR_HEADER} header; details only go to the log.
 */
@Slf4j
public class VaultSecretsFilter extends OncePerRequestFilter {

    public static final String SECRETS_ATTR = "vaultSecrets";
    public static final String MDC_REQUEST_ID_KEY = "requestId";
    public static final String ERROR_HEADER = "x-error";
    public static final String ERROR_MESSAGE = "error fetching secrets.";

    private final SecretsManager secretsManager;
    private final CallerContext callerContext;
    private final SecretsOptions options;
    private final boolean exportSystemProperties;
    private final List<String> publicPaths = List.of("/sys/secrets-status");

    public VaultSecretsFilter(
            SecretsManager secretsManager,
            CallerContext callerContext,
            SecretsOptions options,
            boolean exportSystemProperties) {
        this.secretsManager = secretsManager;
        this.callerContext = callerContext;
        this.options = options;
        this.exportSystemProperties = exportSystemProperties;

        log.debug("VaultSecretsFilter initialized for service '{}' (runtime '{}'). Export to system properties: {}",
                callerContext.serviceName(), callerContext.runtimeName(), exportSystemProperties);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        MDC.put(MDC_REQUEST_ID_KEY, UUID.randomUUID().toString());
        try {
            Map<String, String> secrets;
            try {
                secrets = secretsManager.loadSecrets(callerContext, options);
                mergeIntoRequest(request, secrets);
                if (exportSystemProperties) {
                    exportToSystemProperties(secrets);
                }
            } catch (RuntimeException e) {
                log.error("Failed to load secrets for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage(), e);
                response.setStatus(HttpStatus.BAD_GATEWAY.value());
                response.setHeader(ERROR_HEADER, ERROR_MESSAGE);
                return;
            }

            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    private static void exportToSystemProperties(Map<String, String> secrets) {
        secrets.forEach((key, value) -> {
            if (!StringUtils.hasText(key) || value == null) {
                log.warn("Skipping system property export for a secret with a blank key or null value.");
                return;
            }
            System.setProperty(key, value);
        });
    }

    @SuppressWarnings("unchecked")
    private static void mergeIntoRequest(HttpServletRequest request, Map<String, String> secrets) {
        Map<String, String> merged = new LinkedHashMap<>();
        Object existing = request.getAttribute(SECRETS_ATTR);
        if (existing instanceof Map<?, ?> existingMap) {
            merged.putAll((Map<String, String>) existingMap);
        }
        merged.putAll(secrets);
        request.setAttribute(SECRETS_ATTR, Collections.unmodifiableMap(merged));
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        if (publicPaths.contains(path)) {
            log.trace("Path {} is public, skipping VaultSecretsFilter.", path);
            return true;
        }
        return false;
    }
}
