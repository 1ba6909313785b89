package com.trellis.webshell.config;

import com.trellis.composition.DuplicateTargetPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the web shell, bound from {@code trellis.web.*}:
 *
 * <pre>
 * trellis:
 *   web:
 *     name: trellis-web-shell
 *     environment: production
 *     login-path: /login
 *     tenant-creation-path: /teams/new
 *     duplicate-target-policy: fail-fast
 * </pre>
 *
 * @param name application name, used as the {@code app} metric tag and tracer name. Required.
 * @param environment deployment environment (development, staging, production)
 * @param loginPath where unauthenticated callers are sent, with {@code next=<full path>}
 * @param tenantCreationPath where callers without a team are sent
 * @param duplicateTargetPolicy what the composer does when a fragment target repeats
 */
@ConfigurationProperties(prefix = "trellis.web")
@Validated
public record WebShellProperties(
        @NotBlank String name,
        String environment,
        @Pattern(regexp = "/.*") String loginPath,
        @Pattern(regexp = "/.*") String tenantCreationPath,
        DuplicateTargetPolicy duplicateTargetPolicy) {

    /** Applies defaults for optional fields before Bean Validation runs. */
    public WebShellProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (loginPath == null || loginPath.isBlank()) {
            loginPath = "/login";
        }
        if (tenantCreationPath == null || tenantCreationPath.isBlank()) {
            tenantCreationPath = "/teams/new";
        }
        if (duplicateTargetPolicy == null) {
            duplicateTargetPolicy = DuplicateTargetPolicy.FAIL_FAST;
        }
    }
}
