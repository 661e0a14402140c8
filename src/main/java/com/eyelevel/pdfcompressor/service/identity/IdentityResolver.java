package com.eyelevel.pdfcompressor.service.identity;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.apiclient.UnauthorizedException;
import com.eyelevel.pdfcompressor.model.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Maps the {@code X-API-Key} credential to a persisted {@link Principal}.
 * <p>
 * Authentication and resolution are separate steps: {@link #authenticate(String)} runs in the request gate and
 * never touches the database, {@link #resolve(CallerCredential)} performs the idempotent find-or-create.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    public static final String ANONYMOUS_EMAIL = "anonymous@pdfcompress.local";
    public static final String ANONYMOUS_NAME = "Anonymous User";
    static final String UNAUTHORIZED_DETAIL = "A valid API key must be supplied via the X-API-Key header.";
    private static final String DEFAULT_KEY_NAME = "API Key User";
    private static final int MAX_CREATE_ATTEMPTS = 3;

    private final PdfCompressorConfig config;
    private final PrincipalAtomicService principalAtomicService;

    /**
     * Checks the presented token against the configured keys.
     *
     * @param token the raw header value, possibly {@code null}
     * @return the matching credential, or the anonymous credential when no keys are configured
     * @throws UnauthorizedException if keys are configured and the token is absent or unknown
     */
    public CallerCredential authenticate(final String token) {
        final List<PdfCompressorConfig.Security.ApiKey> keys = config.getSecurity().getApiKeys();
        if (keys == null || keys.isEmpty()) {
            return new CallerCredential(ANONYMOUS_EMAIL, ANONYMOUS_NAME, false, true);
        }
        if (!StringUtils.hasText(token)) {
            throw new UnauthorizedException("unauthorized", UNAUTHORIZED_DETAIL);
        }
        final String presented = token.trim();
        return keys.stream()
                   .filter(key -> presented.equals(key.getKey()))
                   .findFirst()
                   .map(IdentityResolver::toCredential)
                   .orElseThrow(() -> {
                       log.warn("Rejected request with an unrecognized API key.");
                       return new UnauthorizedException("unauthorized", UNAUTHORIZED_DETAIL);
                   });
    }

    /**
     * Finds the principal for the credential, creating it on first use.
     * A concurrent first use of the same credential is resolved by re-reading the winner's row.
     *
     * @throws UnauthorizedException if the principal exists but has been deactivated
     */
    public Principal resolve(final CallerCredential credential) {
        final Principal principal = findOrCreate(credential);
        if (!principal.isActive()) {
            log.warn("Rejected request for inactive principal {}.", principal.getId());
            throw new UnauthorizedException("unauthorized", UNAUTHORIZED_DETAIL);
        }
        return principal;
    }

    private Principal findOrCreate(final CallerCredential credential) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            final Optional<Principal> existing = principalAtomicService.findByEmail(credential.email());
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                return principalAtomicService.attemptToCreate(credential.email(), credential.displayName());
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                log.info("Principal '{}' was created concurrently (attempt {}). Re-reading.", credential.email(), attempt);
                lastFailure = e;
            }
        }
        final Optional<Principal> winner = principalAtomicService.findByEmail(credential.email());
        if (winner.isPresent()) {
            return winner.get();
        }
        throw new IllegalStateException("Could not resolve principal '" + credential.email() + "'", lastFailure);
    }

    private static CallerCredential toCredential(final PdfCompressorConfig.Security.ApiKey key) {
        final String email = StringUtils.hasText(key.getEmail())
                ? key.getEmail().trim()
                : "key-" + DigestUtils.sha256Hex(key.getKey()).substring(0, 12) + "@pdfcompress.local";
        final String name = StringUtils.hasText(key.getName()) ? key.getName().trim() : DEFAULT_KEY_NAME;
        return new CallerCredential(email, name, key.isElevated(), false);
    }
}
