package com.eyelevel.pdfcompressor.service.identity;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.apiclient.UnauthorizedException;
import com.eyelevel.pdfcompressor.model.Principal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock
    private PrincipalAtomicService principalAtomicService;

    private PdfCompressorConfig config;
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        config = new PdfCompressorConfig();
        resolver = new IdentityResolver(config, principalAtomicService);
    }

    @Test
    void noConfiguredKeysMeansAnonymous() {
        final CallerCredential caller = resolver.authenticate("whatever");

        assertThat(caller.anonymous()).isTrue();
        assertThat(caller.elevated()).isFalse();
        assertThat(caller.email()).isEqualTo(IdentityResolver.ANONYMOUS_EMAIL);
        assertThat(caller.displayName()).isEqualTo(IdentityResolver.ANONYMOUS_NAME);
        verifyNoInteractions(principalAtomicService);
    }

    @Test
    void knownKeyMapsToItsIdentity() {
        configureKeys(key("alpha-key", "alpha@example.com", "Alpha", false),
                      key("admin-key", "admin@example.com", "Admin", true));

        final CallerCredential admin = resolver.authenticate("  admin-key ");

        assertThat(admin.email()).isEqualTo("admin@example.com");
        assertThat(admin.displayName()).isEqualTo("Admin");
        assertThat(admin.elevated()).isTrue();
        assertThat(admin.anonymous()).isFalse();
    }

    @Test
    void keyWithoutEmailGetsStableDerivedIdentity() {
        configureKeys(key("bare-key", null, null, false));

        final CallerCredential first = resolver.authenticate("bare-key");
        final CallerCredential second = resolver.authenticate("bare-key");

        assertThat(first.email()).matches("key-[0-9a-f]{12}@pdfcompress\\.local").isEqualTo(second.email());
        assertThat(first.displayName()).isEqualTo("API Key User");
    }

    @Test
    void missingOrUnknownKeyIsRejected() {
        configureKeys(key("alpha-key", "alpha@example.com", "Alpha", false));

        assertThatThrownBy(() -> resolver.authenticate(null))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage(IdentityResolver.UNAUTHORIZED_DETAIL);
        assertThatThrownBy(() -> resolver.authenticate("  "))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> resolver.authenticate("beta-key"))
                .isInstanceOf(UnauthorizedException.class)
                .satisfies(e -> assertThat(((UnauthorizedException) e).getErrorCode()).isEqualTo("unauthorized"));
    }

    @Test
    void existingPrincipalIsReused() {
        final Principal existing = principal("alpha@example.com", true);
        when(principalAtomicService.findByEmail("alpha@example.com")).thenReturn(Optional.of(existing));

        final Principal resolved = resolver.resolve(new CallerCredential("alpha@example.com", "Alpha", false, false));

        assertThat(resolved).isSameAs(existing);
        verify(principalAtomicService, never()).attemptToCreate(anyString(), anyString());
    }

    @Test
    void firstUseCreatesPrincipal() {
        final Principal created = principal("alpha@example.com", true);
        when(principalAtomicService.findByEmail("alpha@example.com")).thenReturn(Optional.empty());
        when(principalAtomicService.attemptToCreate("alpha@example.com", "Alpha")).thenReturn(created);

        assertThat(resolver.resolve(new CallerCredential("alpha@example.com", "Alpha", false, false)))
                .isSameAs(created);
    }

    @Test
    void lostCreationRaceReadsTheWinner() {
        final Principal winner = principal("alpha@example.com", true);
        when(principalAtomicService.findByEmail("alpha@example.com"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(principalAtomicService.attemptToCreate("alpha@example.com", "Alpha"))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThat(resolver.resolve(new CallerCredential("alpha@example.com", "Alpha", false, false)))
                .isSameAs(winner);
    }

    @Test
    void inactivePrincipalIsRejected() {
        when(principalAtomicService.findByEmail("gone@example.com"))
                .thenReturn(Optional.of(principal("gone@example.com", false)));

        assertThatThrownBy(() -> resolver.resolve(new CallerCredential("gone@example.com", "Gone", false, false)))
                .isInstanceOf(UnauthorizedException.class);
    }

    private void configureKeys(final PdfCompressorConfig.Security.ApiKey... keys) {
        config.getSecurity().setApiKeys(List.of(keys));
    }

    private static PdfCompressorConfig.Security.ApiKey key(final String value, final String email, final String name,
                                                           final boolean elevated) {
        final PdfCompressorConfig.Security.ApiKey key = new PdfCompressorConfig.Security.ApiKey();
        key.setKey(value);
        key.setEmail(email);
        key.setName(name);
        key.setElevated(elevated);
        return key;
    }

    private static Principal principal(final String email, final boolean active) {
        final Principal principal = new Principal();
        principal.setId(UUID.randomUUID());
        principal.setEmail(email);
        principal.setFullName("Test");
        principal.setActive(active);
        return principal;
    }
}
