package com.eyelevel.pdfcompressor.service.identity;

/**
 * An authenticated, not yet persisted caller identity produced by {@link IdentityResolver#authenticate(String)}.
 *
 * @param email       the principal's unique email address
 * @param displayName the display name used when the principal is first created
 * @param elevated    whether the caller may read jobs of other principals
 * @param anonymous   {@code true} when no API keys are configured at all
 */
public record CallerCredential(String email, String displayName, boolean elevated, boolean anonymous) {
}
