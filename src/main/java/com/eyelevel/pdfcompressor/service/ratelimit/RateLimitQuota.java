package com.eyelevel.pdfcompressor.service.ratelimit;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed quota such as {@code "10 per minute"}.
 *
 * @param permits number of calls admitted per period, at least one
 * @param period  length of one window
 * @param unit    the unit as written, singular and lower case
 */
public record RateLimitQuota(int permits, Duration period, String unit) {

    private static final Pattern QUOTA = Pattern.compile("^\\s*(\\d+)\\s*(?:per|/)\\s*(second|minute|hour|day)s?\\s*$",
                                                         Pattern.CASE_INSENSITIVE);

    /**
     * @throws IllegalArgumentException when the value is not of the form {@code "N per <second|minute|hour|day>"}
     *                                  or N is zero
     */
    public static RateLimitQuota parse(final String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rate limit quota must not be null");
        }
        final Matcher matcher = QUOTA.matcher(value);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed rate limit quota: '" + value + "'");
        }
        final int permits;
        try {
            permits = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Rate limit quota count is too large: '" + value + "'", e);
        }
        if (permits < 1) {
            throw new IllegalArgumentException("Rate limit quota must admit at least one call: '" + value + "'");
        }
        final String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        final Duration period = switch (unit) {
            case "second" -> Duration.ofSeconds(1);
            case "minute" -> Duration.ofMinutes(1);
            case "hour" -> Duration.ofHours(1);
            case "day" -> Duration.ofDays(1);
            default -> throw new IllegalArgumentException("Unsupported rate limit unit: " + unit);
        };
        return new RateLimitQuota(permits, period, unit);
    }

    @Override
    public String toString() {
        return permits + " per " + unit;
    }
}
