package com.telefonchi.database.migration;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/** Rules for migration identifiers: validation, slug sanitizing and timestamp prefixes. */
public final class MigrationIdentifiers {

    /** {@code yyyyMMdd}, optional {@code _HHmmss}, then a lowercase slug. */
    public static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("\\d{8}(?:_\\d{6})?_[a-z0-9]+(?:_[a-z0-9]+)*");

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private MigrationIdentifiers() {
        // utility class
    }

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER_PATTERN.matcher(identifier).matches();
    }

    /**
     * @throws DiscoveryException if the identifier is null or does not match {@link
     *     #IDENTIFIER_PATTERN}
     */
    public static String requireValid(String identifier) {
        if (!isValid(identifier)) {
            throw new DiscoveryException(
                    "Malformed migration identifier '%s': expected <yyyyMMdd>[_<HHmmss>]_<slug>"
                            .formatted(identifier));
        }
        return identifier;
    }

    /**
     * Lowercases the slug, collapses every run of non-alphanumeric characters to one underscore and
     * trims underscores from both ends. {@code "Add City & Phone!"} becomes {@code
     * add_city_phone}.
     *
     * @throws IllegalArgumentException if nothing usable is left
     */
    public static String sanitizeSlug(String slug) {
        if (slug == null) {
            throw new IllegalArgumentException("slug must not be null");
        }
        String sanitized = NON_ALPHANUMERIC.matcher(slug.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = sanitized.length();
        while (start < end && sanitized.charAt(start) == '_') {
            start++;
        }
        while (end > start && sanitized.charAt(end - 1) == '_') {
            end--;
        }
        sanitized = sanitized.substring(start, end);
        if (sanitized.isEmpty()) {
            throw new IllegalArgumentException(
                    "slug '%s' contains no letters or digits".formatted(slug));
        }
        return sanitized;
    }

    /** Builds {@code <yyyyMMdd_HHmmss>_<sanitized slug>}. */
    public static String generate(LocalDateTime timestamp, String slug) {
        return TIMESTAMP_FORMAT.format(timestamp) + "_" + sanitizeSlug(slug);
    }
}
