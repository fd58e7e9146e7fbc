package net.cratedigger.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Normalizes free-form genre and style labels into stable slugs.
 *
 * <p>"Progressive Rock", "progressive  rock" and "Progressive-Rock!" all map to
 * {@code progressive-rock}. Slugs are the comparison key for style filters.</p>
 */
public final class StyleSlugs {

    /** Separators that split a compound genre field such as {@code "Rock / Jazz, Soul"}. */
    private static final Pattern TAG_SEPARATOR = Pattern.compile("\\s*[/,;]\\s*");

    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private StyleSlugs() {
    }

    /**
     * Converts a display label to its slug.
     *
     * @param label raw label, may be {@code null}
     * @return lowercase hyphenated slug, or an empty string when nothing usable remains
     */
    public static String slugify(String label) {
        if (!StringUtils.hasText(label)) {
            return "";
        }
        String lowered = label.trim().toLowerCase(Locale.ROOT);
        String hyphenated = NON_SLUG_CHARS.matcher(lowered).replaceAll("-");
        return trimHyphens(hyphenated);
    }

    /**
     * Splits a compound genre field into its non-blank tags, in order.
     */
    public static List<String> splitTags(String genreField) {
        if (!StringUtils.hasText(genreField)) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        for (String part : TAG_SEPARATOR.split(genreField.trim())) {
            if (StringUtils.hasText(part)) {
                tags.add(part.trim());
            }
        }
        return tags;
    }

    private static String trimHyphens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
