package fun.fengwk.c2md.core.service.convert.parser;

import org.springframework.util.StringUtils;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Anchor slug derivation.
 *
 * @author fengwk
 */
public final class Slugs {

    public static final String FALLBACK_SLUG = "section";

    private static final Pattern COMBINING_MARK_PATTERN = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC_PATTERN = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern EDGE_HYPHEN_PATTERN = Pattern.compile("^-+|-+$");

    private Slugs() {
    }

    /**
     * Lower-cases the text, strips diacritics and collapses every run of non-alphanumerics to one hyphen.
     */
    public static String slugify(String text) {
        if (!StringUtils.hasText(text)) {
            return FALLBACK_SLUG;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKD);
        normalized = COMBINING_MARK_PATTERN.matcher(normalized).replaceAll("");
        String slug = NON_ALPHANUMERIC_PATTERN.matcher(normalized.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = EDGE_HYPHEN_PATTERN.matcher(slug).replaceAll("");
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

}
