package fun.fengwk.c2md.core.service.convert.support;

import org.springframework.util.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for src and href values found in exported pages.
 *
 * @author fengwk
 */
public final class AssetPaths {

    private static final Pattern INVALID_ESCAPE_PATTERN = Pattern.compile("%(?![0-9A-Fa-f]{2})");

    private AssetPaths() {
    }

    /**
     * Returns true for references that point outside the export, such as http urls or inline data.
     */
    public static boolean isRemote(String reference) {
        if (!StringUtils.hasText(reference)) {
            return false;
        }
        String lower = reference.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://")
            || lower.startsWith("https://")
            || lower.startsWith("//")
            || lower.startsWith("data:")
            || lower.startsWith("mailto:");
    }

    /**
     * Prefixes a bare relative path with ./ so it is explicitly relative.
     */
    public static String toExplicitRelative(String reference) {
        if (!StringUtils.hasText(reference)) {
            return "";
        }
        String trimmed = reference.trim();
        if (isRemote(trimmed)
            || trimmed.startsWith("/")
            || trimmed.startsWith("./")
            || trimmed.startsWith("../")
            || trimmed.startsWith("#")
            || hasScheme(trimmed)) {
            return trimmed;
        }
        return "./" + trimmed;
    }

    /**
     * Strips query and fragment, decodes percent escapes and the leading ./ for filesystem lookup.
     */
    public static String sanitize(String reference) {
        if (!StringUtils.hasText(reference)) {
            return "";
        }
        String path = stripQuery(reference);
        if (path.indexOf('%') >= 0 && !INVALID_ESCAPE_PATTERN.matcher(path).find()) {
            path = URLDecoder.decode(path.replace("+", "%2B"), StandardCharsets.UTF_8);
        }
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path;
    }

    /**
     * Drops query and fragment, keeping percent escapes as written.
     */
    public static String stripQuery(String reference) {
        if (!StringUtils.hasText(reference)) {
            return "";
        }
        String path = reference.trim();
        int cut = indexOfAny(path, '?', '#');
        return cut >= 0 ? path.substring(0, cut) : path;
    }

    /**
     * Last path segment of a reference.
     */
    public static String fileName(String reference) {
        String sanitized = sanitize(reference);
        int slash = sanitized.lastIndexOf('/');
        return slash >= 0 ? sanitized.substring(slash + 1) : sanitized;
    }

    private static boolean hasScheme(String reference) {
        int colon = reference.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        for (int i = 0; i < colon; i++) {
            char c = reference.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') {
                return false;
            }
        }
        return true;
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }

}
