package fun.fengwk.c2md.core.service.convert.cleanup;

import org.jsoup.parser.Parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes html entities left in markdown text.
 *
 * <p>Decoded characters that carry markdown structure are backslash-escaped, and entities that decode to
 * whitespace, control or zero-width characters stay literal, so decoding never creates new headings,
 * table cells, list markers or fences.
 *
 * @author fengwk
 */
final class EntityDecoder {

    private static final Pattern ENTITY_PATTERN =
        Pattern.compile("&(?:#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6}|[a-zA-Z][a-zA-Z0-9]{1,31});");
    private static final String ESCAPED_CHARACTERS = "\\`~#|-";

    private EntityDecoder() {
    }

    static String decode(String markdown) {
        MarkdownLines lines = MarkdownLines.of(markdown);
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.isFenced(i)) {
                lines.lines().set(i, decodeLine(lines.get(i)));
            }
        }
        return MarkdownLines.join(lines.lines());
    }

    private static String decodeLine(String line) {
        String current = line;
        while (current.indexOf('&') >= 0) {
            String next = decodeOnce(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return current;
    }

    private static String decodeOnce(String line) {
        Matcher matcher = ENTITY_PATTERN.matcher(line);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(builder, Matcher.quoteReplacement(decodeEntity(matcher.group())));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String decodeEntity(String entity) {
        String decoded = Parser.unescapeEntities(entity, false);
        if (decoded.equals(entity) || decoded.isEmpty()) {
            return entity;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < decoded.length(); ) {
            int codePoint = decoded.codePointAt(i);
            if (isInvisible(codePoint)) {
                return entity;
            }
            if (ESCAPED_CHARACTERS.indexOf(codePoint) >= 0) {
                builder.append('\\');
            }
            builder.appendCodePoint(codePoint);
            i += Character.charCount(codePoint);
        }
        return builder.toString();
    }

    private static boolean isInvisible(int codePoint) {
        return codePoint == ' '
            || Character.isISOControl(codePoint)
            || codePoint == '\uFEFF'
            || codePoint == '\u200B'
            || codePoint == '\u2060';
    }

}
