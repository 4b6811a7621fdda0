package fun.fengwk.c2md.core.service.convert.cleanup;

import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs every {@link CleanupPass} once, in order, over an assembled markdown page.
 *
 * <p>A leading yaml front matter block is kept as is.
 *
 * @author fengwk
 */
@Component
public class MarkdownCleanupPipeline {

    private static final String FRONT_MATTER_DELIMITER = "---";

    public String clean(String markdown) {
        return clean(markdown, List.of());
    }

    public String clean(String markdown, List<Breadcrumb> breadcrumbs) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        List<Breadcrumb> resolvedBreadcrumbs = breadcrumbs == null ? List.of() : breadcrumbs;
        String normalized = trimLeadingBlankLines(CleanupPass.NORMALIZE_LINE_ENDINGS.apply(markdown));
        boolean hadFrontMatter = frontMatterEnd(normalized) > 0;
        String cleaned = cleanOnce(normalized, resolvedBreadcrumbs);
        // passes may surface a leading delimiter pair, which the next run reads as front matter
        if (!hadFrontMatter && frontMatterEnd(cleaned) > 0) {
            cleaned = cleanOnce(cleaned, resolvedBreadcrumbs);
        }
        return cleaned;
    }

    private String cleanOnce(String normalized, List<Breadcrumb> breadcrumbs) {
        int bodyStart = frontMatterEnd(normalized);
        String frontMatter = normalized.substring(0, bodyStart);
        if (!frontMatter.isEmpty() && !frontMatter.endsWith("\n")) {
            frontMatter = frontMatter + "\n";
        }
        String body = normalized.substring(bodyStart);
        for (CleanupPass pass : CleanupPass.values()) {
            body = pass.apply(body, breadcrumbs);
        }
        body = trimBlankLines(body);
        if (frontMatter.isEmpty()) {
            return body;
        }
        return body.isEmpty() ? frontMatter : frontMatter + "\n" + body;
    }

    /**
     * Index right after the closing front matter delimiter line, 0 when there is none.
     */
    private int frontMatterEnd(String markdown) {
        if (!markdown.startsWith(FRONT_MATTER_DELIMITER + "\n")) {
            return 0;
        }
        int lineStart = FRONT_MATTER_DELIMITER.length() + 1;
        while (lineStart < markdown.length()) {
            int lineEnd = markdown.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? markdown.substring(lineStart) : markdown.substring(lineStart, lineEnd);
            if (FRONT_MATTER_DELIMITER.equals(line.stripTrailing())) {
                return lineEnd < 0 ? markdown.length() : lineEnd + 1;
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        return 0;
    }

    private String trimBlankLines(String body) {
        if (body.isBlank()) {
            return "";
        }
        return trimLeadingBlankLines(body).stripTrailing() + "\n";
    }

    /**
     * Drops leading blank lines, keeping the indentation of the first non-blank line.
     */
    private String trimLeadingBlankLines(String text) {
        int start = 0;
        int index = 0;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            if (text.charAt(index) == '\n') {
                start = index + 1;
            }
            index++;
        }
        return text.substring(start);
    }

}
