package fun.fengwk.c2md.core.service.convert.cleanup;

import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-document markdown transforms, applied in declaration order.
 *
 * <p>Every pass is pure and idempotent. Line based passes leave fenced code blocks untouched.
 *
 * @author fengwk
 */
public enum CleanupPass implements UnaryOperator<String> {

    NORMALIZE_LINE_ENDINGS {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            return markdown.replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace("\uFEFF", "")
                .replace("\u200B", "")
                .replace("\u2060", "");
        }
    },

    /**
     * {@code # ## Title} becomes {@code ## Title}, the deeper level wins and a merged heading is at least level 2.
     */
    COLLAPSE_HEADING_MARKERS {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            MarkdownLines lines = MarkdownLines.of(markdown);
            for (int i = 0; i < lines.size(); i++) {
                if (lines.isFenced(i)) {
                    continue;
                }
                String line = lines.get(i);
                Matcher matcher = DOUBLE_HEADING_PATTERN.matcher(line);
                while (matcher.matches()) {
                    int level = Math.min(6, Math.max(2, Math.max(matcher.group(1).length(), matcher.group(2).length())));
                    String rest = matcher.group(3);
                    line = "#".repeat(level) + (rest == null || rest.isEmpty() ? "" : " " + rest);
                    matcher = DOUBLE_HEADING_PATTERN.matcher(line);
                }
                lines.lines().set(i, line);
            }
            return MarkdownLines.join(lines.lines());
        }
    },

    /**
     * Unwraps headings around list markers and keeps a blank line on both sides of every heading.
     */
    SEPARATE_HEADINGS {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            MarkdownLines lines = MarkdownLines.of(markdown);
            for (int i = 0; i < lines.size(); i++) {
                if (!lines.isFenced(i)) {
                    Matcher matcher = HEADING_LIST_ITEM_PATTERN.matcher(lines.get(i));
                    if (matcher.matches()) {
                        lines.lines().set(i, matcher.group(1));
                    }
                }
            }
            List<String> output = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                boolean heading = !lines.isFenced(i) && MarkdownLines.isHeading(line);
                if (heading && !output.isEmpty() && !output.get(output.size() - 1).isBlank()) {
                    output.add("");
                }
                output.add(line);
                if (heading && i + 1 < lines.size() && !lines.get(i + 1).isBlank()) {
                    output.add("");
                }
            }
            return MarkdownLines.join(output);
        }
    },

    REPAIR_TABLES {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            return TableRepairer.repair(markdown);
        }
    },

    DECODE_ENTITIES {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            return EntityDecoder.decode(markdown);
        }
    },

    /**
     * Strips trailing whitespace and keeps at most two consecutive blank lines.
     */
    COLLAPSE_BLANK_LINES {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            MarkdownLines lines = MarkdownLines.of(markdown);
            List<String> output = new ArrayList<>();
            int blankRun = 0;
            for (int i = 0; i < lines.size(); i++) {
                if (lines.isFenced(i)) {
                    output.add(lines.get(i));
                    blankRun = 0;
                    continue;
                }
                String line = lines.get(i).stripTrailing();
                if (line.isEmpty()) {
                    blankRun++;
                    if (blankRun > MAX_BLANK_LINES) {
                        continue;
                    }
                } else {
                    blankRun = 0;
                }
                output.add(line);
            }
            return MarkdownLines.join(output);
        }
    },

    NAVIGATION_BLOCK {
        @Override
        public String apply(String markdown, List<Breadcrumb> breadcrumbs) {
            return NavigationBlock.convert(markdown, breadcrumbs);
        }
    };

    private static final int MAX_BLANK_LINES = 2;
    private static final Pattern DOUBLE_HEADING_PATTERN = Pattern.compile("^(#{1,6})[ \\t]+(#{1,6})(?:[ \\t]+(.*))?$");
    private static final Pattern HEADING_LIST_ITEM_PATTERN = Pattern.compile("^#{1,6}[ \\t]+(- .*)$");

    public abstract String apply(String markdown, List<Breadcrumb> breadcrumbs);

    @Override
    public String apply(String markdown) {
        return apply(markdown, List.of());
    }

}
