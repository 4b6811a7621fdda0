package fun.fengwk.c2md.core.service.convert.cleanup;

import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a leading numbered list of breadcrumb links into a navigation section.
 *
 * @author fengwk
 */
final class NavigationBlock {

    static final String HEADING = "## Navigation";

    private static final Pattern ITEM_PATTERN = Pattern.compile("^\\d+\\.[ \\t]+\\[([^\\]]*)]\\(([^)\\s]*)\\)[ \\t]*$");

    private NavigationBlock() {
    }

    static String convert(String markdown, List<Breadcrumb> breadcrumbs) {
        MarkdownLines lines = MarkdownLines.of(markdown);
        int start = 0;
        while (start < lines.size() && lines.get(start).isBlank()) {
            start++;
        }
        List<String> items = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        int end = start;
        while (end < lines.size() && !lines.isFenced(end)) {
            Matcher matcher = ITEM_PATTERN.matcher(lines.get(end));
            if (!matcher.matches()) {
                break;
            }
            items.add("- [" + matcher.group(1) + "](" + matcher.group(2) + ")");
            texts.add(matcher.group(1).trim());
            targets.add(matcher.group(2));
            end++;
        }
        if (items.isEmpty() || !isConfirmed(texts, targets, breadcrumbs)) {
            return markdown;
        }
        List<String> output = new ArrayList<>(lines.lines().subList(0, start));
        output.add(HEADING);
        output.add("");
        output.addAll(items);
        if (end < lines.size() && !lines.get(end).isBlank()) {
            output.add("");
        }
        output.addAll(lines.lines().subList(end, lines.size()));
        return MarkdownLines.join(output);
    }

    private static boolean isConfirmed(List<String> texts, List<String> targets, List<Breadcrumb> breadcrumbs) {
        if (breadcrumbs != null && !breadcrumbs.isEmpty()) {
            Set<String> titles = new HashSet<>();
            for (Breadcrumb breadcrumb : breadcrumbs) {
                if (breadcrumb.title() != null) {
                    titles.add(breadcrumb.title().trim());
                }
            }
            return titles.containsAll(texts);
        }
        for (String target : targets) {
            String path = target.toLowerCase(Locale.ROOT);
            int fragment = path.indexOf('#');
            if (fragment >= 0) {
                path = path.substring(0, fragment);
            }
            if (!path.endsWith(".md") && !path.endsWith(".html")) {
                return false;
            }
        }
        return true;
    }

}
