package fun.fengwk.c2md.core.service.convert.cleanup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line view of a markdown document that knows which lines belong to fenced code blocks.
 *
 * @author fengwk
 */
final class MarkdownLines {

    private static final Pattern FENCE_PATTERN = Pattern.compile("^ {0,3}(`{3,}|~{3,})(.*)$");
    private static final Pattern HEADING_PATTERN = Pattern.compile("^#{1,6}[ \\t]+\\S.*$");

    private final List<String> lines;
    private final boolean[] fenced;

    private MarkdownLines(List<String> lines) {
        this.lines = lines;
        this.fenced = fencedMask(lines);
    }

    static MarkdownLines of(String markdown) {
        return new MarkdownLines(new ArrayList<>(Arrays.asList(markdown.split("\n", -1))));
    }

    int size() {
        return lines.size();
    }

    String get(int index) {
        return lines.get(index);
    }

    boolean isFenced(int index) {
        return fenced[index];
    }

    List<String> lines() {
        return lines;
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    static boolean isHeading(String line) {
        return HEADING_PATTERN.matcher(line).matches();
    }

    /**
     * Marks fence delimiter lines and everything between them, an unclosed fence runs to the end.
     */
    private static boolean[] fencedMask(List<String> lines) {
        boolean[] mask = new boolean[lines.size()];
        String openFence = null;
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = FENCE_PATTERN.matcher(lines.get(i));
            if (openFence == null) {
                if (matcher.matches() && !(matcher.group(1).charAt(0) == '`' && matcher.group(2).contains("`"))) {
                    openFence = matcher.group(1);
                    mask[i] = true;
                }
                continue;
            }
            mask[i] = true;
            if (matcher.matches()
                && matcher.group(1).charAt(0) == openFence.charAt(0)
                && matcher.group(1).length() >= openFence.length()
                && matcher.group(2).isBlank()) {
                openFence = null;
            }
        }
        return mask;
    }

}
