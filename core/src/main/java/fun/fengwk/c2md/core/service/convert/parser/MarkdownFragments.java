package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers shared by the element and table handlers.
 *
 * @author fengwk
 */
public final class MarkdownFragments {

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private static final Set<String> BLOCK_TAGS = Set.of(
        "p", "div", "h1", "h2", "h3", "h4", "h5", "h6",
        "ul", "ol", "li", "dl", "dt", "dd",
        "table", "thead", "tbody", "tfoot", "tr", "td", "th",
        "pre", "blockquote", "hr",
        "section", "article", "header", "footer", "main", "nav", "aside", "figure"
    );

    // blocks that would merge into preceding text without a blank line
    private static final Set<String> PARAGRAPH_TAGS = Set.of("p", "div", "section", "article", "figure");

    private MarkdownFragments() {
    }

    public static boolean isBlock(Node node) {
        return node instanceof Element element && BLOCK_TAGS.contains(element.normalName());
    }

    /**
     * True for nodes that separate lines, whitespace next to them carries no meaning.
     */
    public static boolean isLineBoundary(Node node) {
        return node == null || isBlock(node) || (node instanceof Element element && "br".equals(element.normalName()));
    }

    /**
     * Appends a child fragment, starting a new line when a block follows inline text.
     */
    public static void appendFragment(StringBuilder builder, Node child, String fragment, boolean inline) {
        if (fragment.isEmpty()) {
            return;
        }
        if (isBlock(child) && builder.length() > 0) {
            char last = builder.charAt(builder.length() - 1);
            if (inline) {
                if (!Character.isWhitespace(last) && !Character.isWhitespace(fragment.charAt(0))) {
                    builder.append(' ');
                }
            } else if (last != '\n' && fragment.charAt(0) != '\n') {
                builder.append(PARAGRAPH_TAGS.contains(((Element) child).normalName()) ? "\n\n" : "\n");
            }
        }
        builder.append(fragment);
    }

    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ");
    }

    /**
     * Single-line cell content with pipes escaped.
     */
    public static String escapeTableCell(String content) {
        return collapseWhitespace(content).trim().replace("|", "\\|");
    }

    /**
     * Prefixes every line with a blockquote marker.
     */
    public static String quote(String content) {
        StringBuilder builder = new StringBuilder();
        for (String line : content.split("\n", -1)) {
            builder.append(line.isBlank() ? ">" : "> " + line).append("\n");
        }
        return builder.toString();
    }

    /**
     * Text of an element with whitespace preserved and br as newline, used for code.
     */
    public static String rawText(Element element) {
        StringBuilder builder = new StringBuilder();
        appendRawText(element, builder);
        return builder.toString();
    }

    private static void appendRawText(Node node, StringBuilder builder) {
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode textNode) {
                builder.append(textNode.getWholeText());
            } else if (child instanceof Element element) {
                if ("br".equals(element.normalName())) {
                    builder.append("\n");
                } else {
                    appendRawText(element, builder);
                }
            }
        }
    }

}
