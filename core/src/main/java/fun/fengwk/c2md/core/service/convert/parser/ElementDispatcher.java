package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.support.AssetPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive element walker producing the raw markdown of a content tree.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ElementDispatcher implements NodeConverter {

    private static final Set<String> PANEL_CLASSES = Set.of("panel", "aui-message", "confluence-information-macro");
    private static final Set<String> NON_PANEL_CLASSES = Set.of("code", "preformatted");
    private static final Set<String> LAYOUT_CLASSES = Set.of(
        "contentLayout", "contentLayout2", "columnLayout", "section", "cell", "innerCell", "layout-column");
    private static final Set<String> USER_LINK_CLASSES = Set.of("confluence-userlink", "user-mention");
    private static final String PANEL_TITLE_SELECTOR = ".panelHeader, .panel-header, .aui-message-header, p.title";
    private static final String PANEL_BODY_SELECTOR =
        ".panelContent, .panel-body, .aui-message-content, .confluence-information-macro-body";

    private static final Pattern HTML_WHITESPACE_PATTERN = Pattern.compile("[ \\t\\n\\r\\f]+");
    private static final Pattern LANGUAGE_CLASS_PATTERN = Pattern.compile("^(?:language|lang)-(.+)$");
    private static final Pattern BRUSH_PATTERN = Pattern.compile("brush:\\s*([\\w+#.-]+)");
    private static final Pattern PAGE_LINK_PATTERN = Pattern.compile("^([^?#:]+)\\.html?(?:\\?[^#]*)?(#.*)?$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern BACKTICK_RUN_PATTERN = Pattern.compile("`+");

    private final DropFilter dropFilter;
    private final TableRenderer tableRenderer;
    private final ImageRenderer imageRenderer;
    private final ConvertProperties convertProperties;

    @Override
    public String convert(Node node, ConversionContext context, ConversionScope scope) {
        if (dropFilter.shouldDrop(node, scope.insideMainContent())) {
            context.markProcessed(node);
            return "";
        }
        if (node instanceof TextNode textNode) {
            return convertText(textNode);
        }
        if (!(node instanceof Element element)) {
            return "";
        }
        if (!context.markProcessed(element)) {
            log.debug("skip processed element, path={}, tag={}", scope.path(), element.normalName());
            return "";
        }
        ConversionScope childScope = scope.child(element.normalName());
        ElementKind kind = ElementKind.fromTag(element.normalName());
        return switch (kind) {
            case HEADING -> convertHeading(element, context, childScope);
            case PARAGRAPH -> convertParagraph(element, context, childScope);
            case BOLD -> wrapInline(convertChildren(element, context, childScope), "**");
            case ITALIC -> wrapInline(convertChildren(element, context, childScope), "*");
            case STRIKETHROUGH -> wrapInline(convertChildren(element, context, childScope), "~~");
            case UNORDERED_LIST -> convertList(element, context, childScope, false);
            case ORDERED_LIST -> convertList(element, context, childScope, true);
            case LIST_ITEM -> convertStrayListItem(element, context, childScope);
            case LINK -> convertLink(element, context, childScope);
            case IMAGE -> convertImage(element, context, childScope);
            case CODE -> convertInlineCode(element, context);
            case PREFORMATTED -> convertPreformatted(element, context, childScope);
            case BLOCKQUOTE -> convertBlockquote(element, context, childScope);
            case DIV -> convertDiv(element, context, childScope);
            case TABLE -> convertTable(element, context, childScope);
            case BREAK -> childScope.inline() ? " " : "\n";
            case HORIZONTAL_RULE -> childScope.inline() ? " " : "\n\n---\n\n";
            case SPAN, UNKNOWN -> convertChildren(element, context, childScope);
        };
    }

    private String convertText(TextNode textNode) {
        String text = textNode.getWholeText();
        if (text.isEmpty()) {
            return "";
        }
        if (textNode.isBlank()) {
            boolean boundary = MarkdownFragments.isLineBoundary(textNode.previousSibling())
                || MarkdownFragments.isLineBoundary(textNode.nextSibling());
            return boundary ? "" : " ";
        }
        return HTML_WHITESPACE_PATTERN.matcher(text).replaceAll(" ");
    }

    private String convertHeading(Element element, ConversionContext context, ConversionScope scope) {
        String text = MarkdownFragments.collapseWhitespace(convertChildren(element, context, scope.asHeading())).trim();
        if (scope.inHeading() || scope.inline() || text.isEmpty()) {
            return text;
        }
        int level = element.normalName().charAt(1) - '0';
        String slug = context.getSlugRegistry().resolve(element);
        return "#".repeat(level) + " " + text + " {#" + slug + "}\n\n";
    }

    private String convertParagraph(Element element, ConversionContext context, ConversionScope scope) {
        String content = convertChildren(element, context, scope).strip();
        if (content.isEmpty()) {
            return "";
        }
        return scope.inline() ? content + " " : content + "\n\n";
    }

    private String wrapInline(String content, String marker) {
        if (content.isBlank()) {
            return content;
        }
        int start = 0;
        while (Character.isWhitespace(content.charAt(start))) {
            start++;
        }
        int end = content.length();
        while (Character.isWhitespace(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, start) + marker + content.substring(start, end) + marker + content.substring(end);
    }

    private String convertList(Element element, ConversionContext context, ConversionScope scope, boolean ordered) {
        StringBuilder builder = new StringBuilder();
        int number = ordered ? startNumber(element) : 0;
        for (Node child : element.childNodes()) {
            if (!(child instanceof Element item) || !"li".equals(item.normalName())) {
                appendStrayListChild(builder, child, context, scope);
                continue;
            }
            if (dropFilter.shouldDrop(item, scope.insideMainContent())) {
                context.markProcessed(item);
                continue;
            }
            if (!context.markProcessed(item)) {
                continue;
            }
            String content = convertChildren(item, context, scope.child("li")).strip();
            if (content.isEmpty()) {
                continue;
            }
            if (scope.inline()) {
                builder.append(MarkdownFragments.collapseWhitespace(content)).append(' ');
                continue;
            }
            String marker = ordered ? (number++) + ". " : "- ";
            appendIndented(builder, marker, content);
        }
        if (builder.length() == 0) {
            return "";
        }
        return scope.inline() ? builder.toString() : builder.append("\n").toString();
    }

    private void appendStrayListChild(StringBuilder builder, Node child, ConversionContext context, ConversionScope scope) {
        String fragment = convert(child, context, scope).strip();
        if (fragment.isEmpty()) {
            return;
        }
        if (scope.inline()) {
            builder.append(fragment).append(' ');
            return;
        }
        // markup like <ul><li>a</li><ul>...</ul></ul> nests under the previous item
        String indent = builder.length() == 0 ? "" : "  ";
        appendIndented(builder, indent, fragment);
    }

    private void appendIndented(StringBuilder builder, String marker, String content) {
        String indent = " ".repeat(marker.length());
        String[] lines = content.split("\n", -1);
        builder.append(marker).append(lines[0]).append("\n");
        for (int i = 1; i < lines.length; i++) {
            builder.append(lines[i].isBlank() ? "" : indent + lines[i]).append("\n");
        }
    }

    private int startNumber(Element list) {
        String start = list.attr("start").trim();
        if (start.isEmpty()) {
            return 1;
        }
        try {
            return Math.max(0, Integer.parseInt(start));
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

    private String convertStrayListItem(Element element, ConversionContext context, ConversionScope scope) {
        String content = convertChildren(element, context, scope).strip();
        if (content.isEmpty()) {
            return "";
        }
        return scope.inline() ? content + " " : content + "\n";
    }

    private String convertLink(Element element, ConversionContext context, ConversionScope scope) {
        ConversionScope textScope = scope.asInline();
        if (hasAnyClass(element, USER_LINK_CLASSES)) {
            return MarkdownFragments.collapseWhitespace(convertChildren(element, context, textScope));
        }
        StringBuilder text = new StringBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof Element image && "img".equals(image.normalName())) {
                boolean dropped = dropFilter.shouldDrop(image, scope.insideMainContent());
                if (context.markProcessed(image) && !dropped) {
                    text.append(imageRenderer.render(image, context, ImageRenderer.DEFAULT_ALT));
                }
                continue;
            }
            MarkdownFragments.appendFragment(text, child, convert(child, context, textScope), true);
        }
        String label = MarkdownFragments.collapseWhitespace(text.toString()).trim();
        String href = resolveHref(element.attr("href").trim(), context);
        if (label.isEmpty()) {
            label = href;
        }
        if (label.isEmpty()) {
            return "";
        }
        if (href.isEmpty()) {
            return label;
        }
        return "[" + label + "](" + href.replace(" ", "%20") + ")";
    }

    private String resolveHref(String href, ConversionContext context) {
        if (href.startsWith("#")) {
            return context.getSlugRegistry().resolveLink(href, context.getDocument());
        }
        if (!convertProperties.isRewritePageLinks() || AssetPaths.isRemote(href)) {
            return href;
        }
        Matcher matcher = PAGE_LINK_PATTERN.matcher(href);
        if (!matcher.matches()) {
            return href;
        }
        String fragment = matcher.group(2) == null ? "" : matcher.group(2);
        return matcher.group(1) + ".md" + fragment;
    }

    private String convertImage(Element element, ConversionContext context, ConversionScope scope) {
        String markdown = imageRenderer.render(element, context, ImageRenderer.DEFAULT_ALT);
        if (!markdown.isEmpty() && !scope.inline() && isOnlyContentOfParagraph(element)) {
            return markdown + "\n\n";
        }
        return markdown;
    }

    private boolean isOnlyContentOfParagraph(Element image) {
        Element parent = image.parent();
        if (parent == null || !"p".equals(parent.normalName())) {
            return false;
        }
        for (Node sibling : parent.childNodes()) {
            if (sibling == image) {
                continue;
            }
            if (sibling instanceof TextNode textNode && !textNode.isBlank()) {
                return false;
            }
            if (sibling instanceof Element other && !"br".equals(other.normalName())) {
                return false;
            }
        }
        return true;
    }

    private String convertInlineCode(Element element, ConversionContext context) {
        context.markSubtreeProcessed(element);
        String code = MarkdownFragments.rawText(element).replace('\n', ' ');
        if (code.isBlank()) {
            return code;
        }
        String fence = "`".repeat(longestBacktickRun(code) + 1);
        String padding = code.startsWith("`") || code.endsWith("`") ? " " : "";
        return fence + padding + code + padding + fence;
    }

    private String convertPreformatted(Element element, ConversionContext context, ConversionScope scope) {
        context.markSubtreeProcessed(element);
        String code = MarkdownFragments.rawText(element).stripTrailing();
        while (code.startsWith("\n")) {
            code = code.substring(1);
        }
        if (code.isBlank()) {
            return "";
        }
        if (scope.inline()) {
            return MarkdownFragments.collapseWhitespace(code);
        }
        String fence = "`".repeat(Math.max(3, longestBacktickRun(code) + 1));
        return fence + detectLanguage(element) + "\n" + code + "\n" + fence + "\n\n";
    }

    private int longestBacktickRun(String text) {
        int longest = 0;
        Matcher matcher = BACKTICK_RUN_PATTERN.matcher(text);
        while (matcher.find()) {
            longest = Math.max(longest, matcher.group().length());
        }
        return longest;
    }

    private String detectLanguage(Element pre) {
        Element code = pre.selectFirst("code");
        for (Element candidate : code == null ? new Element[] {pre} : new Element[] {pre, code}) {
            String language = candidate.attr("data-language").trim();
            if (!language.isEmpty()) {
                return language;
            }
            for (String className : candidate.classNames()) {
                Matcher matcher = LANGUAGE_CLASS_PATTERN.matcher(className);
                if (matcher.matches()) {
                    return matcher.group(1);
                }
            }
        }
        Matcher brush = BRUSH_PATTERN.matcher(pre.attr("data-syntaxhighlighter-params"));
        return brush.find() ? brush.group(1) : "";
    }

    private String convertBlockquote(Element element, ConversionContext context, ConversionScope scope) {
        String content = convertChildren(element, context, scope).strip();
        if (content.isEmpty()) {
            return "";
        }
        if (scope.inline()) {
            return MarkdownFragments.collapseWhitespace(content) + " ";
        }
        return MarkdownFragments.quote(content) + "\n";
    }

    private String convertDiv(Element element, ConversionContext context, ConversionScope scope) {
        if (hasAnyClass(element, PANEL_CLASSES) && !hasAnyClass(element, NON_PANEL_CLASSES)) {
            return convertPanel(element, context, scope);
        }
        if (hasAnyClass(element, LAYOUT_CLASSES)) {
            return convertLayout(element, context, scope);
        }
        String content = convertChildren(element, context, scope);
        if (scope.inline() || content.isBlank() || content.endsWith("\n")) {
            return content;
        }
        return content.strip() + "\n\n";
    }

    private String convertPanel(Element element, ConversionContext context, ConversionScope scope) {
        String title = "";
        Element titleElement = element.selectFirst(PANEL_TITLE_SELECTOR);
        if (titleElement != null && !context.isProcessed(titleElement)) {
            title = MarkdownFragments.collapseWhitespace(
                convertChildren(titleElement, context, scope.child("title").asInline())).trim();
            context.markSubtreeProcessed(titleElement);
        }
        String body;
        Element bodyElement = element.selectFirst(PANEL_BODY_SELECTOR);
        if (bodyElement != null && context.markProcessed(bodyElement)) {
            body = convertChildren(bodyElement, context, scope.child(bodyElement.normalName()));
        } else {
            body = convertChildren(element, context, scope);
        }
        StringBuilder builder = new StringBuilder();
        if (!title.isEmpty()) {
            builder.append("**").append(title).append("**\n\n");
        }
        builder.append(body.strip());
        String inner = builder.toString().strip();
        if (inner.isEmpty()) {
            return "";
        }
        if (scope.inline()) {
            return MarkdownFragments.collapseWhitespace(inner) + " ";
        }
        return MarkdownFragments.quote(inner) + "\n";
    }

    private String convertLayout(Element element, ConversionContext context, ConversionScope scope) {
        StringBuilder builder = new StringBuilder();
        for (Node child : element.childNodes()) {
            String fragment = convert(child, context, scope);
            if (fragment.isBlank()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(scope.inline() ? " " : "\n");
            }
            builder.append(fragment);
        }
        return builder.toString();
    }

    private String convertTable(Element element, ConversionContext context, ConversionScope scope) {
        if (scope.inline()) {
            context.markSubtreeProcessed(element);
            return MarkdownFragments.collapseWhitespace(element.text()) + " ";
        }
        return tableRenderer.render(element, context, scope, this);
    }

    private boolean hasAnyClass(Element element, Set<String> classNames) {
        for (String className : element.classNames()) {
            if (classNames.contains(className)) {
                return true;
            }
        }
        return false;
    }

}
