package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which nodes never reach the markdown output.
 *
 * @author fengwk
 */
@Component
public class DropFilter {

    private static final Set<String> DROPPED_TAGS = Set.of("script", "style", "noscript", "button");

    private final Set<String> excludedClasses;
    private final Set<String> excludedIds;

    public DropFilter(ConvertProperties convertProperties) {
        this.excludedClasses = new HashSet<>(convertProperties.getExcludedClasses());
        this.excludedIds = new HashSet<>(convertProperties.getExcludedIds());
    }

    public boolean shouldDrop(Node node, boolean insideMainContent) {
        if (node instanceof Comment || node instanceof DataNode) {
            return true;
        }
        if (node instanceof Element element) {
            if (isExcludedElement(element)) {
                return true;
            }
        } else if (!(node instanceof TextNode)) {
            return true;
        }
        return !insideMainContent;
    }

    private boolean isExcludedElement(Element element) {
        if (DROPPED_TAGS.contains(element.normalName())) {
            return true;
        }
        if ("true".equalsIgnoreCase(element.attr("aria-hidden").trim())) {
            return true;
        }
        if (isHiddenByStyle(element.attr("style"))) {
            return true;
        }
        if (excludedIds.contains(element.id())) {
            return true;
        }
        for (String className : element.classNames()) {
            if (excludedClasses.contains(className)) {
                return true;
            }
        }
        return false;
    }

    private boolean isHiddenByStyle(String style) {
        if (style == null || style.isEmpty()) {
            return false;
        }
        String compact = style.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        return compact.contains("display:none") || compact.contains("visibility:hidden");
    }

}
