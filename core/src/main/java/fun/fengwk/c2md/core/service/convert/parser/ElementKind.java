package fun.fengwk.c2md.core.service.convert.parser;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Element kinds understood by the dispatcher.
 *
 * @author fengwk
 */
public enum ElementKind {

    HEADING("h1", "h2", "h3", "h4", "h5", "h6"),
    PARAGRAPH("p"),
    BOLD("strong", "b"),
    ITALIC("em", "i"),
    STRIKETHROUGH("del", "s", "strike"),
    UNORDERED_LIST("ul"),
    ORDERED_LIST("ol"),
    LIST_ITEM("li"),
    LINK("a"),
    IMAGE("img"),
    CODE("code"),
    PREFORMATTED("pre"),
    BLOCKQUOTE("blockquote"),
    DIV("div"),
    TABLE("table"),
    BREAK("br"),
    HORIZONTAL_RULE("hr"),
    SPAN("span"),
    UNKNOWN;

    private static final Map<String, ElementKind> BY_TAG = new HashMap<>();

    static {
        for (ElementKind kind : values()) {
            for (String tag : kind.tags) {
                BY_TAG.put(tag, kind);
            }
        }
    }

    private final String[] tags;

    ElementKind(String... tags) {
        this.tags = tags;
    }

    public static ElementKind fromTag(String tagName) {
        if (tagName == null) {
            return UNKNOWN;
        }
        return BY_TAG.getOrDefault(tagName.toLowerCase(Locale.ROOT), UNKNOWN);
    }

}
