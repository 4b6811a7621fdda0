package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.util.StringUtils;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-document heading anchors and same-document link resolution.
 *
 * <p>Generated ids live in this registry keyed by node identity, the parsed tree is never mutated.
 * Derived slugs are unique per document, later headings with the same text get -2, -3 and so on,
 * and never take an explicit heading id of the document.
 *
 * @author fengwk
 */
public class SlugRegistry {

    private static final Pattern HEADING_TAG_PATTERN = Pattern.compile("h[1-6]");
    private static final Pattern INVALID_ESCAPE_PATTERN = Pattern.compile("%(?![0-9A-Fa-f]{2})");
    private static final String TOC_CONTAINER_SELECTOR = "[data-macro-name=toc], .toc-macro";

    private final Map<Element, String> derivedSlugs = new IdentityHashMap<>();
    private final Map<Element, String> assignedIds = new IdentityHashMap<>();
    private final Set<String> usedSlugs = new HashSet<>();

    public SlugRegistry() {
    }

    /**
     * Reserves the explicit heading ids of the document up front.
     */
    public SlugRegistry(Document document) {
        if (document == null) {
            return;
        }
        for (Element heading : document.select("h1, h2, h3, h4, h5, h6")) {
            String id = heading.id().trim();
            if (StringUtils.hasText(id)) {
                usedSlugs.add(id);
            }
        }
    }

    /**
     * Anchor of a heading: its explicit id when present, otherwise the text-derived slug.
     */
    public String resolve(Element heading) {
        String id = idOf(heading);
        if (StringUtils.hasText(id)) {
            usedSlugs.add(id);
            return id;
        }
        return anchorFor(heading);
    }

    /**
     * Text-derived slug of an element, assigned on first request and stable afterwards.
     */
    public String anchorFor(Element element) {
        String existing = derivedSlugs.get(element);
        if (existing != null) {
            return existing;
        }
        String base = Slugs.slugify(element.text());
        String slug = base;
        int suffix = 2;
        while (!usedSlugs.add(slug)) {
            slug = base + "-" + suffix++;
        }
        derivedSlugs.put(element, slug);
        return slug;
    }

    /**
     * Rewrites a same-document fragment href, other hrefs pass through unchanged.
     */
    public String resolveLink(String href, Document document) {
        if (href == null || document == null || !href.startsWith("#") || href.length() == 1) {
            return href;
        }
        String fragment = decodeFragment(href.substring(1));
        Element target = document.getElementById(fragment);
        boolean foundByName = false;
        if (target == null) {
            target = document.getElementsByAttributeValue("name", fragment).first();
            foundByName = target != null;
        }
        if (target == null) {
            return href;
        }
        if (isHeading(target) || target.closest(TOC_CONTAINER_SELECTOR) != null) {
            return "#" + anchorFor(target);
        }
        if (foundByName && !StringUtils.hasText(target.id())) {
            assignedIds.putIfAbsent(target, fragment);
            return "#" + assignedIds.get(target);
        }
        return href;
    }

    /**
     * Explicit or assigned id of an element, empty when it has none.
     */
    public String idOf(Element element) {
        String assigned = assignedIds.get(element);
        if (assigned != null) {
            return assigned;
        }
        return element.id().trim();
    }

    private boolean isHeading(Element element) {
        return HEADING_TAG_PATTERN.matcher(element.normalName()).matches();
    }

    private String decodeFragment(String fragment) {
        if (fragment.indexOf('%') < 0 || INVALID_ESCAPE_PATTERN.matcher(fragment).find()) {
            return fragment;
        }
        return URLDecoder.decode(fragment.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

}
