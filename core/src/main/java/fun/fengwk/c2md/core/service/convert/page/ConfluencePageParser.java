package fun.fengwk.c2md.core.service.convert.page;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import fun.fengwk.c2md.core.service.convert.model.PageMetadata;
import fun.fengwk.c2md.core.service.convert.parser.TableClassifier;
import fun.fengwk.c2md.core.service.convert.support.AssetPaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts page level information from a Confluence export page.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfluencePageParser {

    public static final String UNTITLED_PAGE = "Untitled Page";

    private static final List<String> TITLE_SELECTORS = List.of(
        "#title-text",
        ".pagetitle",
        "#title-heading .page-title",
        "#title-heading",
        "h1"
    );

    private static final List<String> BREADCRUMB_SELECTORS = List.of(
        "#breadcrumbs li",
        ".breadcrumb-section ol li",
        ".aui-breadcrumb li"
    );

    private static final List<String> ATTACHMENT_SELECTORS = List.of(
        "[data-linked-resource-type=attachment]",
        "img[src*=attachments/]",
        ".greybox a[href]",
        "a.confluence-embedded-file[href]"
    );

    private static final String METADATA_SELECTOR = ".page-metadata";
    private static final String TITLE_SEPARATOR = " : ";
    private static final Pattern CREATED_BY_PATTERN = Pattern.compile("(?i)created by\\s+(.+?)(?:\\s+on\\s+|,|$)");
    private static final Pattern CREATED_DATE_PATTERN = Pattern.compile("(?i)created by\\s+[^,]+?\\s+on\\s+(.+?)(?:,\\s*last\\s|$)");
    private static final Pattern LAST_MODIFIED_PATTERN = Pattern.compile("(?i)last (?:modified|updated)(?:\\s+by\\s+.+?)?\\s+on\\s+(.+)$");
    private static final Pattern PAGE_LINK_PATTERN = Pattern.compile("^(.+)\\.html?$", Pattern.CASE_INSENSITIVE);

    private final ConvertProperties convertProperties;
    private final TableClassifier tableClassifier;

    public PageMetadata extractMetadata(Document document) {
        String metadataText = "";
        Element metadata = document.selectFirst(METADATA_SELECTOR);
        if (metadata != null) {
            metadataText = metadata.text().trim();
        }
        return PageMetadata.builder()
            .title(extractTitle(document))
            .createdBy(firstGroup(CREATED_BY_PATTERN, metadataText))
            .createdDate(firstGroup(CREATED_DATE_PATTERN, metadataText))
            .lastModified(firstGroup(LAST_MODIFIED_PATTERN, metadataText))
            .breadcrumbs(extractBreadcrumbs(document))
            .attachments(extractAttachments(document))
            .build();
    }

    /**
     * The article body, the document body when no candidate selector matches.
     */
    public Element findMainContent(Document document) {
        for (String selector : convertProperties.getMainContentSelectors()) {
            Element candidate = selectFirstSafely(document, selector);
            if (candidate != null) {
                return candidate;
            }
        }
        return document.body();
    }

    public Element findTitleElement(Document document) {
        for (String selector : TITLE_SELECTORS) {
            Element candidate = document.selectFirst(selector);
            if (candidate != null && StringUtils.hasText(candidate.text())) {
                return candidate;
            }
        }
        return null;
    }

    public String extractTitle(Document document) {
        Element titleElement = findTitleElement(document);
        String title = titleElement != null ? titleElement.text().trim() : document.title().trim();
        int separator = title.lastIndexOf(TITLE_SEPARATOR);
        if (separator >= 0) {
            title = title.substring(separator + TITLE_SEPARATOR.length()).trim();
        }
        return title.isEmpty() ? UNTITLED_PAGE : title;
    }

    public List<Breadcrumb> extractBreadcrumbs(Document document) {
        for (String selector : BREADCRUMB_SELECTORS) {
            Elements items = document.select(selector);
            List<Breadcrumb> breadcrumbs = new ArrayList<>();
            for (Element item : items) {
                String text = item.text().trim();
                if (text.isEmpty()) {
                    continue;
                }
                Element link = item.selectFirst("a[href]");
                breadcrumbs.add(new Breadcrumb(text, link == null ? "" : normalizeBreadcrumbHref(link.attr("href"))));
            }
            if (!breadcrumbs.isEmpty()) {
                return breadcrumbs;
            }
        }
        return List.of();
    }

    public List<String> extractAttachments(Document document) {
        Set<String> attachments = new LinkedHashSet<>();
        for (String selector : ATTACHMENT_SELECTORS) {
            for (Element element : document.select(selector)) {
                String reference = element.hasAttr("href") ? element.attr("href") : element.attr("src");
                if (!StringUtils.hasText(reference) || AssetPaths.isRemote(reference)) {
                    continue;
                }
                String path = AssetPaths.sanitize(reference);
                if (!path.isEmpty() && !path.startsWith("images/icons/")) {
                    attachments.add(path);
                }
            }
        }
        return new ArrayList<>(attachments);
    }

    /**
     * The revision history table of the page, null when the page has none.
     */
    public Element findHistoryTable(Document document) {
        Element container = document.getElementById("page-history-container");
        if (container != null) {
            Element table = "table".equals(container.normalName()) ? container : container.selectFirst("table");
            if (table != null) {
                return table;
            }
        }
        for (Element table : document.getElementsByTag("table")) {
            if (tableClassifier.isHistoryTable(table)) {
                return table;
            }
        }
        return null;
    }

    private String normalizeBreadcrumbHref(String href) {
        String path = AssetPaths.sanitize(href);
        if (path.isEmpty() || AssetPaths.isRemote(href)) {
            return href.trim();
        }
        int slash = path.lastIndexOf('/');
        String fileName = slash >= 0 ? path.substring(slash + 1) : path;
        Matcher matcher = PAGE_LINK_PATTERN.matcher(fileName);
        if (convertProperties.isRewritePageLinks() && matcher.matches()) {
            fileName = matcher.group(1) + ".md";
        }
        return "./" + fileName.replace(" ", "%20");
    }

    private Element selectFirstSafely(Document document, String selector) {
        try {
            return document.selectFirst(selector);
        } catch (Selector.SelectorParseException ex) {
            log.warn("invalid main content selector, selector={}, error={}", selector, ex.getMessage());
            return null;
        }
    }

    private String firstGroup(Pattern pattern, String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

}
