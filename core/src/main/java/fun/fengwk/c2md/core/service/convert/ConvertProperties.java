package fun.fengwk.c2md.core.service.convert;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "c2md.convert")
public class ConvertProperties {

    /**
     * Elements carrying one of these classes are never emitted.
     */
    private List<String> excludedClasses = new ArrayList<>(List.of(
        "breadcrumb-section",
        "footer",
        "aui-nav",
        "pageSectionHeader",
        "hidden",
        "navigation",
        "screenreader-only",
        "hidden-xs",
        "hidden-sm",
        "aui-icon",
        "aui-avatar-inner",
        "expand-control"
    ));

    /**
     * Elements carrying one of these ids are never emitted.
     */
    private List<String> excludedIds = new ArrayList<>(List.of(
        "breadcrumbs",
        "footer",
        "navigation",
        "sidebar",
        "page-sidebar",
        "header",
        "actions",
        "likes-and-labels-container",
        "page-metadata-secondary"
    ));

    /**
     * Candidate selectors for the article body, first match wins.
     */
    private List<String> mainContentSelectors = new ArrayList<>(List.of(
        "#main-content",
        ".wiki-content",
        "#content .wiki-content",
        "#content",
        "main",
        ".main-container",
        ".view",
        "article"
    ));

    /**
     * Cell text longer than this makes a table render as sections.
     */
    private int complexCellTextThreshold = 500;

    /**
     * Render tables with complex cells as heading sections instead of simplifying the cells.
     */
    private boolean sectionizeComplexTables = true;

    /**
     * Rewrite relative links to exported html pages into links to markdown pages.
     */
    private boolean rewritePageLinks = true;

    /**
     * Emit breadcrumbs as a navigation block on top of the page.
     */
    private boolean includeNavigation = true;

    /**
     * Emit yaml front matter.
     */
    private boolean includeFrontMatter = true;

    /**
     * Default attachment mode: visible, hidden or xml.
     */
    private String attachmentMode = "visible";

    /**
     * Pretty print the final markdown with flexmark.
     */
    private boolean prettyPrint = true;

    /**
     * Render with the generic html converter when the page conversion fails.
     */
    private boolean fallbackRender = true;

    /**
     * Worker threads for batch conversion.
     */
    private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());

    /**
     * Timeout for a single document in batch conversion, 0 means no timeout.
     */
    private long documentTimeoutMs = 0;

    /**
     * Directory names skipped when walking an export.
     */
    private List<String> skippedDirectories = new ArrayList<>(List.of("attachments", "images"));

}
