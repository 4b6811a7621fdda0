package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies a table by structural inspection.
 *
 * @author fengwk
 */
@Component
public class TableClassifier {

    private static final Set<String> HISTORY_TABLE_CLASSES = Set.of("tableview", "pageHistory");
    private static final Set<String> LAYOUT_TABLE_CLASSES = Set.of("layout", "contentLayoutTable", "layout-table");
    private static final String MACRO_WRAPPER_CLASS = "wysiwyg-macro";
    private static final String LAYOUT_CONTAINER_SELECTOR =
        ".contentLayout, .contentLayout2, .columnLayout, .section, .cell, .innerCell, .layout-column, .panelContent";
    private static final String BLOCK_CONTENT_SELECTOR = "div, table, ul, ol, p, h1, h2, h3, h4, h5, h6";
    private static final String SINGLE_CELL_BLOCK_SELECTOR = "div, table, ul, ol, p";
    private static final String COMPLEX_CONTENT_SELECTOR = "h1, h2, h3, h4, h5, h6, img:not(.emoticon), ul, ol, "
        + "table, pre, blockquote, .panel, .confluence-information-macro";

    private final ConvertProperties convertProperties;

    public TableClassifier(ConvertProperties convertProperties) {
        this.convertProperties = convertProperties;
    }

    public TableKind classify(Element table) {
        Objects.requireNonNull(table, "table");
        if (isHistoryTable(table)) {
            return TableKind.HISTORY;
        }
        if (isLayoutTable(table)) {
            return TableKind.LAYOUT;
        }
        if (convertProperties.isSectionizeComplexTables() && hasComplexCell(table)) {
            return TableKind.COMPLEX_SECTIONS;
        }
        return TableKind.STANDARD;
    }

    public boolean isHistoryTable(Element table) {
        if ("page-history-container".equals(table.id())) {
            return true;
        }
        for (String className : table.classNames()) {
            if (HISTORY_TABLE_CLASSES.contains(className)) {
                return true;
            }
        }
        if (hasHistoryHeader(table)) {
            return true;
        }
        for (Element ancestor = table.parent(); ancestor != null; ancestor = ancestor.parent()) {
            String marker = (ancestor.id() + " " + ancestor.className()).toLowerCase(Locale.ROOT);
            if (marker.contains("history") || marker.contains("version")) {
                return true;
            }
        }
        return false;
    }

    public boolean isLayoutTable(Element table) {
        for (String className : table.classNames()) {
            if (LAYOUT_TABLE_CLASSES.contains(className)) {
                return true;
            }
        }
        List<Element> rows = TableRows.rowsOf(table);
        if (isBorderless(table) && isInLayoutContainer(table)) {
            Element firstCell = firstDataCell(rows);
            if (firstCell != null && firstCell.selectFirst(BLOCK_CONTENT_SELECTOR) != null) {
                return true;
            }
        }
        if (rows.size() == 1) {
            List<Element> cells = TableRows.cellsOf(rows.get(0), "td");
            if (cells.size() == 1 && cells.get(0).selectFirst(SINGLE_CELL_BLOCK_SELECTOR) != null) {
                return true;
            }
        }
        return table.hasClass(MACRO_WRAPPER_CLASS);
    }

    public boolean hasComplexCell(Element table) {
        for (Element cell : TableRows.allCells(table)) {
            if (isComplexCell(cell)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A cell that cannot be flattened into one inline markdown table cell.
     */
    public boolean isComplexCell(Element cell) {
        if (cell.selectFirst(COMPLEX_CONTENT_SELECTOR) != null) {
            return true;
        }
        if (cell.getElementsByTag("p").size() > 1) {
            return true;
        }
        return cell.text().length() > convertProperties.getComplexCellTextThreshold();
    }

    private boolean hasHistoryHeader(Element table) {
        boolean hasVersion = false;
        boolean hasAuthorOrDate = false;
        for (Element row : TableRows.rowsOf(table)) {
            boolean inHead = row.parent() != null && "thead".equals(row.parent().normalName());
            for (Element cell : TableRows.cellsOf(row)) {
                if (!inHead && !"th".equals(cell.normalName())) {
                    continue;
                }
                String text = cell.text().trim().toLowerCase(Locale.ROOT);
                if (text.contains("version") || "v.".equals(text)) {
                    hasVersion = true;
                }
                if (text.contains("changed by") || text.contains("published")) {
                    hasAuthorOrDate = true;
                }
            }
        }
        return hasVersion && hasAuthorOrDate;
    }

    private boolean isBorderless(Element table) {
        if (table.hasAttr("border")) {
            return "0".equals(table.attr("border").trim());
        }
        String style = table.attr("style").toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        return style.contains("border-style:none") || style.contains("border:none") || style.contains("border:0");
    }

    private boolean isInLayoutContainer(Element table) {
        Element parent = table.parent();
        return parent != null && parent.closest(LAYOUT_CONTAINER_SELECTOR) != null;
    }

    private Element firstDataCell(List<Element> rows) {
        for (Element row : rows) {
            List<Element> cells = TableRows.cellsOf(row, "td");
            if (!cells.isEmpty()) {
                return cells.get(0);
            }
        }
        return null;
    }

}
