package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Row and cell access restricted to one table, nested tables are not included.
 *
 * @author fengwk
 */
public final class TableRows {

    private TableRows() {
    }

    public static List<Element> rowsOf(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            switch (child.normalName()) {
                case "tr" -> rows.add(child);
                case "thead", "tbody", "tfoot" -> {
                    for (Element row : child.children()) {
                        if ("tr".equals(row.normalName())) {
                            rows.add(row);
                        }
                    }
                }
                default -> {
                }
            }
        }
        return rows;
    }

    public static List<Element> cellsOf(Element row) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            String name = child.normalName();
            if ("td".equals(name) || "th".equals(name)) {
                cells.add(child);
            }
        }
        return cells;
    }

    public static List<Element> cellsOf(Element row, String tagName) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (tagName.equals(child.normalName())) {
                cells.add(child);
            }
        }
        return cells;
    }

    public static List<Element> allCells(Element table) {
        List<Element> cells = new ArrayList<>();
        for (Element row : rowsOf(table)) {
            cells.addAll(cellsOf(row));
        }
        return cells;
    }

    public static int colspan(Element cell) {
        String value = cell.attr("colspan").trim();
        if (value.isEmpty()) {
            return 1;
        }
        try {
            return Math.min(Math.max(Integer.parseInt(value), 1), 1000);
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

}
