package fun.fengwk.c2md.core.service.convert.parser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders a table with the strategy picked by {@link TableClassifier}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableRenderer {

    static final String HISTORY_HEADER = "| Version | Published | Changed By | Comment |";
    static final String HISTORY_SEPARATOR = "|---|---|---|---|";

    private static final Pattern DOUBLE_HEADING_PATTERN = Pattern.compile("^#+\\s*#+\\s+");
    private static final Pattern HEADING_PATTERN = Pattern.compile("^#{1,6}\\s+");

    private final TableClassifier tableClassifier;
    private final CellSimplifier cellSimplifier;
    private final ImageRenderer imageRenderer;

    public String render(Element table, ConversionContext context, ConversionScope scope, NodeConverter converter) {
        TableKind kind = tableClassifier.classify(table);
        log.debug("render table, path={}, kind={}", scope.path(), kind);
        return switch (kind) {
            case HISTORY -> renderHistory(table, context);
            case LAYOUT -> renderLayout(table, context, scope, converter);
            case COMPLEX_SECTIONS -> renderSections(table, context, scope, converter);
            case STANDARD -> renderStandard(table, context, scope, converter);
        };
    }

    public String renderHistory(Element table, ConversionContext context) {
        context.markSubtreeProcessed(table);
        List<String> lines = new ArrayList<>();
        for (Element row : TableRows.rowsOf(table)) {
            List<Element> cells = TableRows.cellsOf(row, "td");
            if (cells.size() < 3) {
                continue;
            }
            String version = versionCell(cells.get(0));
            String published = MarkdownFragments.escapeTableCell(cells.get(1).text());
            String changedBy = changedByCell(cells.get(2), context);
            String comment = cells.size() > 3 ? MarkdownFragments.escapeTableCell(cells.get(3).text()) : "";
            lines.add(formatRow(List.of(version, published, changedBy, comment)));
        }
        if (lines.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("\n")
            .append(HISTORY_HEADER).append("\n")
            .append(HISTORY_SEPARATOR).append("\n");
        for (String line : lines) {
            builder.append(line).append("\n");
        }
        return builder.append("\n").toString();
    }

    private String renderLayout(Element table, ConversionContext context, ConversionScope scope, NodeConverter converter) {
        StringBuilder builder = new StringBuilder();
        for (Element row : TableRows.rowsOf(table)) {
            context.markProcessed(row);
            for (Element cell : TableRows.cellsOf(row)) {
                if (!context.markProcessed(cell)) {
                    continue;
                }
                String content = converter.convertChildren(cell, context, scope.child(cell.normalName())).strip();
                if (!content.isEmpty()) {
                    builder.append(content).append("\n\n");
                }
            }
        }
        return builder.toString();
    }

    private String renderSections(Element table, ConversionContext context, ConversionScope scope, NodeConverter converter) {
        StringBuilder builder = new StringBuilder();
        for (Element row : TableRows.rowsOf(table)) {
            context.markProcessed(row);
            List<Element> cells = TableRows.cellsOf(row);
            for (int i = 0; i < cells.size(); i++) {
                Element cell = cells.get(i);
                if (!context.markProcessed(cell)) {
                    continue;
                }
                String content = converter.convertChildren(cell, context, scope.child(cell.normalName())).strip();
                if (content.isEmpty()) {
                    continue;
                }
                if (i == 0) {
                    appendSectionTitle(builder, content);
                } else {
                    builder.append(content).append("\n\n");
                }
            }
        }
        return builder.toString();
    }

    private void appendSectionTitle(StringBuilder builder, String content) {
        int newline = content.indexOf('\n');
        String title = newline < 0 ? content : content.substring(0, newline).trim();
        String rest = newline < 0 ? "" : content.substring(newline + 1).strip();
        title = DOUBLE_HEADING_PATTERN.matcher(title).replaceFirst("## ");
        title = HEADING_PATTERN.matcher(title).replaceFirst("## ");
        if (!title.startsWith("## ")) {
            title = "## " + title;
        }
        if (!title.substring(3).isBlank()) {
            builder.append(title).append("\n\n");
        }
        if (!rest.isEmpty()) {
            builder.append(rest).append("\n\n");
        }
    }

    private String renderStandard(Element table, ConversionContext context, ConversionScope scope, NodeConverter converter) {
        List<List<String>> rows = new ArrayList<>();
        int columnCount = 0;
        for (Element row : TableRows.rowsOf(table)) {
            if (!context.markProcessed(row)) {
                continue;
            }
            List<String> cells = new ArrayList<>();
            boolean blank = true;
            for (Element cell : TableRows.cellsOf(row)) {
                String content = "";
                if (context.markProcessed(cell)) {
                    content = renderStandardCell(cell, context, scope, converter);
                }
                blank &= content.isEmpty();
                cells.add(content);
                for (int i = 1; i < TableRows.colspan(cell); i++) {
                    cells.add("");
                }
            }
            if (blank) {
                continue;
            }
            rows.add(cells);
            columnCount = Math.max(columnCount, cells.size());
        }
        if (rows.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("\n");
        for (int i = 0; i < rows.size(); i++) {
            builder.append(formatRow(fitColumns(rows.get(i), columnCount))).append("\n");
            if (i == 0) {
                builder.append("|").append("---|".repeat(columnCount)).append("\n");
            }
        }
        return builder.append("\n").toString();
    }

    private String renderStandardCell(Element cell, ConversionContext context, ConversionScope scope, NodeConverter converter) {
        if (tableClassifier.isComplexCell(cell)) {
            context.markSubtreeProcessed(cell);
            return MarkdownFragments.escapeTableCell(cellSimplifier.simplify(cell));
        }
        String content = converter.convertChildren(cell, context, scope.child(cell.normalName()).asInline());
        return MarkdownFragments.escapeTableCell(content);
    }

    private List<String> fitColumns(List<String> cells, int columnCount) {
        List<String> fitted = new ArrayList<>(cells.subList(0, Math.min(cells.size(), columnCount)));
        while (fitted.size() < columnCount) {
            fitted.add("");
        }
        return fitted;
    }

    private String formatRow(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }

    private String versionCell(Element cell) {
        Element link = cell.selectFirst("a[href]");
        if (link != null && !link.text().isBlank()) {
            return "[" + MarkdownFragments.escapeTableCell(link.text()) + "](" + link.attr("href").trim().replace(" ", "%20") + ")";
        }
        return MarkdownFragments.escapeTableCell(cell.text());
    }

    private String changedByCell(Element cell, ConversionContext context) {
        StringBuilder builder = new StringBuilder();
        Element logo = cell.selectFirst("img.userLogo");
        if (logo != null) {
            String image = imageRenderer.render(logo, context, "User icon");
            if (!image.isEmpty()) {
                builder.append(image).append(' ');
            }
        }
        Element contributor = cell.selectFirst(".page-history-contributor-name a");
        Element unknownUser = cell.selectFirst("span.unknown-user");
        if (contributor != null) {
            String href = contributor.attr("href").trim();
            String name = MarkdownFragments.escapeTableCell(contributor.text());
            builder.append(href.isEmpty() ? name : "[" + name + "](" + href.replace(" ", "%20") + ")");
        } else if (unknownUser != null) {
            builder.append(MarkdownFragments.escapeTableCell(unknownUser.text()));
        } else {
            builder.append(MarkdownFragments.escapeTableCell(cell.text()));
        }
        return builder.toString().trim();
    }

}
