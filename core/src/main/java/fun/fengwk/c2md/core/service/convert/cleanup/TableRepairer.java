package fun.fengwk.c2md.core.service.convert.cleanup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Repairs pipe tables: missing or malformed delimiter rows and ragged rows.
 *
 * @author fengwk
 */
final class TableRepairer {

    private static final Pattern DELIMITER_CELL_PATTERN = Pattern.compile(":?-+:?");
    private static final Pattern CANONICAL_DELIMITER_CELL_PATTERN = Pattern.compile(":?-{3,}:?");

    private TableRepairer() {
    }

    static String repair(String markdown) {
        MarkdownLines lines = MarkdownLines.of(markdown);
        List<String> output = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (!isTableLine(lines, index)) {
                output.add(lines.get(index));
                index++;
                continue;
            }
            int end = index;
            while (end < lines.size() && isTableLine(lines, end)) {
                end++;
            }
            if (!output.isEmpty() && !output.get(output.size() - 1).isBlank()) {
                output.add("");
            }
            output.addAll(repairBlock(lines.lines().subList(index, end)));
            if (end < lines.size() && !lines.get(end).isBlank()) {
                output.add("");
            }
            index = end;
        }
        return MarkdownLines.join(output);
    }

    static boolean isTableLine(String line) {
        String trimmed = line.trim();
        return trimmed.length() >= 2
            && trimmed.startsWith("|")
            && trimmed.endsWith("|")
            && !trimmed.endsWith("\\|");
    }

    /**
     * Cells of a table row, a pipe preceded by a backslash belongs to the cell content.
     */
    static List<String> splitCells(String line) {
        String trimmed = line.trim();
        String inner = trimmed.substring(1, trimmed.length() - 1);
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '|' && (i == 0 || inner.charAt(i - 1) != '\\')) {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().trim());
        return cells;
    }

    private static boolean isTableLine(MarkdownLines lines, int index) {
        return !lines.isFenced(index) && isTableLine(lines.get(index));
    }

    private static List<String> repairBlock(List<String> block) {
        List<String> repaired = new ArrayList<>();
        String header = block.get(0);
        int columnCount = splitCells(header).size();
        repaired.add(header);

        int dataStart = 1;
        if (block.size() > 1 && isDelimiterRow(block.get(1))) {
            repaired.add(normalizeDelimiter(block.get(1), columnCount));
            dataStart = 2;
        } else {
            repaired.add("|" + "---|".repeat(columnCount));
        }
        for (int i = dataStart; i < block.size(); i++) {
            String row = block.get(i);
            List<String> cells = splitCells(row);
            repaired.add(cells.size() == columnCount ? row : formatRow(cells, columnCount));
        }
        return repaired;
    }

    private static boolean isDelimiterRow(String line) {
        for (String cell : splitCells(line)) {
            if (!DELIMITER_CELL_PATTERN.matcher(cell).matches()) {
                return false;
            }
        }
        return true;
    }

    private static String normalizeDelimiter(String line, int columnCount) {
        List<String> cells = splitCells(line);
        boolean canonical = cells.size() == columnCount;
        for (String cell : cells) {
            canonical &= CANONICAL_DELIMITER_CELL_PATTERN.matcher(cell).matches();
        }
        if (canonical) {
            return line;
        }
        StringBuilder builder = new StringBuilder("|");
        for (int i = 0; i < columnCount; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            builder.append(cell.startsWith(":") ? ":" : "")
                .append("---")
                .append(cell.length() > 1 && cell.endsWith(":") ? ":" : "")
                .append("|");
        }
        return builder.toString();
    }

    private static String formatRow(List<String> cells, int columnCount) {
        List<String> fitted = new ArrayList<>(cells.subList(0, Math.min(cells.size(), columnCount)));
        while (fitted.size() < columnCount) {
            fitted.add("");
        }
        return "| " + String.join(" | ", fitted) + " |";
    }

}
