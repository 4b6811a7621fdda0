package fun.fengwk.c2md.core.service.convert.support;

import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.formatter.Formatter;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pretty prints cleaned markdown, aligning table columns.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class MarkdownFormatter {

    private static final String FRONT_MATTER_DELIMITER = "---\n";

    private final Parser parser;
    private final Formatter formatter;

    public MarkdownFormatter() {
        MutableDataSet options = new MutableDataSet();
        options.set(Parser.EXTENSIONS, List.of(TablesExtension.create()));
        options.set(TablesExtension.APPEND_MISSING_COLUMNS, true);
        this.parser = Parser.builder(options).build();
        this.formatter = Formatter.builder(options).build();
    }

    /**
     * Formats markdown, returning the input unchanged when formatting fails.
     */
    public String format(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        String frontMatter = "";
        String body = markdown;
        if (markdown.startsWith(FRONT_MATTER_DELIMITER)) {
            int end = markdown.indexOf("\n" + FRONT_MATTER_DELIMITER, FRONT_MATTER_DELIMITER.length() - 1);
            if (end >= 0) {
                frontMatter = markdown.substring(0, end + 1 + FRONT_MATTER_DELIMITER.length());
                body = markdown.substring(frontMatter.length());
            }
        }
        try {
            String formatted = formatter.render(parser.parse(body)).strip();
            if (formatted.isEmpty()) {
                return markdown;
            }
            return frontMatter.isEmpty() ? formatted + "\n" : frontMatter + "\n" + formatted + "\n";
        } catch (RuntimeException ex) {
            log.warn("format markdown failed, error={}", ex.getMessage(), ex);
            return markdown;
        }
    }

}
