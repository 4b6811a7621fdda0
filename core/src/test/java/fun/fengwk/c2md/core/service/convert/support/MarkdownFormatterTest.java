package fun.fengwk.c2md.core.service.convert.support;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class MarkdownFormatterTest {

    private final MarkdownFormatter markdownFormatter = new MarkdownFormatter();

    @Test
    public void shouldReturnEmptyForBlankInput() {
        assertThat(markdownFormatter.format(null)).isEmpty();
        assertThat(markdownFormatter.format(" \n")).isEmpty();
    }

    @Test
    public void shouldKeepFrontMatterUntouched() {
        String markdown = "---\ntitle: Page\n---\n\n# Page\n\ntext\n";

        String formatted = markdownFormatter.format(markdown);

        assertThat(formatted).startsWith("---\ntitle: Page\n---\n\n");
        assertThat(formatted).contains("# Page");
        assertThat(formatted).endsWith("text\n");
    }

    @Test
    public void shouldKeepTableRowsAsTable() {
        String markdown = "# Page\n\n| a | bb |\n|---|---|\n| ccc | d |\n";

        String formatted = markdownFormatter.format(markdown);

        long tableLines = Arrays.stream(formatted.split("\n")).filter(line -> line.startsWith("|")).count();
        assertThat(tableLines).isEqualTo(3);
        assertThat(formatted).contains("ccc");
        assertThat(formatted).endsWith("|\n");
    }

}
