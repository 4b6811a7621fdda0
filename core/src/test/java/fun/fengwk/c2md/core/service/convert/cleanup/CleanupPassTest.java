package fun.fengwk.c2md.core.service.convert.cleanup;

import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CleanupPassTest {

    private static final List<String> SAMPLES = List.of(
        "",
        "plain text",
        "# # Title\n\n## ### Deep\n# Top",
        "intro\n## Heading\ntext\n### - item",
        "| a | b |\n| c |\n| d | e | f |\ntext after",
        "| a | b |\n|-|:-:|\n| c | d |",
        "| a | b |\n|---|---|\n| x \\| y | z |",
        "Tom &amp; Jerry &lt;3 &#35; &#124; &nbsp;x &#32; &amp;amp;",
        "a\n\n\n\n\nb   \n\n\n\nc",
        "```\n# # not a heading\n| a |\n&amp;\n\n\n\n\n```\nafter",
        "1. [Home](./home.md)\n2. [Space](./space.md)\n# Title",
        "line\r\nwith\rbreaks\uFEFF\u200B"
    );

    @Test
    public void shouldCollapseDoubledHeadingMarkers() {
        assertThat(CleanupPass.COLLAPSE_HEADING_MARKERS.apply("# # Title")).isEqualTo("## Title");
        assertThat(CleanupPass.COLLAPSE_HEADING_MARKERS.apply("## ### Deep")).isEqualTo("### Deep");
        assertThat(CleanupPass.COLLAPSE_HEADING_MARKERS.apply("# # # Triple")).isEqualTo("## Triple");
        assertThat(CleanupPass.COLLAPSE_HEADING_MARKERS.apply("# Single")).isEqualTo("# Single");
    }

    @Test
    public void shouldSeparateHeadingsFromNeighbours() {
        assertThat(CleanupPass.SEPARATE_HEADINGS.apply("intro\n## Heading\ntext"))
            .isEqualTo("intro\n\n## Heading\n\ntext");
    }

    @Test
    public void shouldUnwrapListItemsMarkedAsHeadings() {
        assertThat(CleanupPass.SEPARATE_HEADINGS.apply("### - item\n- next")).isEqualTo("- item\n- next");
    }

    @Test
    public void shouldInsertMissingDelimiterRow() {
        assertThat(CleanupPass.REPAIR_TABLES.apply("| a | b |\n| c | d |"))
            .isEqualTo("| a | b |\n|---|---|\n| c | d |");
    }

    @Test
    public void shouldNormalizeDelimiterRowKeepingAlignment() {
        assertThat(CleanupPass.REPAIR_TABLES.apply("| a | b | c |\n|-|:-:|\n| 1 | 2 | 3 |"))
            .isEqualTo("| a | b | c |\n|---|:---:|---|\n| 1 | 2 | 3 |");
    }

    @Test
    public void shouldPadAndTruncateRaggedRows() {
        assertThat(CleanupPass.REPAIR_TABLES.apply("| a | b |\n|---|---|\n| c |\n| d | e | f |"))
            .isEqualTo("| a | b |\n|---|---|\n| c |  |\n| d | e |");
    }

    @Test
    public void shouldSurroundTableWithBlankLines() {
        assertThat(CleanupPass.REPAIR_TABLES.apply("before\n| a |\n|---|\nafter"))
            .isEqualTo("before\n\n| a |\n|---|\n\nafter");
    }

    @Test
    public void shouldNotCountEscapedPipesAsCells() {
        String table = "| a | b |\n|---|---|\n| x \\| y | z |";

        assertThat(CleanupPass.REPAIR_TABLES.apply(table)).isEqualTo(table);
    }

    @Test
    public void shouldDecodeEntitiesSafely() {
        assertThat(CleanupPass.DECODE_ENTITIES.apply("Tom &amp; Jerry &lt;3 &copy;")).isEqualTo("Tom & Jerry <3 ©");
        assertThat(CleanupPass.DECODE_ENTITIES.apply("&#35; not a heading")).isEqualTo("\\# not a heading");
        assertThat(CleanupPass.DECODE_ENTITIES.apply("| a &#124; b |")).isEqualTo("| a \\| b |");
        assertThat(CleanupPass.DECODE_ENTITIES.apply("keep &#32; space")).isEqualTo("keep &#32; space");
        assertThat(CleanupPass.DECODE_ENTITIES.apply("&amp;lt;")).isEqualTo("<");
        assertThat(CleanupPass.DECODE_ENTITIES.apply("&unknown;")).isEqualTo("&unknown;");
    }

    @Test
    public void shouldCollapseBlankLinesAndTrailingSpaces() {
        assertThat(CleanupPass.COLLAPSE_BLANK_LINES.apply("a\n\n\n\n\nb   \nc"))
            .isEqualTo("a\n\n\nb\nc");
    }

    @Test
    public void shouldConvertBreadcrumbListToNavigation() {
        String markdown = "1. [Home](./home.md)\n2. [Space](./space.md)\n# Title";

        assertThat(CleanupPass.NAVIGATION_BLOCK.apply(markdown))
            .isEqualTo("## Navigation\n\n- [Home](./home.md)\n- [Space](./space.md)\n\n# Title");
    }

    @Test
    public void shouldConfirmNavigationWithBreadcrumbs() {
        String markdown = "1. [Home](overview)\n2. [Space](space)\n\n# Title";
        List<Breadcrumb> breadcrumbs = List.of(new Breadcrumb("Home", "overview"), new Breadcrumb("Space", "space"));

        assertThat(CleanupPass.NAVIGATION_BLOCK.apply(markdown, breadcrumbs))
            .startsWith("## Navigation\n\n- [Home](overview)");
        assertThat(CleanupPass.NAVIGATION_BLOCK.apply(markdown)).isEqualTo(markdown);
        assertThat(CleanupPass.NAVIGATION_BLOCK.apply(markdown, List.of(new Breadcrumb("Other", "x"))))
            .isEqualTo(markdown);
    }

    @Test
    public void shouldLeaveFencedCodeUntouched() {
        String fenced = "```\n# # not a heading\n| a |\n&amp;\n\n\n\n\n```";

        for (CleanupPass pass : CleanupPass.values()) {
            assertThat(pass.apply(fenced)).as(pass.name()).isEqualTo(fenced);
        }
    }

    @Test
    public void shouldNormalizeLineEndingsAndInvisibleCharacters() {
        assertThat(CleanupPass.NORMALIZE_LINE_ENDINGS.apply("a\r\nb\rc\uFEFF\u200B\u2060"))
            .isEqualTo("a\nb\nc");
    }

    @Test
    public void shouldBeIdempotentPerPass() {
        for (CleanupPass pass : CleanupPass.values()) {
            for (String sample : SAMPLES) {
                String once = pass.apply(sample);
                assertThat(pass.apply(once)).as(pass.name() + " on " + sample).isEqualTo(once);
            }
        }
    }

}
