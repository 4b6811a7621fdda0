package fun.fengwk.c2md.core.service.convert.cleanup;

import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class MarkdownCleanupPipelineTest {

    private final MarkdownCleanupPipeline pipeline = new MarkdownCleanupPipeline();

    @Test
    public void shouldReturnEmptyWhenBlank() {
        assertThat(pipeline.clean(null)).isEmpty();
        assertThat(pipeline.clean(" \n\n")).isEmpty();
    }

    @Test
    public void shouldCleanAssembledPage() {
        String markdown = """
            1. [Home](./Home.md)
            2. [Docs](./Docs.md)

            # Page

            # # Setup {#setup}
            intro &amp; more



            | k | v |
            | 1 |
            text
            """;

        assertThat(pipeline.clean(markdown, List.of(new Breadcrumb("Home", "./Home.md"), new Breadcrumb("Docs", "./Docs.md"))))
            .isEqualTo("""
                ## Navigation

                - [Home](./Home.md)
                - [Docs](./Docs.md)

                # Page

                ## Setup {#setup}

                intro & more


                | k | v |
                |---|---|
                | 1 |  |

                text
                """);
    }

    @Test
    public void shouldKeepFrontMatterIntact() {
        String markdown = "---\ntitle: A &amp; B\nbreadcrumbs:\n- Home\n---\n\n\n# A &amp; B\n";

        assertThat(pipeline.clean(markdown)).isEqualTo("---\ntitle: A &amp; B\nbreadcrumbs:\n- Home\n---\n\n# A & B\n");
    }

    @Test
    public void shouldBeIdempotent() {
        List<String> samples = List.of(
            "# # Title\ntext\n| a | b |\n| c |\n&lt;tag&gt; &#35;1\n\n\n\n\nend",
            "1. [Home](./home.md)\n2. [Space](./space.md)\n# Title\n\n- a\n- b",
            "---\ntitle: x\n---\n# x\n```java\n# # keep\n\n\n\n\n```\n&amp;amp;",
            "---\ntitle: only front matter\n---",
            "  indented first line\n\n\n",
            "### - item\n|a|b|\n|-|-|\n|1|2|3|",
            "\n---\n---\n```\n",
            "\n\n---\ntitle: x\n---\ntext",
            "&#45;&#45;&#45;\n&#45;&#45;&#45;\n- a"
        );

        for (String sample : samples) {
            String once = pipeline.clean(sample);
            assertThat(pipeline.clean(once)).as(sample).isEqualTo(once);
        }
    }

    @Test
    public void shouldKeepFrontMatterAfterLeadingBlankLines() {
        String cleaned = pipeline.clean("\n\n---\ntitle: x\n---\n\n\n\ntext");

        assertThat(cleaned).isEqualTo("---\ntitle: x\n---\n\ntext\n");
    }

}
