package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class CellSimplifierTest {

    private final CellSimplifier cellSimplifier = new CellSimplifier();

    @Test
    public void shouldUseHeadingText() {
        assertThat(cellSimplifier.simplify(cell("<h3>Release  notes</h3><p>details</p>"))).isEqualTo("**Release notes**");
    }

    @Test
    public void shouldUseImageAlt() {
        assertThat(cellSimplifier.simplify(cell("<img src=\"a.png\" alt=\"Diagram\">"))).isEqualTo("[Diagram]");
        assertThat(cellSimplifier.simplify(cell("<img src=\"a.png\">"))).isEqualTo("[image]");
    }

    @Test
    public void shouldCountListItems() {
        assertThat(cellSimplifier.simplify(cell("<ul><li>1</li><li>2</li><li>3</li><li>4</li><li>5</li></ul>")))
            .isEqualTo("[List: 5 items]");
    }

    @Test
    public void shouldUsePlaceholdersForTablesAndPanels() {
        assertThat(cellSimplifier.simplify(cell("<table><tr><td>x</td></tr></table>"))).isEqualTo("[Table]");
        assertThat(cellSimplifier.simplify(cell("<div class=\"panel\">p</div>"))).isEqualTo("[Panel content]");
    }

    @Test
    public void shouldTruncateLongText() {
        String text = "x".repeat(60);

        assertThat(cellSimplifier.simplify(cell("<p>" + text + "</p><p>more</p>")))
            .isEqualTo("x".repeat(CellSimplifier.TRUNCATED_TEXT_LENGTH) + "...");
        assertThat(cellSimplifier.simplify(cell("short text"))).isEqualTo("short text");
    }

    private Element cell(String html) {
        return Jsoup.parseBodyFragment("<table><tr><td>" + html + "</td></tr></table>").selectFirst("td");
    }

}
