package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class DropFilterTest {

    private final DropFilter dropFilter = new DropFilter(new ConvertProperties());

    @Test
    public void shouldDropScriptsStylesAndButtons() {
        Document document = Jsoup.parse(
            "<html><head><style>p{}</style></head><body><script>x()</script><noscript>n</noscript>"
                + "<button>b</button></body></html>");

        assertThat(dropFilter.shouldDrop(document.selectFirst("style"), true)).isTrue();
        assertThat(dropFilter.shouldDrop(document.selectFirst("script"), true)).isTrue();
        assertThat(dropFilter.shouldDrop(document.selectFirst("noscript"), true)).isTrue();
        assertThat(dropFilter.shouldDrop(document.selectFirst("button"), true)).isTrue();
    }

    @Test
    public void shouldDropComments() {
        Document document = Jsoup.parseBodyFragment("<!-- note --><p>x</p>");
        Node comment = document.body().childNode(0);

        assertThat(dropFilter.shouldDrop(comment, true)).isTrue();
    }

    @Test
    public void shouldDropHiddenElements() {
        Document document = Jsoup.parseBodyFragment(
            "<p aria-hidden=\"true\">a</p><p style=\"display: none\">b</p><p style=\"VISIBILITY:hidden\">c</p>");

        assertThat(document.select("p")).allMatch(p -> dropFilter.shouldDrop(p, true));
    }

    @Test
    public void shouldDropDenylistedIdsAndClasses() {
        Document document = Jsoup.parseBodyFragment(
            "<div id=\"breadcrumbs\">a</div><div class=\"x footer\">b</div><div class=\"pageSectionHeader\">c</div>");

        assertThat(document.select("div")).allMatch(div -> dropFilter.shouldDrop(div, true));
    }

    @Test
    public void shouldKeepOrdinaryContentInsideMainContent() {
        Document document = Jsoup.parseBodyFragment("<p class=\"intro\" style=\"color: red\">hello</p>");

        assertThat(dropFilter.shouldDrop(document.selectFirst("p"), true)).isFalse();
        assertThat(dropFilter.shouldDrop(document.selectFirst("p").childNode(0), true)).isFalse();
    }

    @Test
    public void shouldDropEverythingOutsideMainContent() {
        Document document = Jsoup.parseBodyFragment("<p>hello</p>");

        assertThat(dropFilter.shouldDrop(document.selectFirst("p"), false)).isTrue();
        assertThat(dropFilter.shouldDrop(document.selectFirst("p").childNode(0), false)).isTrue();
    }

    @Test
    public void shouldUseConfiguredDenylist() {
        ConvertProperties convertProperties = new ConvertProperties();
        convertProperties.getExcludedClasses().add("internal-only");
        DropFilter configured = new DropFilter(convertProperties);
        Document document = Jsoup.parseBodyFragment("<div class=\"internal-only\">secret</div>");

        assertThat(configured.shouldDrop(document.selectFirst("div"), true)).isTrue();
        assertThat(dropFilter.shouldDrop(document.selectFirst("div"), true)).isFalse();
    }

}
