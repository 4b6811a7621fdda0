package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class SlugRegistryTest {

    @Test
    public void shouldReturnSameSlugForSameHeading() {
        Document document = Jsoup.parseBodyFragment("<h2>Getting Started</h2>");
        Element heading = document.selectFirst("h2");
        SlugRegistry registry = new SlugRegistry();

        String first = registry.resolve(heading);
        String second = registry.resolve(heading);

        assertThat(first).isEqualTo("getting-started");
        assertThat(second).isEqualTo(first);
    }

    @Test
    public void shouldPreferExplicitId() {
        Document document = Jsoup.parseBodyFragment("<h2 id=\"custom-id\">Getting Started</h2>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolve(document.selectFirst("h2"))).isEqualTo("custom-id");
    }

    @Test
    public void shouldDeduplicateCollidingSlugs() {
        Document document = Jsoup.parseBodyFragment("<h2>Intro</h2><h3>Intro</h3><h4>intro</h4>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(document.select("h2, h3, h4"))
            .extracting(registry::resolve)
            .containsExactly("intro", "intro-2", "intro-3");
    }

    @Test
    public void shouldNotDeriveSlugTakenByLaterExplicitId() {
        Document document = Jsoup.parseBodyFragment("<h2>Intro</h2><h2 id=\"intro\">Overview</h2>");
        SlugRegistry registry = new SlugRegistry(document);

        assertThat(document.select("h2"))
            .extracting(registry::resolve)
            .containsExactly("intro-2", "intro");
    }

    @Test
    public void shouldNotMutateDocument() {
        Document document = Jsoup.parseBodyFragment("<h2>Getting Started</h2>");
        String before = document.body().html();
        SlugRegistry registry = new SlugRegistry();

        registry.resolve(document.selectFirst("h2"));

        assertThat(document.body().html()).isEqualTo(before);
        assertThat(document.selectFirst("h2").hasAttr("id")).isFalse();
    }

    @Test
    public void shouldRewriteLinkToHeadingSlug() {
        Document document = Jsoup.parseBodyFragment("<a href=\"#sec1\">jump</a><h3 id=\"sec1\">My Section</h3>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolveLink("#sec1", document)).isEqualTo("#my-section");
    }

    @Test
    public void shouldRewriteLinkInsideTableOfContents() {
        Document document = Jsoup.parseBodyFragment(
            "<div class=\"toc-macro\"><span id=\"toc-entry\">Setup Guide</span></div>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolveLink("#toc-entry", document)).isEqualTo("#setup-guide");
    }

    @Test
    public void shouldAssignIdToNamedAnchor() {
        Document document = Jsoup.parseBodyFragment("<p><a name=\"anchor-1\"></a>text</p>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolveLink("#anchor-1", document)).isEqualTo("#anchor-1");
        assertThat(registry.idOf(document.selectFirst("a[name]"))).isEqualTo("anchor-1");
        assertThat(document.selectFirst("a[name]").hasAttr("id")).isFalse();
    }

    @Test
    public void shouldKeepUnresolvableAndExternalLinks() {
        Document document = Jsoup.parseBodyFragment("<p id=\"para\">text</p>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolveLink("#missing", document)).isEqualTo("#missing");
        assertThat(registry.resolveLink("#para", document)).isEqualTo("#para");
        assertThat(registry.resolveLink("https://example.com/#x", document)).isEqualTo("https://example.com/#x");
        assertThat(registry.resolveLink("#", document)).isEqualTo("#");
    }

    @Test
    public void shouldDecodeEscapedFragment() {
        Document document = Jsoup.parseBodyFragment("<h2 id=\"a b\">Spaced Heading</h2>");
        SlugRegistry registry = new SlugRegistry();

        assertThat(registry.resolveLink("#a%20b", document)).isEqualTo("#spaced-heading");
    }

}
