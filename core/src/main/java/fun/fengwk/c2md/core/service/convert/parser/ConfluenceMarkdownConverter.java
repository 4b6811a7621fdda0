package fun.fengwk.c2md.core.service.convert.parser;

import fun.fengwk.c2md.core.service.convert.support.AssetLocator;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Entry point of the element conversion engine.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ConfluenceMarkdownConverter {

    private final ElementDispatcher elementDispatcher;
    private final TableRenderer tableRenderer;

    public ConversionContext newContext(Document document, AssetLocator assetLocator) {
        return new ConversionContext(document, assetLocator);
    }

    /**
     * Converts the children of the article body root.
     */
    public String convertContent(Element contentRoot, ConversionContext context) {
        context.markProcessed(contentRoot);
        return elementDispatcher.convertChildren(contentRoot, context, ConversionScope.mainContent());
    }

    /**
     * Renders a revision history table found outside the article body, empty when already converted.
     */
    public String convertHistoryTable(Element table, ConversionContext context) {
        if (!context.markProcessed(table)) {
            return "";
        }
        return tableRenderer.renderHistory(table, context);
    }

    /**
     * Converts an html body fragment with a fresh context and no asset checks.
     */
    public String convertFragment(String html) {
        Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
        return convertContent(document.body(), newContext(document, AssetLocator.unrestricted()));
    }

}
