package fun.fengwk.c2md.core.service.convert.support;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Generic html to markdown renderer used when the Confluence aware engine fails on a page.
 *
 * @author fengwk
 */
@Component
public class FallbackMarkdownRenderer {

    private final FlexmarkHtmlConverter converter;

    public FallbackMarkdownRenderer() {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, '-');
        options.set(FlexmarkHtmlConverter.LIST_CONTENT_INDENT, true);
        options.set(FlexmarkHtmlConverter.DIV_AS_PARAGRAPH, true);
        options.set(FlexmarkHtmlConverter.OUTPUT_ATTRIBUTES_ID, false);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
    }

    public String render(String title, String html) {
        String body = StringUtils.hasText(html) ? converter.convert(html).strip() : "";
        String heading = "# " + (StringUtils.hasText(title) ? title.trim() : "Untitled Page");
        return body.isEmpty() ? heading + "\n" : heading + "\n\n" + body + "\n";
    }

}
