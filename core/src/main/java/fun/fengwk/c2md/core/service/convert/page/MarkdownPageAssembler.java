package fun.fengwk.c2md.core.service.convert.page;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.model.AssetKind;
import fun.fengwk.c2md.core.service.convert.model.AssetReference;
import fun.fengwk.c2md.core.service.convert.model.AttachmentMode;
import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import fun.fengwk.c2md.core.service.convert.model.PageMetadata;
import fun.fengwk.c2md.core.service.convert.parser.ConfluenceMarkdownConverter;
import fun.fengwk.c2md.core.service.convert.parser.ConversionContext;
import fun.fengwk.c2md.core.service.convert.support.AssetPaths;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Assembles the raw markdown of a whole page before cleanup.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class MarkdownPageAssembler {

    public static final String HISTORY_HEADING = "## Page History";
    public static final String ATTACHMENTS_HEADING = "## Attachments";

    private final ConvertProperties convertProperties;
    private final ConfluencePageParser pageParser;
    private final ConfluenceMarkdownConverter converter;
    private final FrontMatterWriter frontMatterWriter;

    public String assemble(Document document, PageMetadata metadata, List<Breadcrumb> breadcrumbs,
                           AttachmentMode attachmentMode, ConversionContext context) {
        StringBuilder markdown = new StringBuilder();
        if (convertProperties.isIncludeFrontMatter()) {
            markdown.append(frontMatterWriter.write(metadata, breadcrumbs)).append('\n');
        }
        if (convertProperties.isIncludeNavigation() && !breadcrumbs.isEmpty()) {
            appendNavigation(markdown, breadcrumbs);
        }
        markdown.append("# ").append(metadata.getTitle()).append("\n\n");

        Element titleElement = pageParser.findTitleElement(document);
        if (titleElement != null) {
            context.markSubtreeProcessed(titleElement);
        }
        for (Element pageMetadata : document.select(".page-metadata")) {
            context.markSubtreeProcessed(pageMetadata);
        }
        markdown.append(converter.convertContent(pageParser.findMainContent(document), context));

        Element historyTable = pageParser.findHistoryTable(document);
        if (historyTable != null && !context.isProcessed(historyTable)) {
            String history = converter.convertHistoryTable(historyTable, context);
            if (!history.isBlank()) {
                markdown.append("\n\n").append(HISTORY_HEADING).append('\n').append(history);
            }
        }
        appendAttachments(markdown, metadata.getAttachments(), attachmentMode, context);
        return markdown.toString();
    }

    private void appendNavigation(StringBuilder markdown, List<Breadcrumb> breadcrumbs) {
        int index = 1;
        for (Breadcrumb breadcrumb : breadcrumbs) {
            markdown.append(index++).append(". [").append(breadcrumb.title()).append("](")
                .append(breadcrumb.url() == null ? "" : breadcrumb.url()).append(")\n");
        }
        markdown.append('\n');
    }

    private void appendAttachments(StringBuilder markdown, List<String> attachments,
                                   AttachmentMode attachmentMode, ConversionContext context) {
        if (attachments == null || attachments.isEmpty()) {
            return;
        }
        for (String attachment : attachments) {
            Optional<Path> located = context.getAssetLocator().locate(attachment);
            if (located.isPresent()) {
                context.addAsset(new AssetReference(located.get(), attachment, AssetKind.ATTACHMENT));
            } else {
                context.addWarning("missing attachment: " + attachment);
            }
        }
        switch (attachmentMode) {
            case VISIBLE -> {
                markdown.append("\n\n").append(ATTACHMENTS_HEADING).append("\n\n");
                for (String attachment : attachments) {
                    markdown.append("- [").append(AssetPaths.fileName(attachment)).append("](")
                        .append(AssetPaths.toExplicitRelative(attachment.replace(" ", "%20"))).append(")\n");
                }
            }
            case XML -> {
                markdown.append("\n\n");
                for (String attachment : attachments) {
                    markdown.append("<attachment filename=\"").append(xmlValue(AssetPaths.fileName(attachment)))
                        .append("\" local_path=\"").append(xmlValue(AssetPaths.toExplicitRelative(attachment)))
                        .append("\" />\n");
                }
            }
            case HIDDEN -> {
            }
        }
    }

    private String xmlValue(String value) {
        return value.replace('"', '\'');
    }

}
