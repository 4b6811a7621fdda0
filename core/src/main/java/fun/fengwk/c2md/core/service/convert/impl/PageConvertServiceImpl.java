package fun.fengwk.c2md.core.service.convert.impl;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.PageConvertService;
import fun.fengwk.c2md.core.service.convert.cleanup.MarkdownCleanupPipeline;
import fun.fengwk.c2md.core.service.convert.model.AttachmentMode;
import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import fun.fengwk.c2md.core.service.convert.model.ConvertRequest;
import fun.fengwk.c2md.core.service.convert.model.ConvertResponse;
import fun.fengwk.c2md.core.service.convert.model.PageMetadata;
import fun.fengwk.c2md.core.service.convert.page.ConfluencePageParser;
import fun.fengwk.c2md.core.service.convert.page.MarkdownPageAssembler;
import fun.fengwk.c2md.core.service.convert.parser.ConfluenceMarkdownConverter;
import fun.fengwk.c2md.core.service.convert.parser.ConversionContext;
import fun.fengwk.c2md.core.service.convert.support.AssetLocator;
import fun.fengwk.c2md.core.service.convert.support.FallbackMarkdownRenderer;
import fun.fengwk.c2md.core.service.convert.support.FileSystemAssetLocator;
import fun.fengwk.c2md.core.service.convert.support.MarkdownFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.List;

/**
 * Page convert service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageConvertServiceImpl implements PageConvertService {

    private final ConvertProperties convertProperties;
    private final ConfluencePageParser pageParser;
    private final ConfluenceMarkdownConverter markdownConverter;
    private final MarkdownPageAssembler pageAssembler;
    private final MarkdownCleanupPipeline cleanupPipeline;
    private final MarkdownFormatter markdownFormatter;
    private final FallbackMarkdownRenderer fallbackRenderer;

    @Override
    public ConvertResponse convert(ConvertRequest request) {
        long startAt = System.currentTimeMillis();
        try {
            validateRequest(request);
            AttachmentMode attachmentMode = AttachmentMode.fromValue(
                StringUtils.hasText(request.getAttachmentMode())
                    ? request.getAttachmentMode()
                    : convertProperties.getAttachmentMode()
            );

            Document document = Jsoup.parse(request.getHtml());
            PageMetadata metadata = pageParser.extractMetadata(document);
            List<Breadcrumb> breadcrumbs = request.getBreadcrumbs() != null
                ? request.getBreadcrumbs()
                : metadata.getBreadcrumbs();
            ConversionContext context = markdownConverter.newContext(document, buildAssetLocator(request));

            String markdown = pageAssembler.assemble(document, metadata, breadcrumbs, attachmentMode, context);
            markdown = cleanupPipeline.clean(markdown, breadcrumbs);
            if (convertProperties.isPrettyPrint()) {
                markdown = markdownFormatter.format(markdown);
            }
            for (String warning : context.getWarnings()) {
                log.debug("convert warning, source={}, warning={}", request.getSourcePath(), warning);
            }
            return ConvertResponse.builder()
                .statusCode(200)
                .sourcePath(request.getSourcePath())
                .title(metadata.getTitle())
                .markdown(markdown)
                .assets(context.getAssets())
                .warnings(context.getWarnings())
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (IllegalArgumentException ex) {
            log.warn("convert request invalid, source={}, error={}", sourceOf(request), ex.getMessage());
            return failure(request, 400, ex.getMessage(), startAt);
        } catch (Exception ex) {
            log.warn("convert failed, source={}, error={}", sourceOf(request), ex.getMessage(), ex);
            if (convertProperties.isFallbackRender()) {
                return renderFallback(request, ex, startAt);
            }
            return failure(request, 500, ex.getMessage(), startAt);
        }
    }

    private void validateRequest(ConvertRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (!StringUtils.hasText(request.getHtml())) {
            throw new IllegalArgumentException("html is blank");
        }
        AttachmentMode.fromValue(request.getAttachmentMode());
    }

    private AssetLocator buildAssetLocator(ConvertRequest request) {
        Path sourcePath = request.getSourcePath();
        if (sourcePath == null) {
            return AssetLocator.unrestricted();
        }
        Path pageDirectory = sourcePath.toAbsolutePath().getParent();
        Path exportRoot = request.getExportRoot() == null ? null : request.getExportRoot().toAbsolutePath();
        return new FileSystemAssetLocator(pageDirectory, exportRoot);
    }

    private ConvertResponse renderFallback(ConvertRequest request, Exception cause, long startAt) {
        try {
            Document document = Jsoup.parse(request.getHtml());
            String title = pageParser.extractTitle(document);
            String html = pageParser.findMainContent(document).html();
            String markdown = cleanupPipeline.clean(fallbackRenderer.render(title, html));
            return ConvertResponse.builder()
                .statusCode(200)
                .sourcePath(request.getSourcePath())
                .title(title)
                .markdown(markdown)
                .assets(List.of())
                .warnings(List.of("fallback render: " + cause.getMessage()))
                .fallback(true)
                .elapsedMs(System.currentTimeMillis() - startAt)
                .build();
        } catch (Exception ex) {
            log.warn("fallback render failed, source={}, error={}", sourceOf(request), ex.getMessage(), ex);
            return failure(request, 500, cause.getMessage(), startAt);
        }
    }

    private ConvertResponse failure(ConvertRequest request, int statusCode, String error, long startAt) {
        return ConvertResponse.builder()
            .statusCode(statusCode)
            .sourcePath(request == null ? null : request.getSourcePath())
            .assets(List.of())
            .warnings(List.of())
            .error(error)
            .elapsedMs(System.currentTimeMillis() - startAt)
            .build();
    }

    private Object sourceOf(ConvertRequest request) {
        return request == null || request.getSourcePath() == null ? "" : request.getSourcePath();
    }

}
