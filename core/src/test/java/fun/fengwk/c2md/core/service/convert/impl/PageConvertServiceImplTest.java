package fun.fengwk.c2md.core.service.convert.impl;

import fun.fengwk.c2md.core.service.convert.ConvertFixtures;
import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.cleanup.MarkdownCleanupPipeline;
import fun.fengwk.c2md.core.service.convert.model.AssetKind;
import fun.fengwk.c2md.core.service.convert.model.AssetReference;
import fun.fengwk.c2md.core.service.convert.model.ConvertRequest;
import fun.fengwk.c2md.core.service.convert.model.ConvertResponse;
import fun.fengwk.c2md.core.service.convert.page.MarkdownPageAssembler;
import fun.fengwk.c2md.core.service.convert.support.FallbackMarkdownRenderer;
import fun.fengwk.c2md.core.service.convert.support.MarkdownFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class PageConvertServiceImplTest {

    private static final String SIMPLE_PAGE = "<html><head><title>Space : Page</title></head>"
        + "<body><div id=\"main-content\"><p>Hello</p></div></body></html>";

    @Mock
    private MarkdownPageAssembler pageAssembler;

    private ConvertProperties convertProperties;

    private PageConvertServiceImpl mockedService;

    @TempDir
    Path exportRoot;

    @BeforeEach
    void setUp() {
        convertProperties = ConvertFixtures.plainProperties();
        mockedService = new PageConvertServiceImpl(
            convertProperties,
            ConvertFixtures.newPageParser(convertProperties),
            ConvertFixtures.newConverter(convertProperties),
            pageAssembler,
            new MarkdownCleanupPipeline(),
            new MarkdownFormatter(),
            new FallbackMarkdownRenderer()
        );
    }

    @Test
    public void shouldReturn400WhenRequestNull() {
        ConvertResponse response = mockedService.convert(null);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("request is null");
        assertThat(response.getAssets()).isEmpty();
        assertThat(response.getWarnings()).isEmpty();
    }

    @Test
    public void shouldReturn400WhenHtmlBlank() {
        ConvertResponse response = mockedService.convert(ConvertRequest.builder().html(" ").build());

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("html is blank");
        verify(pageAssembler, never()).assemble(any(), any(), any(), any(), any());
    }

    @Test
    public void shouldReturn400WhenAttachmentModeUnsupported() {
        ConvertResponse response = mockedService.convert(
            ConvertRequest.builder().html(SIMPLE_PAGE).attachmentMode("inline").build()
        );

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getError()).isEqualTo("unsupported attachments mode: inline");
        verify(pageAssembler, never()).assemble(any(), any(), any(), any(), any());
    }

    @Test
    public void shouldRenderFallbackWhenConversionFails() {
        when(pageAssembler.assemble(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        ConvertResponse response = mockedService.convert(ConvertRequest.builder().html(SIMPLE_PAGE).build());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.isFallback()).isTrue();
        assertThat(response.getTitle()).isEqualTo("Page");
        assertThat(response.getMarkdown()).startsWith("# Page\n\n").contains("Hello");
        assertThat(response.getWarnings()).containsExactly("fallback render: boom");
        assertThat(response.getAssets()).isEmpty();
    }

    @Test
    public void shouldReturn500WhenConversionFailsWithoutFallback() {
        convertProperties.setFallbackRender(false);
        when(pageAssembler.assemble(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        ConvertResponse response = mockedService.convert(ConvertRequest.builder().html(SIMPLE_PAGE).build());

        assertThat(response.getStatusCode()).isEqualTo(500);
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).isEqualTo("boom");
        assertThat(response.getMarkdown()).isNull();
    }

    @Test
    public void shouldConvertExportPage() {
        PageConvertServiceImpl service = ConvertFixtures.newPageConvertService(ConvertFixtures.plainProperties());

        ConvertResponse response = service.convert(ConvertRequest.builder().html(ConvertFixtures.EXPORT_PAGE).build());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.isFallback()).isFalse();
        assertThat(response.getTitle()).isEqualTo("Setup Guide");
        assertThat(response.getMarkdown())
            .startsWith("---\n")
            .contains("## Navigation\n\n- [Engineering](./index.md)\n- [Onboarding](./Onboarding_100.md)")
            .contains("# Setup Guide")
            .contains("## Attachments")
            .doesNotContain("Document generated by Confluence")
            .endsWith("\n");
        assertThat(response.getAssets()).extracting(AssetReference::kind)
            .containsExactly(AssetKind.IMAGE, AssetKind.ATTACHMENT, AssetKind.ATTACHMENT);
        assertThat(response.getWarnings()).isEmpty();
        assertThat(response.getElapsedMs()).isNotNull();
    }

    @Test
    public void shouldPreferRequestBreadcrumbsAndAttachmentMode() {
        PageConvertServiceImpl service = ConvertFixtures.newPageConvertService(ConvertFixtures.plainProperties());

        ConvertResponse response = service.convert(ConvertRequest.builder()
            .html(ConvertFixtures.EXPORT_PAGE)
            .breadcrumbs(List.of())
            .attachmentMode("hidden")
            .build());

        assertThat(response.getMarkdown())
            .doesNotContain("## Navigation")
            .doesNotContain("## Attachments")
            .doesNotContain("breadcrumbs:");
        assertThat(response.getAssets()).hasSize(3);
    }

    @Test
    public void shouldResolveAssetsAgainstSourceDirectory() throws IOException {
        Path page = exportRoot.resolve("Setup-Guide_123.html");
        Files.writeString(page, ConvertFixtures.EXPORT_PAGE);
        Path image = exportRoot.resolve("attachments/123/diagram.png");
        Files.createDirectories(image.getParent());
        Files.writeString(image, "png");
        PageConvertServiceImpl service = ConvertFixtures.newPageConvertService(ConvertFixtures.plainProperties());

        ConvertResponse response = service.convert(ConvertRequest.builder()
            .html(ConvertFixtures.EXPORT_PAGE)
            .sourcePath(page)
            .exportRoot(exportRoot)
            .build());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getSourcePath()).isEqualTo(page);
        assertThat(response.getAssets()).containsExactly(
            new AssetReference(image.toAbsolutePath().normalize(), "attachments/123/diagram.png", AssetKind.IMAGE),
            new AssetReference(image.toAbsolutePath().normalize(), "attachments/123/diagram.png", AssetKind.ATTACHMENT)
        );
        assertThat(response.getWarnings()).containsExactly("missing attachment: attachments/123/guide v2.pdf");
    }

    @Test
    public void shouldPrettyPrintByDefault() {
        PageConvertServiceImpl service = ConvertFixtures.newPageConvertService(new ConvertProperties());

        ConvertResponse response = service.convert(ConvertRequest.builder().html(ConvertFixtures.EXPORT_PAGE).build());

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getMarkdown()).startsWith("---\n").contains("# Setup Guide").contains("port");
    }

}
