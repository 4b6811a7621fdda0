package fun.fengwk.c2md.core.service.convert.runtime;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.model.AssetReference;
import fun.fengwk.c2md.core.service.convert.model.ConvertRequest;
import fun.fengwk.c2md.core.service.convert.model.ConvertResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts every exported page under a directory into a mirrored markdown tree.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectoryConverter {

    static final int CHUNK_SIZE = 64;

    private final BatchConvertExecutor batchConvertExecutor;
    private final ConvertProperties convertProperties;

    public DirectoryConvertSummary convert(Path inputDir, Path outputDir, String attachmentMode) throws IOException {
        if (inputDir == null || !Files.isDirectory(inputDir)) {
            throw new IllegalArgumentException("input is not a directory: " + inputDir);
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("output is null");
        }
        Path inputRoot = inputDir.toAbsolutePath().normalize();
        Path outputRoot = outputDir.toAbsolutePath().normalize();
        List<Path> pages = findPages(inputRoot);
        log.info("convert directory started, input={}, output={}, pages={}", inputRoot, outputRoot, pages.size());

        Tally tally = new Tally();
        for (int from = 0; from < pages.size(); from += CHUNK_SIZE) {
            List<Path> chunk = pages.subList(from, Math.min(pages.size(), from + CHUNK_SIZE));
            List<ConvertRequest> requests = new ArrayList<>(chunk.size());
            for (Path page : chunk) {
                ConvertRequest request = readRequest(page, inputRoot, attachmentMode);
                if (request == null) {
                    tally.failed++;
                } else {
                    requests.add(request);
                }
            }
            for (ConvertResponse response : batchConvertExecutor.convertAll(requests)) {
                writeResponse(response, inputRoot, outputRoot, tally);
            }
        }
        DirectoryConvertSummary summary = new DirectoryConvertSummary(
            pages.size(), tally.converted, tally.fallback, tally.failed, tally.assetsCopied, tally.warnings
        );
        log.info("convert directory finished, summary={}", summary);
        return summary;
    }

    /**
     * Exported pages below the root, in path order, skipping asset directories.
     */
    public List<Path> findPages(Path inputRoot) throws IOException {
        List<Path> pages = new ArrayList<>();
        Files.walkFileTree(inputRoot, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(inputRoot) && isSkippedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isHtmlFile(file)) {
                    pages.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

        });
        pages.sort(null);
        return pages;
    }

    private ConvertRequest readRequest(Path page, Path inputRoot, String attachmentMode) {
        try {
            return ConvertRequest.builder()
                .html(Files.readString(page, StandardCharsets.UTF_8))
                .sourcePath(page)
                .exportRoot(inputRoot)
                .attachmentMode(attachmentMode)
                .build();
        } catch (IOException ex) {
            log.warn("read page failed, page={}, error={}", page, ex.getMessage());
            return null;
        }
    }

    private void writeResponse(ConvertResponse response, Path inputRoot, Path outputRoot, Tally tally) {
        Path source = response.getSourcePath();
        if (!response.isSuccess()) {
            tally.failed++;
            log.warn("convert page failed, page={}, statusCode={}, error={}", source, response.getStatusCode(), response.getError());
            return;
        }
        Path target = outputRoot.resolve(toMarkdownPath(inputRoot.relativize(source))).normalize();
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, response.getMarkdown(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            tally.failed++;
            log.warn("write markdown failed, target={}, error={}", target, ex.getMessage());
            return;
        }
        tally.converted++;
        if (response.isFallback()) {
            tally.fallback++;
        }
        List<String> warnings = response.getWarnings() == null ? List.of() : response.getWarnings();
        tally.warnings += warnings.size();
        for (String warning : warnings) {
            log.warn("convert page warning, page={}, warning={}", source, warning);
        }
        if (response.getAssets() != null) {
            for (AssetReference asset : response.getAssets()) {
                copyAsset(asset, target.getParent(), outputRoot, tally);
            }
        }
    }

    private void copyAsset(AssetReference asset, Path targetDir, Path outputRoot, Tally tally) {
        Path destination = targetDir.resolve(asset.target()).normalize();
        if (!destination.startsWith(outputRoot)) {
            tally.warnings++;
            log.warn("asset outside output directory, asset={}, destination={}", asset.target(), destination);
            return;
        }
        if (!tally.copiedAssets.add(destination)) {
            return;
        }
        try {
            if (Files.exists(destination) && Files.isSameFile(asset.source(), destination)) {
                return;
            }
            Files.createDirectories(destination.getParent());
            Files.copy(asset.source(), destination, StandardCopyOption.REPLACE_EXISTING);
            tally.assetsCopied++;
        } catch (IOException ex) {
            tally.warnings++;
            log.warn("copy asset failed, source={}, destination={}, error={}", asset.source(), destination, ex.getMessage());
        }
    }

    private boolean isSkippedDirectory(Path dir) {
        Path name = dir.getFileName();
        return name != null && convertProperties.getSkippedDirectories().contains(name.toString());
    }

    static boolean isHtmlFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".htm");
    }

    static Path toMarkdownPath(Path relative) {
        String name = relative.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String markdownName = (dot > 0 ? name.substring(0, dot) : name) + ".md";
        Path parent = relative.getParent();
        return parent == null ? Path.of(markdownName) : parent.resolve(markdownName);
    }

    private static class Tally {

        private int converted;
        private int fallback;
        private int failed;
        private int assetsCopied;
        private int warnings;
        private final Set<Path> copiedAssets = new HashSet<>();

    }

}
