package fun.fengwk.c2md.core.service.convert.support;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates assets relative to the directory of an exported page, then relative to the export root.
 * Files outside the export root, or outside the page directory when there is no root, are never located.
 *
 * @author fengwk
 */
@Slf4j
public class FileSystemAssetLocator implements AssetLocator {

    private final Path pageDirectory;
    private final Path exportRoot;
    private final Path boundary;

    public FileSystemAssetLocator(Path pageDirectory, Path exportRoot) {
        this.pageDirectory = pageDirectory;
        this.exportRoot = exportRoot;
        Path root = exportRoot != null ? exportRoot : pageDirectory;
        this.boundary = root == null ? null : root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<Path> locate(String reference) {
        Optional<Path> located = locateIn(pageDirectory, reference);
        if (located.isPresent() || exportRoot == null || exportRoot.equals(pageDirectory)) {
            return located;
        }
        return locateIn(exportRoot, reference);
    }

    private Optional<Path> locateIn(Path directory, String reference) {
        if (directory == null) {
            return Optional.empty();
        }
        try {
            Path candidate = directory.resolve(reference).normalize();
            if (!candidate.toAbsolutePath().startsWith(boundary)) {
                log.debug("asset reference outside export, reference={}, boundary={}", reference, boundary);
                return Optional.empty();
            }
            return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
        } catch (InvalidPathException ex) {
            log.debug("invalid asset reference, reference={}, error={}", reference, ex.getMessage());
            return Optional.empty();
        }
    }

}
