package fun.fengwk.c2md.core.service.convert.support;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a local image or attachment reference to a file.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface AssetLocator {

    /**
     * @param reference sanitized relative reference, without query or fragment
     * @return the located file, empty when it cannot be found
     */
    Optional<Path> locate(String reference);

    /**
     * Locator that accepts every syntactically valid reference without touching the filesystem.
     */
    static AssetLocator unrestricted() {
        return reference -> {
            try {
                return Optional.of(Path.of(reference));
            } catch (InvalidPathException ex) {
                return Optional.empty();
            }
        };
    }

}
