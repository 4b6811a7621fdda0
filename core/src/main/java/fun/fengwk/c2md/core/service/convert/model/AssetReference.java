package fun.fengwk.c2md.core.service.convert.model;

import java.nio.file.Path;

/**
 * A local file referenced by the converted page.
 *
 * @param source resolved source file
 * @param target path as written in the markdown, relative to the page
 * @param kind image or attachment
 * @author fengwk
 */
public record AssetReference(Path source, String target, AssetKind kind) {

}
