package fun.fengwk.c2md.core.service.convert.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Convert request model.
 *
 * @author fengwk
 */
@Data
@Builder
public class ConvertRequest {

    private String html;

    /**
     * Exported html file, local assets are resolved against its directory.
     */
    private Path sourcePath;

    /**
     * Root directory of the export, second place local assets are looked up.
     */
    private Path exportRoot;

    /**
     * Externally supplied breadcrumbs, extracted from the page when absent.
     */
    private List<Breadcrumb> breadcrumbs;

    private String attachmentMode;

}
