package fun.fengwk.c2md.core.service.convert.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Convert response model.
 *
 * @author fengwk
 */
@Data
@Builder
public class ConvertResponse {

    private int statusCode;
    private Path sourcePath;
    private String title;
    private String markdown;
    private List<AssetReference> assets;
    private List<String> warnings;

    /**
     * True when the page was rendered by the generic html converter.
     */
    private boolean fallback;

    private Long elapsedMs;
    private String error;

    public boolean isSuccess() {
        return statusCode == 200;
    }

}
