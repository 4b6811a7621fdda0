package fun.fengwk.c2md.core.service.convert.runtime;

/**
 * Outcome of converting an export directory.
 *
 * @author fengwk
 */
public record DirectoryConvertSummary(int total, int converted, int fallback, int failed, int assetsCopied, int warnings) {

    public boolean hasFailures() {
        return failed > 0;
    }

}
