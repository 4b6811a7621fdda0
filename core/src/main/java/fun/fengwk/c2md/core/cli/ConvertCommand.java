package fun.fengwk.c2md.core.cli;

import fun.fengwk.c2md.core.service.convert.ConvertProperties;
import fun.fengwk.c2md.core.service.convert.model.AttachmentMode;
import fun.fengwk.c2md.core.service.convert.runtime.DirectoryConvertSummary;
import fun.fengwk.c2md.core.service.convert.runtime.DirectoryConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Export directory convert command runner.
 *
 * <pre>
 * --input=&lt;export dir&gt; [--output=&lt;markdown dir&gt;] [--attachments=visible|hidden|xml]
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConvertCommand implements ApplicationRunner, ExitCodeGenerator {

    static final String OPTION_INPUT = "input";
    static final String OPTION_OUTPUT = "output";
    static final String OPTION_ATTACHMENTS = "attachments";
    static final String DEFAULT_OUTPUT_SUFFIX = "-md";

    private final DirectoryConverter directoryConverter;
    private final ConvertProperties convertProperties;

    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_INPUT)) {
            return;
        }
        String input = optionValue(args, OPTION_INPUT);
        if (!StringUtils.hasText(input)) {
            log.warn("input option is blank");
            exitCode = 2;
            return;
        }
        Path inputDir = Path.of(input.trim());
        String output = optionValue(args, OPTION_OUTPUT);
        Path outputDir = StringUtils.hasText(output) ? Path.of(output.trim()) : defaultOutputDir(inputDir);
        String attachments = optionValue(args, OPTION_ATTACHMENTS);
        if (!StringUtils.hasText(attachments)) {
            attachments = convertProperties.getAttachmentMode();
        }

        try {
            AttachmentMode attachmentMode = AttachmentMode.fromValue(attachments);
            DirectoryConvertSummary summary = directoryConverter.convert(inputDir, outputDir, attachmentMode.getValue());
            log.info(
                "convert finished, input={}, output={}, total={}, converted={}, fallback={}, failed={}, assets={}, warnings={}",
                inputDir,
                outputDir,
                summary.total(),
                summary.converted(),
                summary.fallback(),
                summary.failed(),
                summary.assetsCopied(),
                summary.warnings()
            );
            exitCode = summary.hasFailures() ? 1 : 0;
        } catch (IllegalArgumentException ex) {
            log.warn("convert arguments invalid, input={}, error={}", inputDir, ex.getMessage());
            exitCode = 2;
        } catch (IOException ex) {
            log.warn("convert failed, input={}, output={}, error={}", inputDir, outputDir, ex.getMessage(), ex);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static Path defaultOutputDir(Path inputDir) {
        Path absoluteInput = inputDir.toAbsolutePath().normalize();
        Path name = absoluteInput.getFileName();
        if (name == null) {
            return absoluteInput.resolve("markdown");
        }
        return absoluteInput.resolveSibling(name + DEFAULT_OUTPUT_SUFFIX);
    }

    private String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

}
