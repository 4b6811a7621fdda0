package fun.fengwk.c2md.core.service.convert.page;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import fun.fengwk.c2md.core.service.convert.model.Breadcrumb;
import fun.fengwk.c2md.core.service.convert.model.PageMetadata;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes page metadata as a yaml front matter block.
 *
 * @author fengwk
 */
@Component
public class FrontMatterWriter {

    public static final String DELIMITER = "---";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
        .build();

    public String write(PageMetadata metadata, List<Breadcrumb> breadcrumbs) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("title", metadata.getTitle());
        putIfPresent(values, "created_by", metadata.getCreatedBy());
        putIfPresent(values, "created", metadata.getCreatedDate());
        putIfPresent(values, "last_modified", metadata.getLastModified());
        if (breadcrumbs != null && !breadcrumbs.isEmpty()) {
            values.put("breadcrumbs", breadcrumbs.stream().map(Breadcrumb::title).toList());
        }
        try {
            return DELIMITER + "\n" + yamlMapper.writeValueAsString(values) + DELIMITER + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("write front matter failed", ex);
        }
    }

    private void putIfPresent(Map<String, Object> values, String key, String value) {
        if (StringUtils.hasText(value)) {
            values.put(key, value);
        }
    }

}
