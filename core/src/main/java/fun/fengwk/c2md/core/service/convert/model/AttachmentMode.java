package fun.fengwk.c2md.core.service.convert.model;

import org.springframework.util.StringUtils;

/**
 * How attachments are listed at the end of a page.
 *
 * @author fengwk
 */
public enum AttachmentMode {

    VISIBLE("visible"),
    HIDDEN("hidden"),
    XML("xml");

    private final String value;

    AttachmentMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AttachmentMode fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return VISIBLE;
        }
        for (AttachmentMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unsupported attachments mode: " + value);
    }

}
