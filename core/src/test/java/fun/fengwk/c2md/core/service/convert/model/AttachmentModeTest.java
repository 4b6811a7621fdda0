package fun.fengwk.c2md.core.service.convert.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class AttachmentModeTest {

    @Test
    public void shouldParseValuesIgnoringCase() {
        assertThat(AttachmentMode.fromValue("visible")).isEqualTo(AttachmentMode.VISIBLE);
        assertThat(AttachmentMode.fromValue(" HIDDEN ")).isEqualTo(AttachmentMode.HIDDEN);
        assertThat(AttachmentMode.fromValue("Xml")).isEqualTo(AttachmentMode.XML);
    }

    @Test
    public void shouldDefaultToVisible() {
        assertThat(AttachmentMode.fromValue(null)).isEqualTo(AttachmentMode.VISIBLE);
        assertThat(AttachmentMode.fromValue("")).isEqualTo(AttachmentMode.VISIBLE);
    }

    @Test
    public void shouldRejectUnknownValue() {
        assertThatThrownBy(() -> AttachmentMode.fromValue("inline"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("unsupported attachments mode: inline");
    }

}
