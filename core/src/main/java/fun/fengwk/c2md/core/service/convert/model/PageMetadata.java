package fun.fengwk.c2md.core.service.convert.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Page level information extracted around the article body.
 *
 * @author fengwk
 */
@Data
@Builder
public class PageMetadata {

    private String title;
    private String createdBy;
    private String createdDate;
    private String lastModified;
    private List<Breadcrumb> breadcrumbs;
    private List<String> attachments;

}
