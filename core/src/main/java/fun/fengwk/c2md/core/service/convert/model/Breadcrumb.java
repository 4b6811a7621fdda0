package fun.fengwk.c2md.core.service.convert.model;

/**
 * One entry of the page ancestry.
 *
 * @author fengwk
 */
public record Breadcrumb(String title, String url) {

}
