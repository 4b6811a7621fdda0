package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Reduces a complex table cell to a short inline placeholder so the grid keeps its shape.
 *
 * @author fengwk
 */
@Component
public class CellSimplifier {

    static final int MAX_TEXT_LENGTH = 50;
    static final int TRUNCATED_TEXT_LENGTH = 47;

    public String simplify(Element cell) {
        Element heading = cell.selectFirst("h1, h2, h3, h4, h5, h6");
        if (heading != null) {
            return "**" + MarkdownFragments.collapseWhitespace(heading.text()).trim() + "**";
        }
        Element image = cell.selectFirst("img");
        if (image != null) {
            String alt = image.attr("alt").trim();
            return "[" + (alt.isEmpty() ? "image" : alt) + "]";
        }
        Element list = cell.selectFirst("ul, ol");
        if (list != null) {
            return "[List: " + countItems(list) + " items]";
        }
        if (cell.selectFirst("table") != null) {
            return "[Table]";
        }
        if (cell.selectFirst(".panel, .confluence-information-macro") != null) {
            return "[Panel content]";
        }
        String text = MarkdownFragments.collapseWhitespace(cell.text()).trim();
        if (text.length() > MAX_TEXT_LENGTH) {
            return text.substring(0, TRUNCATED_TEXT_LENGTH) + "...";
        }
        return text;
    }

    private int countItems(Element list) {
        int count = 0;
        for (Element child : list.children()) {
            if ("li".equals(child.normalName())) {
                count++;
            }
        }
        return count;
    }

}
