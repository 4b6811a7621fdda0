package fun.fengwk.c2md.core.service.convert.parser;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Converts one node and its subtree to a markdown fragment.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface NodeConverter {

    String convert(Node node, ConversionContext context, ConversionScope scope);

    /**
     * Converts the children of an element in document order.
     */
    default String convertChildren(Element element, ConversionContext context, ConversionScope scope) {
        StringBuilder builder = new StringBuilder();
        for (Node child : element.childNodes()) {
            MarkdownFragments.appendFragment(builder, child, convert(child, context, scope), scope.inline());
        }
        return builder.toString();
    }

}
