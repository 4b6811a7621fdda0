package fun.fengwk.c2md.core.service.convert.parser;

/**
 * Immutable traversal scope passed down the element tree.
 *
 * @param path ancestry label used in diagnostics
 * @param insideMainContent whether the walk is inside the article body
 * @param inline whether block markup must flatten to a single line
 * @param inHeading whether an enclosing heading already emits the heading markers
 * @author fengwk
 */
public record ConversionScope(String path, boolean insideMainContent, boolean inline, boolean inHeading) {

    private static final int MAX_PATH_LENGTH = 256;

    public static ConversionScope mainContent() {
        return new ConversionScope("main", true, false, false);
    }

    public ConversionScope child(String tagName) {
        String childPath = path + ">" + tagName;
        if (childPath.length() > MAX_PATH_LENGTH) {
            childPath = "..." + childPath.substring(childPath.length() - MAX_PATH_LENGTH);
        }
        return new ConversionScope(childPath, insideMainContent, inline, inHeading);
    }

    public ConversionScope asInline() {
        return inline ? this : new ConversionScope(path, insideMainContent, true, inHeading);
    }

    public ConversionScope asHeading() {
        return new ConversionScope(path, insideMainContent, true, true);
    }

}
