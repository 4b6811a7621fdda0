package fun.fengwk.c2md.core.service.convert.parser;

/**
 * Rendering strategy of a table, decided once before rendering.
 *
 * @author fengwk
 */
public enum TableKind {

    /**
     * Page revision history.
     */
    HISTORY,

    /**
     * Table used only to position content.
     */
    LAYOUT,

    /**
     * Data table whose cells hold block content, rendered as heading sections.
     */
    COMPLEX_SECTIONS,

    /**
     * Plain grid.
     */
    STANDARD

}
