package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph.models.Cell;
import org.w3c.dom.Element;

/**
 * A cell together with the DOM elements it was read from.
 *
 * @param cell           the resolved cell
 * @param cellElement    the {@code mxCell} element carrying geometry and style
 * @param wrapperElement the enclosing {@code UserObject}/{@code object}, or null
 */
public record ResolvedCell(
        Cell cell,
        Element cellElement,
        Element wrapperElement
) {
    /**
     * The element that represents the whole cell in its parent: the wrapper when there is one.
     */
    public Element outerElement() {
        return wrapperElement != null ? wrapperElement : cellElement;
    }

    /**
     * The element that carries the effective id attribute.
     */
    public Element idElement() {
        if (wrapperElement != null && !cellElement.hasAttribute("id")) {
            return wrapperElement;
        }
        return cellElement;
    }

    /**
     * The element that carries the label: the wrapper's {@code label}, else the cell's {@code value}.
     */
    public Element labelElement() {
        if (wrapperElement == null) {
            return cellElement;
        }
        if (wrapperElement.hasAttribute("label") || !cellElement.hasAttribute("value")) {
            return wrapperElement;
        }
        return cellElement;
    }

    public String labelAttribute() {
        return labelElement() == wrapperElement ? "label" : "value";
    }
}
