package com.gdiff.maven.diff;

import java.util.Map;

import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphRebuilder;
import com.gdiff.maven.graph.NodeClass;

/**
 * Whole-document restyling used for reference copies and for legibility of every output.
 */
public final class CosmeticPass {

    public static final int DEFAULT_FONT_SIZE_DELTA = 20;

    /**
     * Paints every node with the color of its class, ignoring any diff state.
     */
    public static GraphDocument recolor(GraphDocument document, Map<NodeClass, String> colors) {
        for (NodeClass nodeClass : NodeClass.values()) {
            if (colors.get(nodeClass) == null) {
                throw new InvalidPaletteException("No reference color for " + nodeClass.key());
            }
        }
        return GraphRebuilder.rebuild(document,
                (path, node, parent) -> node.withFillColor(colors.get(node.getNodeClass())));
    }

    /**
     * Adds {@code delta} to every label's font size.
     */
    public static GraphDocument resizeFonts(GraphDocument document, int delta) {
        return GraphRebuilder.rebuild(document,
                (path, node, parent) -> node.withStyle(node.getStyle().withFontSize(node.getStyle().getFontSize() + delta)));
    }

    private CosmeticPass() {
    }
}
