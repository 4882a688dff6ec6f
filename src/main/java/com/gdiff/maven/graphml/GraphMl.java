package com.gdiff.maven.graphml;

import java.util.ArrayList;
import java.util.List;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Element names and DOM helpers shared by the GraphML reader and writer.
 */
final class GraphMl {

    static final String GRAPHML_NS = "http://graphml.graphdrawing.org/xmlns";
    static final String YWORKS_NS = "http://www.yworks.com/xml/graphml";
    static final String YWORKS_PREFIX = "y";

    static final String NODE_GRAPHICS_KEY = "d6";
    static final String EDGE_GRAPHICS_KEY = "d10";
    static final String NODE_CLASS_KEY = "dclass";
    static final String NODE_CLASS_ATTRIBUTE = "gdiff.nodeClass";

    static final int DEFAULT_FONT_SIZE = 12;

    /**
     * Direct element children with the given local name, namespace ignored.
     */
    static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList kids = parent.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node kid = kids.item(i);
            if (kid.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(kid))) {
                result.add((Element) kid);
            }
        }
        return result;
    }

    static Element firstChild(Element parent, String localName) {
        List<Element> matches = children(parent, localName);
        return matches.isEmpty() ? null : matches.get(0);
    }

    static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    /**
     * Attribute value, or null when absent or empty.
     */
    static String attribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private GraphMl() {
    }
}
