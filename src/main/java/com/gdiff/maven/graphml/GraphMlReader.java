package com.gdiff.maven.graphml;

import static com.gdiff.maven.graphml.GraphMl.attribute;
import static com.gdiff.maven.graphml.GraphMl.children;
import static com.gdiff.maven.graphml.GraphMl.firstChild;
import static com.gdiff.maven.graphml.GraphMl.localName;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import com.gdiff.maven.graph.Graph;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphEdge;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.MalformedDocumentException;
import com.gdiff.maven.graph.NodeClass;
import com.gdiff.maven.graph.NodeId;
import com.gdiff.maven.graph.NodeStyle;

/**
 * Reads yEd GraphML contact maps into {@link GraphDocument}s.
 * <p>
 * A node's style comes from the first {@code y:ShapeNode}, or the first {@code y:GroupNode} of a
 * {@code y:ProxyAutoBoundsNode}, found in its {@code data} elements. Its class comes from a
 * {@code gdiff.nodeClass} data entry when the document declares one, otherwise from its fill color.
 * Nested {@code graph} elements become subgraphs; edges stay at the level that declares them.
 */
public class GraphMlReader {

    private final ColorClassifier classifier;

    public GraphMlReader() {
        this(ColorClassifier.defaults());
    }

    public GraphMlReader(ColorClassifier classifier) {
        this.classifier = classifier;
    }

    public GraphDocument read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    /**
     * @param systemId name of the document, used in error messages
     */
    public GraphDocument read(InputStream in, String systemId) throws IOException {
        Document dom = parse(in, systemId);
        Element root = dom.getDocumentElement();
        if (!"graphml".equals(localName(root))) {
            throw new MalformedDocumentException("Not a GraphML document: " + systemId
                    + " (root element " + localName(root) + ")");
        }
        Element graph = firstChild(root, "graph");
        if (graph == null) {
            throw new MalformedDocumentException("GraphML document has no graph: " + systemId);
        }
        return new GraphDocument(readGraph(graph, nodeClassKeys(root)));
    }

    private Graph readGraph(Element rootGraph, Set<String> classKeys) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(rootGraph, LabelPath.root(), null));
        while (true) {
            Frame frame = stack.peek();
            if (frame.next < frame.nodeElements.size()) {
                Element nodeElement = frame.nodeElements.get(frame.next++);
                String id = attribute(nodeElement, "id");
                if (id == null) {
                    throw new MalformedDocumentException("Node without id", frame.path);
                }
                NodeStyle style = readStyle(nodeElement, id, frame.path);
                LabelPath path = frame.path.append(style.getLabel());
                GraphNode.Builder node = GraphNode.builder()
                        .id(NodeId.of(id))
                        .style(style)
                        .nodeClass(readNodeClass(nodeElement, style, path, classKeys));

                Element nested = firstChild(nodeElement, "graph");
                if (nested != null) {
                    stack.push(new Frame(nested, path, node));
                } else {
                    frame.built.add(node.build());
                }
                continue;
            }
            stack.pop();
            Graph graph = Graph.builder()
                    .id(attribute(frame.graphElement, "id"))
                    .nodes(frame.built)
                    .edges(readEdges(frame.graphElement, frame.path))
                    .build();
            if (stack.isEmpty()) {
                return graph;
            }
            stack.peek().built.add(frame.owner.subgraph(graph).build());
        }
    }

    private NodeStyle readStyle(Element nodeElement, String id, LabelPath parentPath) {
        Element properties = findProperties(nodeElement);
        if (properties == null) {
            throw new MalformedDocumentException("Can't find properties for node " + id, parentPath);
        }
        Element label = firstChild(properties, "NodeLabel");
        if (label == null) {
            throw new MalformedDocumentException("Node " + id + " has no label", parentPath);
        }
        String text = label.getTextContent() == null ? "" : label.getTextContent().trim();
        LabelPath path = parentPath.append(text);

        Element fill = firstChild(properties, "Fill");
        String color = fill == null ? null : attribute(fill, "color");
        if (color == null) {
            throw new MalformedDocumentException("Node " + id + " has no fill color", path);
        }
        return new NodeStyle(text, color, readFontSize(label, id, path));
    }

    private static int readFontSize(Element label, String id, LabelPath path) {
        String value = attribute(label, "fontSize");
        if (value == null) {
            return GraphMl.DEFAULT_FONT_SIZE;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedDocumentException("Node " + id + " has a non-numeric font size: " + value, path, e);
        }
    }

    private static Element findProperties(Element nodeElement) {
        for (Element data : children(nodeElement, "data")) {
            Element shape = firstChild(data, "ShapeNode");
            if (shape != null) {
                return shape;
            }
            Element proxy = firstChild(data, "ProxyAutoBoundsNode");
            if (proxy != null) {
                Element realizers = firstChild(proxy, "Realizers");
                Element group = realizers == null ? null : firstChild(realizers, "GroupNode");
                if (group != null) {
                    return group;
                }
            }
        }
        return null;
    }

    private NodeClass readNodeClass(Element nodeElement, NodeStyle style, LabelPath path, Set<String> classKeys) {
        if (!classKeys.isEmpty()) {
            for (Element data : children(nodeElement, "data")) {
                if (classKeys.contains(data.getAttribute("key"))) {
                    try {
                        return NodeClass.fromKey(data.getTextContent());
                    } catch (IllegalArgumentException e) {
                        throw new MalformedDocumentException(e.getMessage(), path, e);
                    }
                }
            }
        }
        return classifier.classify(style.getFillColor(), path);
    }

    private static List<GraphEdge> readEdges(Element graphElement, LabelPath path) {
        List<GraphEdge> edges = new ArrayList<>();
        for (Element edge : children(graphElement, "edge")) {
            String source = attribute(edge, "source");
            String target = attribute(edge, "target");
            if (source == null || target == null) {
                throw new MalformedDocumentException("Edge " + attribute(edge, "id") + " is missing an endpoint", path);
            }
            edges.add(new GraphEdge(attribute(edge, "id"), source, target));
        }
        return edges;
    }

    private static Set<String> nodeClassKeys(Element root) {
        Set<String> keys = new HashSet<>();
        for (Element key : children(root, "key")) {
            if (GraphMl.NODE_CLASS_ATTRIBUTE.equals(key.getAttribute("attr.name"))) {
                keys.add(key.getAttribute("id"));
            }
        }
        return keys;
    }

    private static Document parse(InputStream in, String systemId) throws IOException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setIgnoringComments(true);
            dbf.setCoalescing(true);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DocumentBuilder db = dbf.newDocumentBuilder();
            return db.parse(in, systemId);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        } catch (SAXException e) {
            throw new MalformedDocumentException("Not well-formed GraphML in " + systemId + ": " + e.getMessage(), null, e);
        }
    }

    /**
     * A graph element being read: its node elements, the nodes built so far and the node that owns it.
     */
    private static final class Frame {
        final Element graphElement;
        final LabelPath path;
        final GraphNode.Builder owner; // null for the document's top-level graph
        final List<Element> nodeElements;
        final List<GraphNode> built = new ArrayList<>();
        int next;

        Frame(Element graphElement, LabelPath path, GraphNode.Builder owner) {
            this.graphElement = graphElement;
            this.path = path;
            this.owner = owner;
            this.nodeElements = children(graphElement, "node");
        }
    }
}
