package com.gdiff.maven.diff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.gdiff.maven.graph.Graph;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphEdge;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.GraphRebuilder;
import com.gdiff.maven.graph.GraphTraversal;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.NodeId;
import com.gdiff.maven.graph.Resolution;

/**
 * Builds the union of a painted diff and a second document.
 * <p>
 * Nodes of the second document whose label path already exists are mapped onto the existing node.
 * The others are copied in under the node at their parent's label path, painted other-only and given
 * fresh identifiers from the parent graph's allocation counter; their descendants follow them, keeping
 * their own trailing identifier segment. Once a level of the second document has been walked, its edges
 * are translated through the rename map and appended to the matching merged level unless an edge
 * between the same two nodes already exists there. Edges inside inserted subtrees travel with them.
 */
public class GraphMerger {

    private static final String EDGE_ID_PREFIX = "e";
    private static final String GRAPH_ID_SUFFIX = ":";

    private final DuplicateLabelPolicy duplicateLabelPolicy;

    public GraphMerger() {
        this(DuplicateLabelPolicy.WARN);
    }

    public GraphMerger(DuplicateLabelPolicy duplicateLabelPolicy) {
        this.duplicateLabelPolicy = duplicateLabelPolicy;
    }

    /**
     * @param diffResult result of diffing the source against {@code other}; left untouched
     * @param other      the second document
     * @param palette    colors for inserted nodes ({@code otherOnly} slot)
     * @return union document with the rename map extended to every node of {@code other}
     */
    public DiffResult merge(DiffResult diffResult, GraphDocument other, Palette palette) {
        RenameMap renameMap = new RenameMap(diffResult.getRenameMap());
        Map<LabelPath, Provenance> provenance = new LinkedHashMap<>(diffResult.getProvenance());
        List<String> warnings = new ArrayList<>(diffResult.getWarnings());
        MergeState state = new MergeState(palette, renameMap, provenance, warnings,
                edgeIds(diffResult.getDocument()));

        Graph mergedRoot = mergeNodes(diffResult.getDocument().getRoot(), other.getRoot(), state);
        return new DiffResult(new GraphDocument(mergedRoot), renameMap, provenance, warnings);
    }

    private Graph mergeNodes(Graph mergedRoot, Graph otherRoot, MergeState state) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(LabelPath.root(), null, mergedRoot, otherRoot, -1));
        checkSiblings(otherRoot, LabelPath.root(), state);
        while (true) {
            Frame frame = stack.peek();
            if (frame.cursor < frame.otherGraph.getNodes().size()) {
                GraphNode otherNode = frame.otherGraph.getNodes().get(frame.cursor++);
                LabelPath path = frame.path.append(otherNode.getLabel());
                int existing = findChild(frame.children, path, state.warnings);
                if (existing >= 0) {
                    GraphNode mergedNode = frame.children.get(existing);
                    state.renameMap.put(otherNode.getId(), mergedNode.getId());
                    if (otherNode.hasSubgraph()) {
                        checkSiblings(otherNode.getSubgraph(), path, state);
                        stack.push(new Frame(path, mergedNode, mergedNode.getSubgraph(), otherNode.getSubgraph(), existing));
                    }
                } else {
                    NodeId newId = frame.owner == null
                            ? NodeId.root(frame.nextIndex)
                            : frame.owner.getId().child(frame.nextIndex);
                    frame.nextIndex++;
                    frame.children.add(insert(otherNode, newId, path, state));
                }
                continue;
            }
            stack.pop();
            Graph level = frame.build(state);
            if (stack.isEmpty()) {
                return level;
            }
            Frame parent = stack.peek();
            parent.children.set(frame.slot, frame.owner.withSubgraph(level));
        }
    }

    private int findChild(List<GraphNode> children, LabelPath path, List<String> warnings) {
        String label = path.last();
        int first = -1;
        int matches = 0;
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getLabel().equals(label)) {
                if (first < 0) {
                    first = i;
                }
                matches++;
            }
        }
        if (matches > 1) {
            Resolution ambiguous = Resolution.ambiguous(children.get(first), path);
            duplicateLabelPolicy.select(ambiguous, path, "union document", warnings);
        }
        return first;
    }

    /**
     * Copies {@code otherNode} and its whole subtree under {@code newId}, repainted and re-identified.
     */
    private GraphNode insert(GraphNode otherNode, NodeId newId, LabelPath path, MergeState state) {
        GraphNode top = otherNode.withId(newId).withFillColor(state.otherOnlyColor(otherNode));
        state.renameMap.put(otherNode.getId(), newId);
        state.provenance.put(path, Provenance.OTHER_ONLY);
        if (!otherNode.hasSubgraph()) {
            return top;
        }
        checkSiblings(otherNode.getSubgraph(), path, state);

        Graph moved = GraphRebuilder.rebuild(otherNode.getSubgraph(), path, top, (childPath, node, parent) -> {
            if (node.hasSubgraph()) {
                checkSiblings(node.getSubgraph(), childPath, state);
            }
            NodeId id = node.getId().withParent(parent.getId());
            state.renameMap.put(node.getId(), id);
            state.provenance.put(childPath, Provenance.OTHER_ONLY);
            GraphNode copy = node.withId(id).withFillColor(state.otherOnlyColor(node));
            return node.hasSubgraph() ? copy.withSubgraph(node.getSubgraph().withId(id + GRAPH_ID_SUFFIX)) : copy;
        });

        // endpoints of nested edges are only known once the whole subtree has new identifiers
        Graph relinked = GraphRebuilder.rebuild(moved, path, top, (childPath, node, parent) -> node.hasSubgraph()
                ? node.withSubgraph(node.getSubgraph().withEdges(remap(node.getSubgraph().getEdges(), state.renameMap)))
                : node);
        return top.withSubgraph(relinked
                .withId(newId + GRAPH_ID_SUFFIX)
                .withEdges(remap(relinked.getEdges(), state.renameMap)));
    }

    private static List<GraphEdge> remap(List<GraphEdge> edges, RenameMap renameMap) {
        List<GraphEdge> remapped = new ArrayList<>(edges.size());
        for (GraphEdge edge : edges) {
            remapped.add(edge.withEndpoints(renameMap.get(edge.getSource()), renameMap.get(edge.getTarget())));
        }
        return remapped;
    }

    private void checkSiblings(Graph otherLevel, LabelPath path, MergeState state) {
        duplicateLabelPolicy.checkSiblings(otherLevel.getNodes(), path, "other document", state.warnings);
    }

    private static List<GraphEdge> mergeEdges(List<GraphEdge> existing, List<GraphEdge> incoming, RenameMap renameMap,
            Set<String> usedIds) {
        if (incoming.isEmpty()) {
            return existing;
        }
        List<GraphEdge> merged = new ArrayList<>(existing);
        int counter = existing.size();
        for (GraphEdge edge : incoming) {
            String source = renameMap.get(edge.getSource());
            String target = renameMap.get(edge.getTarget());
            if (containsPair(merged, source, target)) {
                continue;
            }
            String id;
            do {
                id = EDGE_ID_PREFIX + counter++;
            } while (usedIds.contains(id));
            usedIds.add(id);
            merged.add(new GraphEdge(id, source, target));
        }
        return merged;
    }

    private static boolean containsPair(List<GraphEdge> edges, String a, String b) {
        for (GraphEdge edge : edges) {
            if (edge.connects(a, b)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> edgeIds(GraphDocument document) {
        Set<String> ids = new HashSet<>();
        for (GraphEdge edge : document.getRoot().getEdges()) {
            ids.add(edge.getId());
        }
        for (GraphTraversal.Visit visit : GraphTraversal.preorder(document)) {
            if (visit.getNode().hasSubgraph()) {
                for (GraphEdge edge : visit.getNode().getSubgraph().getEdges()) {
                    ids.add(edge.getId());
                }
            }
        }
        return ids;
    }

    private static final class MergeState {
        final Palette palette;
        final RenameMap renameMap;
        final Map<LabelPath, Provenance> provenance;
        final List<String> warnings;
        final Set<String> edgeIds; // every edge id in use anywhere in the merged document

        MergeState(Palette palette, RenameMap renameMap, Map<LabelPath, Provenance> provenance, List<String> warnings,
                Set<String> edgeIds) {
            this.palette = palette;
            this.renameMap = renameMap;
            this.provenance = provenance;
            this.warnings = warnings;
            this.edgeIds = edgeIds;
        }

        String otherOnlyColor(GraphNode node) {
            return palette.color(Provenance.OTHER_ONLY, node.getNodeClass());
        }
    }

    /**
     * One level of the zipped walk: the merged node, its growing child list and the other document's
     * children still to be merged into it.
     */
    private static final class Frame {
        final LabelPath path;
        final GraphNode owner;       // null for the document root
        final Graph mergedGraph;     // null while the merged node is a leaf
        final Graph otherGraph;
        final int slot;              // position of owner among its parent's children
        final List<GraphNode> children;
        int nextIndex;
        int cursor;

        Frame(LabelPath path, GraphNode owner, Graph mergedGraph, Graph otherGraph, int slot) {
            this.path = path;
            this.owner = owner;
            this.mergedGraph = mergedGraph;
            this.otherGraph = otherGraph;
            this.slot = slot;
            this.children = mergedGraph == null ? new ArrayList<>() : new ArrayList<>(mergedGraph.getNodes());
            this.nextIndex = mergedGraph == null ? 0 : mergedGraph.getNextIndex();
        }

        /**
         * The merged level, with the other level's edges appended once all its nodes have been mapped.
         */
        Graph build(MergeState state) {
            List<GraphEdge> existing = mergedGraph == null ? List.of() : mergedGraph.getEdges();
            List<GraphEdge> edges = mergeEdges(existing, otherGraph.getEdges(), state.renameMap, state.edgeIds);
            if (mergedGraph != null) {
                return mergedGraph.toBuilder().nodes(children).edges(edges).nextIndex(nextIndex).build();
            }
            if (children.isEmpty()) {
                return null;
            }
            return Graph.builder()
                    .id(owner.getId() + GRAPH_ID_SUFFIX)
                    .nodes(children)
                    .edges(edges)
                    .nextIndex(nextIndex)
                    .build();
        }
    }
}
