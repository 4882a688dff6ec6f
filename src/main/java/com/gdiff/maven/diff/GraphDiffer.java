package com.gdiff.maven.diff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.GraphRebuilder;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.PathResolver;

/**
 * One-directional structural diff of two compound graphs.
 * <p>
 * The result is a copy of the source with the same nodes, edges and identifiers, where every node is
 * painted by whether its label path also exists in the other document. Nothing is added or removed.
 */
public class GraphDiffer {

    private static final String SOURCE = "source document";

    private final DuplicateLabelPolicy duplicateLabelPolicy;

    public GraphDiffer() {
        this(DuplicateLabelPolicy.WARN);
    }

    public GraphDiffer(DuplicateLabelPolicy duplicateLabelPolicy) {
        this.duplicateLabelPolicy = duplicateLabelPolicy;
    }

    /**
     * Paints a copy of {@code source}: {@code intersect} for nodes whose label path resolves in
     * {@code other}, {@code sourceOnly} for the rest.
     *
     * @return painted copy, identity rename map of every source node, provenance per label path
     */
    public DiffResult diff(GraphDocument source, GraphDocument other, Palette palette) {
        RenameMap renameMap = new RenameMap();
        Map<LabelPath, Provenance> provenance = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        duplicateLabelPolicy.checkSiblings(source.getRoot().getNodes(), LabelPath.root(), SOURCE, warnings);
        GraphDocument painted = GraphRebuilder.rebuild(source, (path, node, parent) -> {
            if (node.hasSubgraph()) {
                duplicateLabelPolicy.checkSiblings(node.getSubgraph().getNodes(), path, SOURCE, warnings);
            }
            Optional<GraphNode> match = duplicateLabelPolicy.select(
                    PathResolver.resolve(other, path), path, "other document", warnings);
            Provenance slot = match.isPresent() && match.get().getLabel().equals(node.getLabel())
                    ? Provenance.INTERSECT
                    : Provenance.SOURCE_ONLY;
            provenance.put(path, slot);
            renameMap.put(node.getId(), node.getId());
            return node.withFillColor(palette.color(slot, node.getNodeClass()));
        });

        return new DiffResult(painted, renameMap, provenance, warnings);
    }
}
