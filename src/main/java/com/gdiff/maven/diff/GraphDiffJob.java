package com.gdiff.maven.diff;

import com.gdiff.maven.graph.GraphDocument;

/**
 * Runs a complete comparison of two documents in matrix or union mode and names the outputs.
 * <p>
 * Matrix mode yields the forward diff, recolored reference copies of both inputs and the reverse diff.
 * Union mode yields a single merged document. Every output has its label fonts enlarged once by the
 * configured delta. Inputs are never modified; any error aborts the run before outputs exist.
 */
public class GraphDiffJob {

    public static final String EXTENSION = ".graphml";

    private final DiffMode mode;
    private final Palette palette;
    private final int fontSizeDelta;
    private final GraphDiffer differ;
    private final GraphMerger merger;

    private String forwardOutput;
    private String reverseOutput;

    public GraphDiffJob(DiffMode mode, Palette palette, int fontSizeDelta, DuplicateLabelPolicy duplicateLabelPolicy) {
        this.mode = mode;
        this.palette = palette;
        this.fontSizeDelta = fontSizeDelta;
        this.differ = new GraphDiffer(duplicateLabelPolicy);
        this.merger = new GraphMerger(duplicateLabelPolicy);
    }

    /**
     * Overrides the file names of the forward and reverse diff in matrix mode; null keeps the default.
     */
    public GraphDiffJob withOutputNames(String forward, String reverse) {
        this.forwardOutput = forward;
        this.reverseOutput = reverse;
        return this;
    }

    /**
     * @param sourceName file name of the first input, used to derive output names
     * @param otherName  file name of the second input
     */
    public DiffRun run(String sourceName, GraphDocument source, String otherName, GraphDocument other) {
        String src = baseName(sourceName);
        String oth = baseName(otherName);
        DiffRun run = new DiffRun(mode);

        switch (mode) {
            case MATRIX: {
                DiffResult forward = differ.diff(source, other, palette);
                DiffResult reverse = differ.diff(other, source, palette.mirrored());
                String forwardName = forwardOutput != null ? forwardOutput : src + "_" + oth + "_diff" + EXTENSION;
                String reverseName = reverseOutput != null ? reverseOutput : oth + "_" + src + "_diff" + EXTENSION;
                run.addResult(forwardName, forward, resize(forward.getDocument()));
                run.addOutput(src + "_recolored" + EXTENSION, resize(referenceCopy(source, Provenance.SOURCE_ONLY)));
                run.addOutput(oth + "_recolored" + EXTENSION, resize(referenceCopy(other, Provenance.OTHER_ONLY)));
                run.addResult(reverseName, reverse, resize(reverse.getDocument()));
                break;
            }
            case UNION: {
                DiffResult union = merger.merge(differ.diff(source, other, palette), other, palette);
                run.addResult(src + "_" + oth + "_union" + EXTENSION, union, resize(union.getDocument()));
                break;
            }
            default:
                throw new InvalidModeException(mode.key());
        }
        return run;
    }

    /**
     * Flat recolored copy of an input, painted by node class with one palette slot.
     */
    public GraphDocument referenceCopy(GraphDocument document, Provenance slot) {
        return CosmeticPass.recolor(document, palette.slot(slot));
    }

    public GraphDocument resize(GraphDocument document) {
        return CosmeticPass.resizeFonts(document, fontSizeDelta);
    }

    public DiffMode getMode() {
        return mode;
    }

    public Palette getPalette() {
        return palette;
    }

    public static String baseName(String fileName) {
        String name = fileName;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        return name.endsWith(EXTENSION) ? name.substring(0, name.length() - EXTENSION.length()) : name;
    }
}
