package com.pseudoparser;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Options of a {@link LanguageParser}. Every value has a default, so
 * {@code new ParserSettings()} gives the standard behavior.
 */
public class ParserSettings {

    /**
     * Whether nodes get a {@link com.pseudoparser.ast.SourcePosition};
     * <code>true</code> by default.
     */
    private boolean propagatePositions = true;

    /**
     * Whether <code>and</code>/<code>or</code> build a
     * {@link com.pseudoparser.ast.ShortCircuitBinOp}, or a
     * {@link com.pseudoparser.ast.BinOp} with its short-circuit flag set;
     * <code>true</code> (dedicated node) by default.
     */
    private boolean dedicatedShortCircuitNodes = true;

    /**
     * Whether loop depth, recursion and complexity hints are recorded in node
     * metadata; <code>true</code> by default.
     */
    private boolean collectAnalysisHints = true;

    /**
     * Whether comments between statements become
     * {@link com.pseudoparser.ast.Comment} statements; <code>true</code> by
     * default. Comments inside a statement are never kept.
     */
    private boolean retainComments = true;

    /**
     * Encoding of source files read by {@link LanguageParser#parseFile};
     * UTF-8 by default.
     */
    private Charset charset = StandardCharsets.UTF_8;

    public boolean isPropagatePositions() {
        return propagatePositions;
    }

    public void setPropagatePositions(boolean propagatePositions) {
        this.propagatePositions = propagatePositions;
    }

    public boolean isDedicatedShortCircuitNodes() {
        return dedicatedShortCircuitNodes;
    }

    public void setDedicatedShortCircuitNodes(boolean dedicatedShortCircuitNodes) {
        this.dedicatedShortCircuitNodes = dedicatedShortCircuitNodes;
    }

    public boolean isCollectAnalysisHints() {
        return collectAnalysisHints;
    }

    public void setCollectAnalysisHints(boolean collectAnalysisHints) {
        this.collectAnalysisHints = collectAnalysisHints;
    }

    public boolean isRetainComments() {
        return retainComments;
    }

    public void setRetainComments(boolean retainComments) {
        this.retainComments = retainComments;
    }

    public Charset getCharset() {
        return charset;
    }

    public void setCharset(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    /**
     * @return a human readable representation of the settings values
     */
    public String toDescriptionString() {
        StringBuilder desc = new StringBuilder();

        final char newLine = '\n';

        desc.append("propagatePositions = ").append(isPropagatePositions()).append(newLine);
        desc.append("dedicatedShortCircuitNodes = ").append(isDedicatedShortCircuitNodes()).append(newLine);
        desc.append("collectAnalysisHints = ").append(isCollectAnalysisHints()).append(newLine);
        desc.append("retainComments = ").append(isRetainComments()).append(newLine);
        desc.append("charset = ").append(getCharset()).append(newLine);

        return desc.toString();
    }
}
