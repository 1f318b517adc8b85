package com.pseudoparser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-node analysis data. A node only owns one of these once something has
 * been written to it, see {@link Node#getOrCreateMetadata()}.
 *
 * <p>All writes happen while the tree is being built. Once a tree has been
 * frozen with {@link Node#freezeMetadata()}, as every tree returned by the
 * parser is, each mutator throws {@link IllegalStateException}. Trees built by
 * hand stay writable until they are frozen.</p>
 */
public final class Metadata {

    private SourcePosition position;
    private Map<String, Object> complexityHints;
    private int loopDepth;
    private boolean recursive;
    private String patternType;
    private boolean frozen;

    Metadata() {
    }

    static Metadata frozenEmpty() {
        Metadata empty = new Metadata();
        empty.freeze();
        return empty;
    }

    void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Metadata is frozen");
        }
    }

    public Optional<SourcePosition> getPosition() {
        return Optional.ofNullable(position);
    }

    void setPosition(SourcePosition position) {
        checkWritable();
        this.position = position;
    }

    /**
     * @return an unmodifiable view of the hints, empty if none were recorded
     */
    public Map<String, Object> getComplexityHints() {
        if (complexityHints == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(complexityHints);
    }

    public void putComplexityHint(String key, Object value) {
        checkWritable();
        if (complexityHints == null) {
            complexityHints = new LinkedHashMap<>();
        }
        complexityHints.put(key, value);
    }

    /**
     * @return nesting depth of a loop node, 1 for an outermost loop; 0 when not a loop
     */
    public int getLoopDepth() {
        return loopDepth;
    }

    public void setLoopDepth(int loopDepth) {
        checkWritable();
        this.loopDepth = loopDepth;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        checkWritable();
        this.recursive = recursive;
    }

    public Optional<String> getPatternType() {
        return Optional.ofNullable(patternType);
    }

    public void setPatternType(String patternType) {
        checkWritable();
        this.patternType = patternType;
    }

    @Override
    public String toString() {
        return "Metadata[position=" + position
            + ", complexityHints=" + getComplexityHints()
            + ", loopDepth=" + loopDepth
            + ", recursive=" + recursive
            + ", patternType=" + patternType + "]";
    }
}
