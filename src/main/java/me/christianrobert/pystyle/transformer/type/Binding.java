package me.christianrobert.pystyle.transformer.type;

import me.christianrobert.pystyle.transformer.ast.SyntaxNode;

/**
 * A name bound in one scope, with its current type guess.
 *
 * <p>Created on the first assignment seen in declaration order. Later assignments can only
 * widen it (see {@link #widen(InferredType)}); once the scope is finalized the binding is
 * frozen and every write fails with {@link IllegalStateException}.</p>
 */
public class Binding {

    private final String name;
    private final String scopeId;
    private final SyntaxNode firstAssignment;
    private InferredType type;
    private boolean frozen;

    public Binding(String name, String scopeId, InferredType type, SyntaxNode firstAssignment) {
        this.name = name;
        this.scopeId = scopeId;
        this.type = type != null ? type : InferredType.UNKNOWN;
        this.firstAssignment = firstAssignment;
    }

    public String getName() {
        return name;
    }

    public String getScopeId() {
        return scopeId;
    }

    public InferredType getType() {
        return type;
    }

    /**
     * Statement or parameter that created the binding.
     */
    public SyntaxNode getFirstAssignment() {
        return firstAssignment;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Records a later assignment. A differing type widens the binding to
     * {@link InferredType#UNKNOWN}; there is no way back to a narrower type.
     *
     * @return true if the binding was widened by this call
     */
    boolean widen(InferredType assignedType) {
        checkWritable();
        if (type.isUnknown() || type.equals(assignedType)) {
            return false;
        }
        type = InferredType.UNKNOWN;
        return true;
    }

    /**
     * Replaces the type with a plugin-supplied one, just before freezing.
     */
    void override(InferredType overridingType) {
        checkWritable();
        type = overridingType != null ? overridingType : InferredType.UNKNOWN;
    }

    void freeze() {
        frozen = true;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Binding " + name + " in " + scopeId + " is frozen");
        }
    }

    @Override
    public String toString() {
        return "Binding{" + scopeId + "." + name + ": " + type.getDisplayName() + (frozen ? ", frozen" : "") + "}";
    }
}
