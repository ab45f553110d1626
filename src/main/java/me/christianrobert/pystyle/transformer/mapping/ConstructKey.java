package me.christianrobert.pystyle.transformer.mapping;

import java.util.Objects;

/**
 * Lookup key of the mapping table: construct family, origin name, arity and operand variant.
 *
 * <p>{@link #ANY_ARITY} and {@link OperandVariant#ANY} act as wildcards when a more
 * specific entry is missing.</p>
 */
public class ConstructKey {

    public static final int ANY_ARITY = -1;

    private final ConstructKind kind;
    private final String name;
    private final int arity;
    private final OperandVariant variant;

    public ConstructKey(ConstructKind kind, String name, int arity, OperandVariant variant) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.arity = arity;
        this.variant = variant != null ? variant : OperandVariant.ANY;
    }

    public static ConstructKey of(ConstructKind kind, String name) {
        return new ConstructKey(kind, name, ANY_ARITY, OperandVariant.ANY);
    }

    public static ConstructKey of(ConstructKind kind, String name, int arity) {
        return new ConstructKey(kind, name, arity, OperandVariant.ANY);
    }

    public static ConstructKey of(ConstructKind kind, String name, int arity, OperandVariant variant) {
        return new ConstructKey(kind, name, arity, variant);
    }

    public ConstructKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public OperandVariant getVariant() {
        return variant;
    }

    ConstructKey withArity(int newArity) {
        return new ConstructKey(kind, name, newArity, variant);
    }

    ConstructKey withVariant(OperandVariant newVariant) {
        return new ConstructKey(kind, name, arity, newVariant);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstructKey that = (ConstructKey) o;
        return arity == that.arity && kind == that.kind
                && name.equals(that.name) && variant == that.variant;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, arity, variant);
    }

    @Override
    public String toString() {
        return kind + ":" + name + "/" + (arity == ANY_ARITY ? "*" : String.valueOf(arity)) + "/" + variant;
    }
}
