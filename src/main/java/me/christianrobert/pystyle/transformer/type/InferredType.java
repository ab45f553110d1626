package me.christianrobert.pystyle.transformer.type;

import java.util.Objects;

/**
 * Best-guess type of a binding or expression.
 * <p>
 * The lattice is flat apart from the two collection kinds: {@link Kind#OBJECT_UNKNOWN} is the
 * top element every conflicting guess widens to. Nothing here is sound; a type is a
 * rendering hint, never a guarantee about runtime values.
 * </p>
 */
public class InferredType {

    public static final InferredType INTEGER = new InferredType(Kind.INTEGER, null, null);
    public static final InferredType FLOAT = new InferredType(Kind.FLOAT, null, null);
    public static final InferredType BOOLEAN = new InferredType(Kind.BOOLEAN, null, null);
    public static final InferredType TEXT = new InferredType(Kind.TEXT, null, null);
    public static final InferredType UNKNOWN = new InferredType(Kind.OBJECT_UNKNOWN, null, null);

    private final Kind kind;
    private final InferredType first;   // element type (LIST_OF) or key type (MAP_OF)
    private final InferredType second;  // value type (MAP_OF)

    private InferredType(Kind kind, InferredType first, InferredType second) {
        this.kind = kind;
        this.first = first;
        this.second = second;
    }

    public static InferredType listOf(InferredType elementType) {
        return new InferredType(Kind.LIST_OF, orUnknown(elementType), null);
    }

    public static InferredType mapOf(InferredType keyType, InferredType valueType) {
        return new InferredType(Kind.MAP_OF, orUnknown(keyType), orUnknown(valueType));
    }

    private static InferredType orUnknown(InferredType type) {
        return type != null ? type : UNKNOWN;
    }

    // Kind checks
    public boolean isUnknown() {
        return kind == Kind.OBJECT_UNKNOWN;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isList() {
        return kind == Kind.LIST_OF;
    }

    public boolean isMap() {
        return kind == Kind.MAP_OF;
    }

    public boolean isCollection() {
        return isList() || isMap();
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Element type of a list, {@code null} for every other kind.
     */
    public InferredType getElementType() {
        return kind == Kind.LIST_OF ? first : null;
    }

    public InferredType getKeyType() {
        return kind == Kind.MAP_OF ? first : null;
    }

    public InferredType getValueType() {
        return kind == Kind.MAP_OF ? second : null;
    }

    /**
     * Type of the values a for loop over this type produces: list elements, map keys,
     * single characters of a text. Unknown for everything else.
     */
    public InferredType getIterationType() {
        switch (kind) {
            case LIST_OF:
            case MAP_OF:
                return first;
            case TEXT:
                return TEXT;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Declaration type in the target dialect (e.g. {@code int}, {@code List<String>}).
     */
    public String toJavaType() {
        switch (kind) {
            case INTEGER:
                return "int";
            case FLOAT:
                return "double";
            case BOOLEAN:
                return "boolean";
            case TEXT:
                return "String";
            case LIST_OF:
                return "List<" + first.toBoxedJavaType() + ">";
            case MAP_OF:
                return "Map<" + first.toBoxedJavaType() + ", " + second.toBoxedJavaType() + ">";
            case OBJECT_UNKNOWN:
            default:
                return "Object";
        }
    }

    /**
     * Type name usable as a generic argument ({@code Integer} instead of {@code int}).
     */
    public String toBoxedJavaType() {
        switch (kind) {
            case INTEGER:
                return "Integer";
            case FLOAT:
                return "Double";
            case BOOLEAN:
                return "Boolean";
            default:
                return toJavaType();
        }
    }

    /**
     * Short name used in tree dumps and diagnostics: {@code ListOf(Integer)}.
     */
    public String getDisplayName() {
        switch (kind) {
            case LIST_OF:
                return "ListOf(" + first.getDisplayName() + ")";
            case MAP_OF:
                return "MapOf(" + first.getDisplayName() + ", " + second.getDisplayName() + ")";
            default:
                return kind.getDisplayName();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InferredType that = (InferredType) o;
        return kind == that.kind &&
                Objects.equals(first, that.first) &&
                Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, first, second);
    }

    @Override
    public String toString() {
        return "InferredType{" + getDisplayName() + "}";
    }

    public enum Kind {
        INTEGER("Integer"),
        FLOAT("Float"),
        BOOLEAN("Boolean"),
        TEXT("Text"),
        LIST_OF("ListOf"),
        MAP_OF("MapOf"),
        OBJECT_UNKNOWN("ObjectUnknown");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }
}
