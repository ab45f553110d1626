package me.christianrobert.pystyle.transformer.mapping;

import me.christianrobert.pystyle.transformer.type.InferredType;

/**
 * Selects between templates of the same construct by the inferred type of the
 * deciding operand (e.g. {@code len} on text vs. on a list).
 */
public enum OperandVariant {
    ANY,
    NUMERIC,
    TEXT,
    LIST,
    MAP;

    public static OperandVariant of(InferredType type) {
        if (type == null) {
            return ANY;
        }
        switch (type.getKind()) {
            case INTEGER:
            case FLOAT:
                return NUMERIC;
            case TEXT:
                return TEXT;
            case LIST_OF:
                return LIST;
            case MAP_OF:
                return MAP;
            default:
                return ANY;
        }
    }
}
