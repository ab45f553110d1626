package me.christianrobert.pystyle.transformer.mapping;

/**
 * Family of origin constructs the mapping table covers.
 */
public enum ConstructKind {
    BUILTIN_CALL,
    BINARY_OPERATOR,
    UNARY_OPERATOR,
    COMPARISON_OPERATOR,
    LITERAL,
    MAGIC_METHOD,
    TYPE_NAME
}
