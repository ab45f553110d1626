package me.christianrobert.pystyle.transformer.mapping;

import me.christianrobert.pystyle.transformer.type.InferredType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Built-in rows of the mapping table.
 *
 * <p>Operator entries are keyed by the operator enum name ({@code ADD}, {@code EQ}, ...),
 * literal entries by {@code TRUE}/{@code FALSE}/{@code NONE}/{@code FSTRING}.
 * Every binary operation renders parenthesized so that the target dialect's precedence
 * rules never change the meaning.</p>
 */
public final class BuiltinMappings {

    /**
     * Builtins of the origin language. A call to one of these without a table entry is
     * an unmapped construct, a call to any other name is a plain call.
     */
    private static final Set<String> KNOWN_BUILTINS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "abs", "all", "any", "bin", "bool", "callable", "chr", "dict", "dir", "divmod",
            "enumerate", "filter", "float", "format", "frozenset", "getattr", "hasattr", "hash",
            "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len", "list", "map",
            "max", "min", "next", "oct", "open", "ord", "pow", "print", "range", "repr",
            "reversed", "round", "set", "setattr", "sorted", "str", "sum", "tuple", "type",
            "vars", "zip")));

    /**
     * Reductions that have a well-defined loop equivalent.
     */
    private static final Set<String> LOOP_REDUCTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "sum", "any", "all")));

    private static final String ARRAY_LIST = "java.util.ArrayList";
    private static final String HASH_MAP = "java.util.HashMap";
    private static final String COLLECTIONS = "java.util.Collections";
    private static final String COLLECTORS = "java.util.stream.Collectors";
    private static final String INT_STREAM = "java.util.stream.IntStream";

    private static final MappingTable DEFAULT_TABLE = MappingTable.builder().addAll(entries()).build();

    private BuiltinMappings() {
    }

    /**
     * The shared built-in table.
     */
    public static MappingTable defaultTable() {
        return DEFAULT_TABLE;
    }

    public static boolean isKnownBuiltin(String name) {
        return KNOWN_BUILTINS.contains(name);
    }

    public static boolean isLoopReduction(String name) {
        return LOOP_REDUCTIONS.contains(name);
    }

    static List<MappingEntry> entries() {
        List<MappingEntry> entries = new ArrayList<>();
        addBuiltinCalls(entries);
        addBinaryOperators(entries);
        addComparisonOperators(entries);
        addUnaryOperators(entries);
        addLiterals(entries);
        addMagicMethods(entries);
        addTypeNames(entries);
        return entries;
    }

    // ========== Builtin calls ==========

    private static void addBuiltinCalls(List<MappingEntry> e) {
        // Console output
        e.add(call("print", 0, OperandVariant.ANY, "System.out.println()"));
        e.add(call("print", ConstructKey.ANY_ARITY, OperandVariant.ANY, "System.out.println({+})"));

        // Length: character count for text, element count for collections
        e.add(call("len", 1, OperandVariant.TEXT, "{0}.length()").returning(InferredType.INTEGER));
        e.add(call("len", 1, OperandVariant.LIST, "{0}.size()").returning(InferredType.INTEGER));
        e.add(call("len", 1, OperandVariant.MAP, "{0}.size()").returning(InferredType.INTEGER));
        e.add(call("len", 1, OperandVariant.ANY, "{0}.size()").returning(InferredType.INTEGER));

        // Ranges outside a for header (inside one they become a counted loop)
        InferredType intList = InferredType.listOf(InferredType.INTEGER);
        e.add(call("range", 1, OperandVariant.ANY, "IntStream.range(0, {0}).boxed().collect(Collectors.toList())")
                .returning(intList).importing(INT_STREAM, COLLECTORS));
        e.add(call("range", 2, OperandVariant.ANY, "IntStream.range({0}, {1}).boxed().collect(Collectors.toList())")
                .returning(intList).importing(INT_STREAM, COLLECTORS));

        // Constructors with declared return types
        e.add(call("str", 0, OperandVariant.ANY, "\"\"").returning(InferredType.TEXT));
        e.add(call("str", 1, OperandVariant.ANY, "String.valueOf({0})").returning(InferredType.TEXT));

        e.add(call("int", 0, OperandVariant.ANY, "0").returning(InferredType.INTEGER));
        e.add(call("int", 1, OperandVariant.TEXT, "Integer.parseInt({0})").returning(InferredType.INTEGER));
        e.add(call("int", 1, OperandVariant.NUMERIC, "(int) ({0})").returning(InferredType.INTEGER));
        e.add(call("int", 1, OperandVariant.ANY, "Integer.parseInt(String.valueOf({0}))").returning(InferredType.INTEGER));

        e.add(call("float", 0, OperandVariant.ANY, "0.0").returning(InferredType.FLOAT));
        e.add(call("float", 1, OperandVariant.TEXT, "Double.parseDouble({0})").returning(InferredType.FLOAT));
        e.add(call("float", 1, OperandVariant.NUMERIC, "(double) ({0})").returning(InferredType.FLOAT));
        e.add(call("float", 1, OperandVariant.ANY, "Double.parseDouble(String.valueOf({0}))").returning(InferredType.FLOAT));

        e.add(call("bool", 0, OperandVariant.ANY, "false").returning(InferredType.BOOLEAN));
        e.add(call("bool", 1, OperandVariant.TEXT, "!{0}.isEmpty()").returning(InferredType.BOOLEAN));
        e.add(call("bool", 1, OperandVariant.LIST, "!{0}.isEmpty()").returning(InferredType.BOOLEAN));
        e.add(call("bool", 1, OperandVariant.MAP, "!{0}.isEmpty()").returning(InferredType.BOOLEAN));
        e.add(call("bool", 1, OperandVariant.NUMERIC, "({0} != 0)").returning(InferredType.BOOLEAN));
        e.add(call("bool", 1, OperandVariant.ANY, "({0} != null)").returning(InferredType.BOOLEAN));

        e.add(call("list", 0, OperandVariant.ANY, "new ArrayList<>()")
                .returning(InferredType.listOf(InferredType.UNKNOWN)).importing(ARRAY_LIST));
        e.add(call("list", 1, OperandVariant.ANY, "new ArrayList<>({0})")
                .returning(InferredType.listOf(InferredType.UNKNOWN)).importing(ARRAY_LIST));
        e.add(call("dict", 0, OperandVariant.ANY, "new HashMap<>()")
                .returning(InferredType.mapOf(InferredType.UNKNOWN, InferredType.UNKNOWN)).importing(HASH_MAP));
        e.add(call("dict", 1, OperandVariant.ANY, "new HashMap<>({0})")
                .returning(InferredType.mapOf(InferredType.UNKNOWN, InferredType.UNKNOWN)).importing(HASH_MAP));

        // Numeric helpers
        e.add(call("abs", 1, OperandVariant.ANY, "Math.abs({0})"));
        e.add(call("round", 1, OperandVariant.ANY, "(int) Math.round({0})").returning(InferredType.INTEGER));
        e.add(call("max", 1, OperandVariant.ANY, "Collections.max({0})").importing(COLLECTIONS));
        e.add(call("max", 2, OperandVariant.ANY, "Math.max({0}, {1})"));
        e.add(call("min", 1, OperandVariant.ANY, "Collections.min({0})").importing(COLLECTIONS));
        e.add(call("min", 2, OperandVariant.ANY, "Math.min({0}, {1})"));
    }

    // ========== Operators ==========

    private static void addBinaryOperators(List<MappingEntry> e) {
        e.add(binary("ADD", OperandVariant.ANY, "({0} + {1})"));
        e.add(binary("ADD", OperandVariant.TEXT, "({0} + {1})").returning(InferredType.TEXT));
        e.add(binary("SUB", OperandVariant.ANY, "({0} - {1})"));
        e.add(binary("MULT", OperandVariant.ANY, "({0} * {1})"));
        e.add(binary("MULT", OperandVariant.TEXT, "{0}.repeat({1})").returning(InferredType.TEXT));
        e.add(binary("DIV", OperandVariant.ANY, "({0} / {1})").returning(InferredType.FLOAT));
        e.add(binary("MOD", OperandVariant.ANY, "({0} % {1})"));
        e.add(binary("MOD", OperandVariant.TEXT, "String.format({0}, {1})").returning(InferredType.TEXT));
        e.add(binary("POW", OperandVariant.ANY, "Math.pow({0}, {1})").returning(InferredType.FLOAT));
        e.add(binary("FLOOR_DIV", OperandVariant.ANY, "Math.floorDiv({0}, {1})").returning(InferredType.INTEGER));
        e.add(binary("LSHIFT", OperandVariant.ANY, "({0} << {1})").returning(InferredType.INTEGER));
        e.add(binary("RSHIFT", OperandVariant.ANY, "({0} >> {1})").returning(InferredType.INTEGER));
        e.add(binary("BIT_OR", OperandVariant.ANY, "({0} | {1})"));
        e.add(binary("BIT_XOR", OperandVariant.ANY, "({0} ^ {1})"));
        e.add(binary("BIT_AND", OperandVariant.ANY, "({0} & {1})"));
        e.add(binary("AND", OperandVariant.ANY, "({0} && {1})").returning(InferredType.BOOLEAN));
        e.add(binary("OR", OperandVariant.ANY, "({0} || {1})").returning(InferredType.BOOLEAN));
    }

    private static void addComparisonOperators(List<MappingEntry> e) {
        e.add(compare("EQ", OperandVariant.ANY, "({0} == {1})"));
        e.add(compare("NOT_EQ", OperandVariant.ANY, "({0} != {1})"));
        for (OperandVariant objectVariant : Arrays.asList(OperandVariant.TEXT, OperandVariant.LIST, OperandVariant.MAP)) {
            e.add(compare("EQ", objectVariant, "{0}.equals({1})"));
            e.add(compare("NOT_EQ", objectVariant, "!{0}.equals({1})"));
        }
        e.add(compare("LT", OperandVariant.ANY, "({0} < {1})"));
        e.add(compare("LT_E", OperandVariant.ANY, "({0} <= {1})"));
        e.add(compare("GT", OperandVariant.ANY, "({0} > {1})"));
        e.add(compare("GT_E", OperandVariant.ANY, "({0} >= {1})"));
        e.add(compare("LT", OperandVariant.TEXT, "({0}.compareTo({1}) < 0)"));
        e.add(compare("LT_E", OperandVariant.TEXT, "({0}.compareTo({1}) <= 0)"));
        e.add(compare("GT", OperandVariant.TEXT, "({0}.compareTo({1}) > 0)"));
        e.add(compare("GT_E", OperandVariant.TEXT, "({0}.compareTo({1}) >= 0)"));
        e.add(compare("IS", OperandVariant.ANY, "({0} == {1})"));
        e.add(compare("IS_NOT", OperandVariant.ANY, "({0} != {1})"));
        // membership: the variant is taken from the container (right operand)
        e.add(compare("IN", OperandVariant.ANY, "{1}.contains({0})"));
        e.add(compare("IN", OperandVariant.MAP, "{1}.containsKey({0})"));
        e.add(compare("NOT_IN", OperandVariant.ANY, "!{1}.contains({0})"));
        e.add(compare("NOT_IN", OperandVariant.MAP, "!{1}.containsKey({0})"));
    }

    private static void addUnaryOperators(List<MappingEntry> e) {
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.UNARY_OPERATOR, "NOT", 1), "!{0}")
                .returning(InferredType.BOOLEAN));
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.UNARY_OPERATOR, "NEGATE", 1), "(-{0})"));
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.UNARY_OPERATOR, "PLUS", 1), "(+{0})"));
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.UNARY_OPERATOR, "INVERT", 1), "(~{0})")
                .returning(InferredType.INTEGER));
    }

    // ========== Literals, magic methods, type names ==========

    private static void addLiterals(List<MappingEntry> e) {
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.LITERAL, "TRUE"), "true").returning(InferredType.BOOLEAN));
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.LITERAL, "FALSE"), "false").returning(InferredType.BOOLEAN));
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.LITERAL, "NONE"), "null"));
        // first argument is the format string with %s placeholders
        e.add(MappingEntry.of(ConstructKey.of(ConstructKind.LITERAL, "FSTRING"), "String.format({*})")
                .returning(InferredType.TEXT));
    }

    private static void addMagicMethods(List<MappingEntry> e) {
        e.add(magic("__str__", "toString").returning(InferredType.TEXT));
        e.add(magic("__repr__", "toString").returning(InferredType.TEXT));
        e.add(magic("__eq__", "equals").returning(InferredType.BOOLEAN));
        e.add(magic("__hash__", "hashCode").returning(InferredType.INTEGER));
        e.add(magic("__len__", "size").returning(InferredType.INTEGER));
        e.add(magic("__contains__", "contains").returning(InferredType.BOOLEAN));
        e.add(magic("__getitem__", "get"));
        e.add(magic("__setitem__", "set"));
        e.add(magic("__iter__", "iterator"));
        e.add(magic("__next__", "next"));
        e.add(magic("__add__", "plus"));
        e.add(magic("__sub__", "minus"));
        e.add(magic("__mul__", "multiply"));
        e.add(magic("__truediv__", "divide"));
    }

    private static void addTypeNames(List<MappingEntry> e) {
        e.add(typeName("int", "int").returning(InferredType.INTEGER));
        e.add(typeName("float", "double").returning(InferredType.FLOAT));
        e.add(typeName("str", "String").returning(InferredType.TEXT));
        e.add(typeName("bool", "boolean").returning(InferredType.BOOLEAN));
        e.add(typeName("list", "List<Object>").returning(InferredType.listOf(InferredType.UNKNOWN))
                .importing("java.util.List"));
        e.add(typeName("tuple", "List<Object>").returning(InferredType.listOf(InferredType.UNKNOWN))
                .importing("java.util.List"));
        e.add(typeName("dict", "Map<Object, Object>")
                .returning(InferredType.mapOf(InferredType.UNKNOWN, InferredType.UNKNOWN))
                .importing("java.util.Map"));
        e.add(typeName("set", "Set<Object>").returning(InferredType.UNKNOWN).importing("java.util.Set"));
        e.add(typeName("object", "Object").returning(InferredType.UNKNOWN));
        e.add(typeName("None", "void"));
    }

    // ========== Helpers ==========

    private static MappingEntry call(String name, int arity, OperandVariant variant, String pattern) {
        return MappingEntry.of(ConstructKey.of(ConstructKind.BUILTIN_CALL, name, arity, variant), pattern);
    }

    private static MappingEntry binary(String operator, OperandVariant variant, String pattern) {
        return MappingEntry.of(ConstructKey.of(ConstructKind.BINARY_OPERATOR, operator, 2, variant), pattern);
    }

    private static MappingEntry compare(String operator, OperandVariant variant, String pattern) {
        return MappingEntry.of(ConstructKey.of(ConstructKind.COMPARISON_OPERATOR, operator, 2, variant), pattern)
                .returning(InferredType.BOOLEAN);
    }

    private static MappingEntry magic(String name, String targetName) {
        return MappingEntry.of(ConstructKey.of(ConstructKind.MAGIC_METHOD, name), targetName);
    }

    private static MappingEntry typeName(String name, String targetName) {
        return MappingEntry.of(ConstructKey.of(ConstructKind.TYPE_NAME, name), targetName);
    }
}
