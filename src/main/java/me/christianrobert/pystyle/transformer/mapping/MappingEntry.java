package me.christianrobert.pystyle.transformer.mapping;

import me.christianrobert.pystyle.transformer.type.InferredType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of the mapping table: how an origin construct renders in the target dialect.
 *
 * <p>Immutable. {@link #returning(InferredType)} and {@link #importing(String...)} return
 * modified copies.</p>
 */
public class MappingEntry {

    public static final String BUILTIN_ORIGIN = "builtin";

    private final ConstructKey key;
    private final Template template;
    private final InferredType returnType;
    private final List<String> requiredImports;
    private final String origin;

    public MappingEntry(ConstructKey key, Template template, InferredType returnType,
                        List<String> requiredImports, String origin) {
        this.key = Objects.requireNonNull(key, "key");
        this.template = Objects.requireNonNull(template, "template");
        this.returnType = returnType;
        this.requiredImports = requiredImports != null
                ? Collections.unmodifiableList(new ArrayList<>(requiredImports))
                : Collections.emptyList();
        this.origin = origin != null ? origin : BUILTIN_ORIGIN;
    }

    public static MappingEntry of(ConstructKey key, String pattern) {
        return new MappingEntry(key, Template.of(pattern), null, null, BUILTIN_ORIGIN);
    }

    public MappingEntry returning(InferredType type) {
        return new MappingEntry(key, template, type, requiredImports, origin);
    }

    public MappingEntry importing(String... imports) {
        List<String> merged = new ArrayList<>(requiredImports);
        merged.addAll(Arrays.asList(imports));
        return new MappingEntry(key, template, returnType, merged, origin);
    }

    /**
     * Copy attributed to a plugin (used in diagnostics and logs).
     */
    public MappingEntry contributedBy(String pluginId) {
        return new MappingEntry(key, template, returnType, requiredImports, pluginId);
    }

    public ConstructKey getKey() {
        return key;
    }

    public Template getTemplate() {
        return template;
    }

    /**
     * Declared type of the rendered expression, or {@code null} when it depends on the operands.
     */
    public InferredType getReturnType() {
        return returnType;
    }

    /**
     * Fully qualified names the rendered text needs imported (e.g. {@code java.util.ArrayList}).
     */
    public List<String> getRequiredImports() {
        return requiredImports;
    }

    public String getOrigin() {
        return origin;
    }

    public String render(List<String> arguments) {
        return template.render(arguments);
    }

    @Override
    public String toString() {
        return "MappingEntry{" + key + " -> " + template + (returnType != null ? " : " + returnType.getDisplayName() : "")
                + ", origin=" + origin + "}";
    }
}
