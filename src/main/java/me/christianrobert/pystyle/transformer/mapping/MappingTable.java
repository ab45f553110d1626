package me.christianrobert.pystyle.transformer.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable registry from origin construct to target-dialect template.
 *
 * <p>Lookup is a handful of hash lookups, from most to least specific:</p>
 * <ol>
 *   <li>exact (arity, variant)</li>
 *   <li>(arity, {@link OperandVariant#ANY})</li>
 *   <li>({@link ConstructKey#ANY_ARITY}, variant)</li>
 *   <li>({@link ConstructKey#ANY_ARITY}, {@link OperandVariant#ANY})</li>
 * </ol>
 * <p>A wildcard-arity entry only matches if its template has enough arguments.</p>
 *
 * <p>Shared read-only between concurrent conversions.</p>
 */
public class MappingTable {

    private static final Logger log = LoggerFactory.getLogger(MappingTable.class);

    private final Map<ConstructKey, MappingEntry> entries;
    private final Set<String> names;  // kind + ":" + name, for "is this construct mapped at all"

    private MappingTable(Map<ConstructKey, MappingEntry> entries) {
        this.entries = Collections.unmodifiableMap(new HashMap<>(entries));
        Set<String> keys = new HashSet<>();
        for (ConstructKey key : entries.keySet()) {
            keys.add(key.getKind() + ":" + key.getName());
        }
        this.names = Collections.unmodifiableSet(keys);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds the template for a construct.
     *
     * @param kind Construct family
     * @param name Origin name (builtin name, operator enum name, literal name, ...)
     * @param arity Number of rendered arguments/operands
     * @param variant Variant of the deciding operand's inferred type
     * @return the most specific entry, or {@code null} if the construct is unmapped for this arity
     */
    public MappingEntry lookup(ConstructKind kind, String name, int arity, OperandVariant variant) {
        ConstructKey exact = ConstructKey.of(kind, name, arity, variant);
        MappingEntry entry = entries.get(exact);
        if (entry != null) {
            return entry;
        }
        if (variant != OperandVariant.ANY) {
            entry = entries.get(exact.withVariant(OperandVariant.ANY));
            if (entry != null) {
                return entry;
            }
        }
        entry = entries.get(exact.withArity(ConstructKey.ANY_ARITY));
        if (entry != null && entry.getTemplate().accepts(arity)) {
            return entry;
        }
        if (variant != OperandVariant.ANY) {
            entry = entries.get(ConstructKey.of(kind, name, ConstructKey.ANY_ARITY, OperandVariant.ANY));
            if (entry != null && entry.getTemplate().accepts(arity)) {
                return entry;
            }
        }
        return null;
    }

    public MappingEntry lookup(ConstructKind kind, String name, int arity) {
        return lookup(kind, name, arity, OperandVariant.ANY);
    }

    /**
     * Looks up a construct that takes no arguments (literal names, magic methods, type names).
     */
    public MappingEntry lookup(ConstructKind kind, String name) {
        return lookup(kind, name, 0, OperandVariant.ANY);
    }

    /**
     * True if any entry exists for the construct, whatever its arity or variant.
     */
    public boolean hasConstruct(ConstructKind kind, String name) {
        return names.contains(kind + ":" + name);
    }

    public int size() {
        return entries.size();
    }

    public Collection<MappingEntry> getEntries() {
        return entries.values();
    }

    /**
     * Returns a new table with the contributed entries layered on top.
     * Later contributions override earlier ones and built-ins with the same key.
     */
    public MappingTable withContributions(List<MappingEntry> contributions) {
        if (contributions == null || contributions.isEmpty()) {
            return this;
        }
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        for (MappingEntry contribution : contributions) {
            MappingEntry previous = builder.entries.put(contribution.getKey(), contribution);
            if (previous != null) {
                log.debug("Mapping {} overridden by {} (was {})", contribution.getKey(),
                        contribution.getOrigin(), previous.getOrigin());
            }
        }
        return builder.build();
    }

    public static class Builder {
        private final Map<ConstructKey, MappingEntry> entries = new HashMap<>();

        public Builder add(MappingEntry entry) {
            entries.put(entry.getKey(), entry);
            return this;
        }

        public Builder addAll(Collection<MappingEntry> toAdd) {
            for (MappingEntry entry : toAdd) {
                add(entry);
            }
            return this;
        }

        public MappingTable build() {
            return new MappingTable(entries);
        }
    }
}
