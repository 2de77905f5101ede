package org.qthought.runtime.requirements;

import org.qthought.runtime.api.ConflictException;
import org.qthought.runtime.api.MalformedRequirementsException;
import org.qthought.runtime.model.RegisterDeclaration;
import org.qthought.runtime.spi.IInterpretation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable ledger of the named resources a protocol needs, grouped by kind.
 * <p>
 * A name appears under at most one kind. Merging is associative and commutative; declaring the
 * same name under two incompatible kinds is a {@link ConflictException}. The only compatible pair
 * of distinct kinds is {@code AgentMemory(n)} and {@code Agent(n,m)}: the agent subsumes the bare
 * memory and the ledger keeps only the agent.
 * <p>
 * Iteration order (kinds in insertion order, then names in insertion order) defines the storage
 * order of the registers allocated from the ledger.
 */
public final class Requirements {

    private static final Requirements EMPTY = new Requirements(new LinkedHashMap<>());

    private final Map<RequirementKind, Set<String>> namesByKind;
    private final Map<String, RequirementKind> kindByName;

    private Requirements(LinkedHashMap<RequirementKind, LinkedHashSet<String>> entries) {
        Map<RequirementKind, Set<String>> copy = new LinkedHashMap<>();
        Map<String, RequirementKind> byName = new HashMap<>();
        for (Map.Entry<RequirementKind, LinkedHashSet<String>> entry : entries.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
            for (String name : entry.getValue()) {
                byName.put(name, entry.getKey());
            }
        }
        this.namesByKind = Collections.unmodifiableMap(copy);
        this.kindByName = Collections.unmodifiableMap(byName);
        checkRegisterNames();
    }

    /**
     * @return the empty ledger, the identity of {@link #merge}.
     */
    public static Requirements empty() {
        return EMPTY;
    }

    /**
     * @param kind a kind string such as {@code "Agent(1,1)"}.
     * @param names the names required of that kind.
     * @return a ledger with a single kind.
     */
    public static Requirements of(String kind, String... names) {
        return of(RequirementKind.parse(kind), names);
    }

    /**
     * @param kind the kind.
     * @param names the names required of that kind.
     * @return a ledger with a single kind.
     */
    public static Requirements of(RequirementKind kind, String... names) {
        return builder().require(kind, names).build();
    }

    /**
     * @return a builder that merges declarations as they are added.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Unions the per-kind name sets of two ledgers.
     * @param a first ledger.
     * @param b second ledger.
     * @return the merged ledger.
     * @throws ConflictException if a name is declared under incompatible kinds.
     */
    public static Requirements merge(Requirements a, Requirements b) {
        return a.merge(b);
    }

    /**
     * Unions this ledger with another.
     * @param other the ledger to merge in.
     * @return the merged ledger.
     * @throws ConflictException if a name is declared under incompatible kinds.
     */
    public Requirements merge(Requirements other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        Builder builder = new Builder(this);
        for (Map.Entry<RequirementKind, Set<String>> entry : other.namesByKind.entrySet()) {
            for (String name : entry.getValue()) {
                builder.require(entry.getKey(), name);
            }
        }
        return builder.build();
    }

    /**
     * Checks that every kind in this ledger is supported by the interpretation.
     * @param interpretation the loaded interpretation.
     * @throws MalformedRequirementsException for the first unsupported kind.
     */
    public void validate(IInterpretation interpretation) {
        for (RequirementKind kind : namesByKind.keySet()) {
            if (!interpretation.supportedKinds().contains(kind.type())) {
                throw new MalformedRequirementsException("Kind " + kind + " is not supported by interpretation '"
                        + interpretation.getName() + "'");
            }
        }
    }

    /**
     * Checks whether a system allocated from {@code provided} has everything this ledger needs.
     * @param provided the ledger the system was allocated from.
     * @return true if every required name is provided with the same kind or a subsuming kind.
     */
    public boolean isSatisfiedBy(Requirements provided) {
        return missingFrom(provided).isEmpty();
    }

    /**
     * @param provided the ledger the system was allocated from.
     * @return human readable descriptions of the declarations {@code provided} lacks.
     */
    public List<String> missingFrom(Requirements provided) {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<RequirementKind, Set<String>> entry : namesByKind.entrySet()) {
            for (String name : entry.getValue()) {
                RequirementKind available = provided.kindByName.get(name);
                if (available == null || !available.subsumes(entry.getKey())) {
                    missing.add(entry.getKey() + " " + name);
                }
            }
        }
        return missing;
    }

    /**
     * @return the kinds in insertion order.
     */
    public Set<RequirementKind> kinds() {
        return namesByKind.keySet();
    }

    /**
     * @param kind a kind.
     * @return the names required of that kind, empty if none.
     */
    public Set<String> names(RequirementKind kind) {
        return namesByKind.getOrDefault(kind, Collections.emptySet());
    }

    /**
     * @param name a required name.
     * @return the kind it is declared with.
     */
    public Optional<RequirementKind> kindOf(String name) {
        return Optional.ofNullable(kindByName.get(name));
    }

    /**
     * @return true if nothing is required.
     */
    public boolean isEmpty() {
        return namesByKind.isEmpty();
    }

    /**
     * @return the registers this ledger allocates, in storage order.
     */
    public List<RegisterDeclaration> registerDeclarations() {
        List<RegisterDeclaration> declarations = new ArrayList<>();
        for (Map.Entry<RequirementKind, Set<String>> entry : namesByKind.entrySet()) {
            for (String name : entry.getValue()) {
                declarations.addAll(entry.getKey().registersFor(name));
            }
        }
        return declarations;
    }

    /**
     * @return the names of all registers this ledger allocates.
     */
    public Set<String> registerNames() {
        Set<String> names = new LinkedHashSet<>();
        for (RegisterDeclaration declaration : registerDeclarations()) {
            names.add(declaration.name());
        }
        return names;
    }

    private void checkRegisterNames() {
        Map<String, String> owners = new HashMap<>();
        for (Map.Entry<RequirementKind, Set<String>> entry : namesByKind.entrySet()) {
            for (String name : entry.getValue()) {
                for (RegisterDeclaration declaration : entry.getKey().registersFor(name)) {
                    String previous = owners.putIfAbsent(declaration.name(), entry.getKey() + " " + name);
                    if (previous != null) {
                        throw new ConflictException("Register '" + declaration.name() + "' is produced by both "
                                + previous + " and " + entry.getKey() + " " + name);
                    }
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Requirements)) return false;
        Requirements that = (Requirements) o;
        return namesByKind.equals(that.namesByKind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namesByKind);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Requirements: \n");
        sb.append("-".repeat(30)).append('\n');
        for (Map.Entry<RequirementKind, Set<String>> entry : namesByKind.entrySet()) {
            sb.append(String.format("%-18s%s%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }

    /**
     * Accumulates declarations, consolidating agent memories into agents and rejecting conflicts.
     */
    public static final class Builder {

        private final LinkedHashMap<RequirementKind, LinkedHashSet<String>> entries = new LinkedHashMap<>();
        private final Map<String, RequirementKind> kindByName = new HashMap<>();

        private Builder() {}

        private Builder(Requirements start) {
            for (Map.Entry<RequirementKind, Set<String>> entry : start.namesByKind.entrySet()) {
                entries.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
            }
            kindByName.putAll(start.kindByName);
        }

        /**
         * @param kind a kind string such as {@code "Qureg(2)"}.
         * @param names the names to require.
         * @return this builder.
         */
        public Builder require(String kind, String... names) {
            return require(RequirementKind.parse(kind), names);
        }

        /**
         * @param kind the kind.
         * @param names the names to require.
         * @return this builder.
         * @throws ConflictException if a name is already declared under an incompatible kind.
         */
        public Builder require(RequirementKind kind, String... names) {
            Objects.requireNonNull(kind, "kind");
            for (String name : names) {
                add(kind, name);
            }
            return this;
        }

        private void add(RequirementKind kind, String name) {
            if (name == null || name.isBlank()) {
                throw new MalformedRequirementsException("Required names must not be blank");
            }
            RequirementKind existing = kindByName.get(name);
            if (existing == null) {
                entries.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(name);
                kindByName.put(name, kind);
            } else if (existing.subsumes(kind)) {
                // already provided
                return;
            } else if (kind.subsumes(existing)) {
                LinkedHashSet<String> previous = entries.get(existing);
                previous.remove(name);
                if (previous.isEmpty()) {
                    entries.remove(existing);
                }
                entries.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(name);
                kindByName.put(name, kind);
            } else {
                throw new ConflictException("'" + name + "' is required both as " + existing + " and as " + kind);
            }
        }

        /**
         * @return the immutable ledger.
         * @throws ConflictException if two declarations produce the same register name.
         */
        public Requirements build() {
            if (entries.isEmpty()) {
                return EMPTY;
            }
            return new Requirements(entries);
        }
    }
}
