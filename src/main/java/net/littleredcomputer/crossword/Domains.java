package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The candidate words still open to each variable. Starts from the full word list;
 * shrinks under node and arc consistency, and can be rolled back to a snapshot.
 */
public class Domains {
    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();

    /** An immutable copy of every domain, taken at a choice point. */
    public static final class Snapshot {
        private final ImmutableMap<Variable, ImmutableSet<String>> domains;
        private Snapshot(ImmutableMap<Variable, ImmutableSet<String>> domains) { this.domains = domains; }

        public ImmutableSet<String> get(Variable v) { return domains.get(v); }
    }

    public Domains(Crossword crossword) {
        for (Variable v : crossword.variables()) domains.put(v, new LinkedHashSet<>(crossword.words()));
    }

    /**
     * Keep only the words whose length matches their variable. A domain may end up
     * empty; that is left for arc consistency to discover.
     */
    public void enforceNodeConsistency() {
        domains.forEach((v, words) -> words.removeIf(w -> w.length() != v.length()));
    }

    /** @return a read-only view of the current domain of v */
    public Set<String> get(Variable v) {
        return Collections.unmodifiableSet(domainOf(v));
    }

    public int size(Variable v) {
        return domainOf(v).size();
    }

    boolean remove(Variable v, String word) {
        return domainOf(v).remove(word);
    }

    /** Reduce the domain of v to the single word given. */
    void restrict(Variable v, String word) {
        Set<String> d = domainOf(v);
        d.clear();
        d.add(word);
    }

    Set<String> mutableDomain(Variable v) {
        return domainOf(v);
    }

    public Snapshot snapshot() {
        ImmutableMap.Builder<Variable, ImmutableSet<String>> b = ImmutableMap.builder();
        domains.forEach((v, words) -> b.put(v, ImmutableSet.copyOf(words)));
        return new Snapshot(b.build());
    }

    /** Reinstate every domain exactly as it was when the snapshot was taken. */
    public void restore(Snapshot s) {
        s.domains.forEach((v, words) -> {
            Set<String> d = domainOf(v);
            d.clear();
            d.addAll(words);
        });
    }

    private Set<String> domainOf(Variable v) {
        Set<String> d = domains.get(v);
        if (d == null) throw new IllegalArgumentException("unknown variable: " + v);
        return d;
    }

    @Override
    public String toString() {
        return domains.toString();
    }
}
