package com.sporewriter.model.mapping;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable partial map between node ids of two graphs.
 *
 * Holds ids only, never graph references, so it outlives edits to either
 * graph. Whether the ids still exist must be checked by whoever consumes it.
 */
@ToString
@EqualsAndHashCode
public final class Correspondence {

    private static final Correspondence EMPTY = new Correspondence(List.of(), new TreeMap<>(), false);

    private final List<Integer> domain;
    private final SortedMap<Integer, Integer> assignments;
    private final boolean complete;

    Correspondence(List<Integer> domain, Map<Integer, Integer> assignments, boolean complete) {
        this.domain = List.copyOf(domain);
        this.assignments = Collections.unmodifiableSortedMap(new TreeMap<>(assignments));
        this.complete = complete;
    }

    public static Correspondence empty() {
        return EMPTY;
    }

    /**
     * Wrap a mapping that did not come from a builder session, e.g. one decoded
     * from a request. Its domain is its own key set, and nothing guarantees it
     * is injective.
     */
    public static Correspondence of(Map<Integer, Integer> mapping) {
        return new Correspondence(List.copyOf(new TreeSet<>(mapping.keySet())), mapping, true);
    }

    /**
     * The declared domain sequence, in assignment order.
     */
    public List<Integer> domain() {
        return domain;
    }

    /**
     * Assignments keyed by domain id, ascending.
     */
    public SortedMap<Integer, Integer> assignments() {
        return assignments;
    }

    public Optional<Integer> get(int domainId) {
        return Optional.ofNullable(assignments.get(domainId));
    }

    public boolean isDefinedAt(int domainId) {
        return assignments.containsKey(domainId);
    }

    /**
     * Set of assigned values.
     */
    public Set<Integer> image() {
        return Collections.unmodifiableSet(new TreeSet<>(assignments.values()));
    }

    public int size() {
        return assignments.size();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * True once every element of the declared domain has been assigned.
     */
    public boolean isComplete() {
        return complete;
    }

    /**
     * Copy keeping only the assignments and domain elements inside {@code ids}.
     */
    public Correspondence restrictTo(Collection<Integer> ids) {
        Set<Integer> keep = new HashSet<>(ids);
        List<Integer> restrictedDomain = domain.stream().filter(keep::contains).collect(Collectors.toList());
        Map<Integer, Integer> restricted = new TreeMap<>(assignments);
        restricted.keySet().retainAll(keep);
        return new Correspondence(restrictedDomain, restricted, complete);
    }

    public boolean isInjective() {
        return firstSharedTarget().isEmpty();
    }

    /**
     * A value assigned to more than one domain id, if any.
     */
    public Optional<Integer> firstSharedTarget() {
        Set<Integer> seen = new HashSet<>();
        for (Integer target : assignments.values()) {
            if (!seen.add(target)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
