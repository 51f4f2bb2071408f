package com.sporewriter.model.mapping;

import com.sporewriter.exception.BuilderError;
import com.sporewriter.exception.BuilderException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds an injective map one assignment at a time.
 *
 * A session is opened with {@link #start(List)}, which fixes the domain
 * sequence. Each {@link #assign(int)} call pairs the next pending domain
 * element with the given target, so elements are always assigned in domain
 * order. Once every element is assigned the session is frozen and kept as
 * {@link #lastCompleted()}, which also survives later cancelled sessions.
 *
 * The ordering of the domain is up to the caller. The same builder is used
 * for match maps (domain = LHS nodes) and gluing maps (domain = RHS nodes).
 */
@Slf4j
public class CorrespondenceBuilder {

    private BuilderState state = BuilderState.IDLE;
    private List<Integer> domain = List.of();
    private final Map<Integer, Integer> assignments = new LinkedHashMap<>();
    private final Set<Integer> usedTargets = new HashSet<>();
    private int cursor;
    private Correspondence lastCompleted;

    /**
     * Open a new session over {@code domain}, dropping any in-progress one.
     * An empty domain completes immediately.
     */
    public void start(List<Integer> domain) {
        if (new HashSet<>(domain).size() != domain.size()) {
            throw new IllegalArgumentException("Domain contains duplicate ids: " + domain);
        }
        this.domain = List.copyOf(domain);
        assignments.clear();
        usedTargets.clear();
        cursor = 0;
        state = BuilderState.BUILDING;
        log.debug("Started correspondence over {} domain element(s)", domain.size());
        completeIfExhausted();
    }

    /**
     * Assign {@code target} to the pending domain element.
     *
     * @throws BuilderException {@code DOMAIN_EXHAUSTED} if every element is already
     *         assigned, {@code DUPLICATE_TARGET} if {@code target} is already used
     * @throws IllegalStateException if no session is open
     */
    public void assign(int target) {
        if (state == BuilderState.COMPLETE) {
            throw new BuilderException(BuilderError.DOMAIN_EXHAUSTED,
                    "All " + domain.size() + " domain element(s) are already assigned");
        }
        if (state != BuilderState.BUILDING) {
            throw new IllegalStateException("No correspondence session in progress (state " + state + ")");
        }
        if (usedTargets.contains(target)) {
            throw new BuilderException(BuilderError.DUPLICATE_TARGET,
                    "Target " + target + " is already assigned to another domain element");
        }
        int source = domain.get(cursor);
        assignments.put(source, target);
        usedTargets.add(target);
        cursor++;
        log.debug("Assigned {} -> {} ({}/{})", source, target, cursor, domain.size());
        completeIfExhausted();
    }

    /**
     * Abandon the current session. Assignments made in it are discarded;
     * {@link #lastCompleted()} is untouched.
     */
    public void cancel() {
        if (state != BuilderState.BUILDING) {
            return;
        }
        log.debug("Cancelled correspondence after {}/{} assignment(s)", cursor, domain.size());
        assignments.clear();
        usedTargets.clear();
        cursor = 0;
        state = BuilderState.CANCELLED;
    }

    /**
     * The domain element awaiting assignment, empty unless a session is building.
     */
    public Optional<Integer> currentDomainElement() {
        if (state != BuilderState.BUILDING) {
            return Optional.empty();
        }
        return Optional.of(domain.get(cursor));
    }

    /**
     * Map built so far. While building this is the partial map of the open
     * session; after completion it is the completed map; when idle or
     * cancelled it is the last completed map, or empty if there is none.
     */
    public Correspondence snapshot() {
        switch (state) {
            case BUILDING:
                return new Correspondence(domain, assignments, false);
            case COMPLETE:
                return lastCompleted;
            default:
                return lastCompleted().orElse(Correspondence.empty());
        }
    }

    public Optional<Correspondence> lastCompleted() {
        return Optional.ofNullable(lastCompleted);
    }

    public BuilderState getState() {
        return state;
    }

    private void completeIfExhausted() {
        if (cursor < domain.size()) {
            return;
        }
        lastCompleted = new Correspondence(domain, assignments, true);
        state = BuilderState.COMPLETE;
        log.debug("Correspondence complete: {}", lastCompleted.assignments());
    }
}
