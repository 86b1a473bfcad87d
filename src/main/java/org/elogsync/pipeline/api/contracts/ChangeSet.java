package org.elogsync.pipeline.api.contracts;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of experiment identifiers selected for one sync run.
 * <p>
 * Duplicates are collapsed on construction. Iteration follows first-seen order, but
 * consumers must not rely on it: fetch results may complete in any order.
 */
public final class ChangeSet implements Iterable<String> {

    private static final ChangeSet EMPTY = new ChangeSet(Collections.emptySet());

    private final Set<String> identifiers;

    private ChangeSet(Set<String> identifiers) {
        this.identifiers = identifiers;
    }

    /**
     * Creates a change set from the given identifiers.
     *
     * @param identifiers Experiment identifiers (must not be null, must not contain null or blank values)
     * @return A new change set with duplicates removed
     * @throws IllegalArgumentException if an identifier is null or blank
     */
    public static ChangeSet of(Collection<String> identifiers) {
        Objects.requireNonNull(identifiers, "identifiers must not be null");
        Set<String> copy = new LinkedHashSet<>();
        for (String id : identifiers) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Experiment identifier must not be null or blank");
            }
            copy.add(id);
        }
        return copy.isEmpty() ? EMPTY : new ChangeSet(Collections.unmodifiableSet(copy));
    }

    public static ChangeSet of(String... identifiers) {
        return of(List.of(identifiers));
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public boolean contains(String identifier) {
        return identifiers.contains(identifier);
    }

    public int size() {
        return identifiers.size();
    }

    public boolean isEmpty() {
        return identifiers.isEmpty();
    }

    /**
     * @return Unmodifiable view of the identifiers in first-seen order
     */
    public Set<String> identifiers() {
        return identifiers;
    }

    @Override
    public Iterator<String> iterator() {
        return identifiers.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeSet other)) return false;
        return identifiers.equals(other.identifiers);
    }

    @Override
    public int hashCode() {
        return identifiers.hashCode();
    }

    @Override
    public String toString() {
        return "ChangeSet" + identifiers;
    }
}
