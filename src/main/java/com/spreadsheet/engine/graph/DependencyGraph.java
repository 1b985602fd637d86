package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.Reference;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Which cells read which.
 * - Forward edges: cell -> the references its formula reads (ranges kept as two corners).
 * - Reverse edges: cell -> the cells that read it, expanded per member cell of every range,
 *   so "who depends on me" is a single map lookup.
 * Not thread-safe; the owning {@code Sheet}'s lock guards it.
 */
public class DependencyGraph {

    // Forward adjacency: "sourceCell" -> referencesItReads
    private final Map<Address, Set<Reference>> forward = new HashMap<>();
    // Reverse adjacency: "targetCell" -> cellsThatReadIt
    private final Map<Address, Set<Address>> reverse = new HashMap<>();

    /**
     * True if giving {@code target} the forward edges {@code newRefs} would make it reachable
     * from itself. Depth-first from every member of {@code newRefs} over the current forward edges;
     * target's own current edges are ignored since they are about to be replaced.
     */
    public boolean wouldCycle(Address target, Collection<Reference> newRefs) {
        Set<Address> visited = new HashSet<>();
        Deque<Address> stack = new ArrayDeque<>();
        for (Reference ref : newRefs) {
            if (ref.covers(target)) {
                return true;
            }
            pushMembers(ref, stack, visited);
        }
        while (!stack.isEmpty()) {
            Address current = stack.pop();
            for (Reference ref : forward.getOrDefault(current, Collections.emptySet())) {
                if (ref.covers(target)) {
                    return true;
                }
                pushMembers(ref, stack, visited);
            }
        }
        return false;
    }

    private void pushMembers(Reference ref, Deque<Address> stack, Set<Address> visited) {
        if (ref.isSingle()) {
            if (visited.add(ref.getAddress())) {
                stack.push(ref.getAddress());
            }
            return;
        }
        for (Address member : ref.getRange().cells()) {
            // only cells with a formula can lead anywhere
            if (forward.containsKey(member) && visited.add(member)) {
                stack.push(member);
            }
        }
    }

    /**
     * Replaces target's forward edges with {@code newRefs} and updates reverse edges to match.
     * The caller must already have ruled out a cycle.
     */
    public void commitEdges(Address target, Collection<Reference> newRefs) {
        clearDependencies(target);
        if (newRefs.isEmpty()) {
            return;
        }
        Set<Reference> refs = new LinkedHashSet<>(newRefs);
        forward.put(target, refs);
        for (Reference ref : refs) {
            for (Address member : ref.getRange().cells()) {
                reverse.computeIfAbsent(member, k -> new HashSet<>()).add(target);
            }
        }
    }

    /**
     * Removes all forward references from 'cell', and
     * also removes 'cell' from the reverse adjacency of each cell it used to read.
     */
    public void clearDependencies(Address cell) {
        Set<Reference> old = forward.remove(cell);
        if (old == null) {
            return;
        }
        for (Reference ref : old) {
            for (Address member : ref.getRange().cells()) {
                Set<Address> readers = reverse.get(member);
                if (readers != null) {
                    readers.remove(cell);
                    if (readers.isEmpty()) {
                        reverse.remove(member);
                    }
                }
            }
        }
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    public Set<Reference> referencesOf(Address cell) {
        return Collections.unmodifiableSet(forward.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * Direct readers of {@code address}.
     */
    public Set<Address> dependentsOf(Address address) {
        return Collections.unmodifiableSet(reverse.getOrDefault(address, Collections.emptySet()));
    }

    /**
     * {@code origin} plus every cell that transitively reads it, in ascending address order.
     */
    public Set<Address> affectedSet(Address origin) {
        Set<Address> affected = new TreeSet<>();
        Deque<Address> queue = new ArrayDeque<>();
        affected.add(origin);
        queue.add(origin);
        while (!queue.isEmpty()) {
            Address current = queue.poll();
            for (Address reader : reverse.getOrDefault(current, Collections.emptySet())) {
                if (affected.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        return affected;
    }

    /**
     * Snapshot of the forward graph, ordered by cell address.
     */
    public Map<Address, Set<Reference>> forwardView() {
        Map<Address, Set<Reference>> view = new TreeMap<>();
        forward.forEach((cell, refs) -> view.put(cell, Collections.unmodifiableSet(new LinkedHashSet<>(refs))));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Snapshot of the reverse graph, ordered by cell address.
     */
    public Map<Address, Set<Address>> reverseView() {
        Map<Address, Set<Address>> view = new TreeMap<>();
        reverse.forEach((cell, readers) -> view.put(cell, Collections.unmodifiableSet(new TreeSet<>(readers))));
        return Collections.unmodifiableMap(view);
    }
}
