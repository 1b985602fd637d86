package com.spreadsheet.engine.graph;

import com.spreadsheet.engine.models.Address;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.Reference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private static Address at(String text) {
        return Address.parse(text);
    }

    private static Reference cell(String text) {
        return Reference.single(at(text));
    }

    private static Reference range(String text) {
        return Reference.range(CellRange.parse(text));
    }

    @Test
    void testReverseEdgesExpandRanges() {
        graph.commitEdges(at("C1"), Collections.singletonList(range("A1:A3")));
        assertEquals(Collections.singleton(at("C1")), graph.dependentsOf(at("A2")));
        // forward edges keep the range compact
        assertEquals(Collections.singleton(range("A1:A3")), graph.referencesOf(at("C1")));
    }

    @Test
    void testSelfReferenceIsCycle() {
        assertTrue(graph.wouldCycle(at("A1"), Collections.singletonList(cell("A1"))));
        assertTrue(graph.wouldCycle(at("A2"), Collections.singletonList(range("A1:A3"))));
    }

    /**
     * C1 -> A1, A1 -> B1; making B1 read C1 closes the loop.
     */
    @Test
    void testThreeCellCycle() {
        graph.commitEdges(at("C1"), Collections.singletonList(cell("A1")));
        graph.commitEdges(at("A1"), Collections.singletonList(cell("B1")));
        assertTrue(graph.wouldCycle(at("B1"), Collections.singletonList(cell("C1"))));
        assertFalse(graph.wouldCycle(at("B1"), Collections.singletonList(cell("D1"))));
    }

    @Test
    void testCycleThroughRange() {
        graph.commitEdges(at("B1"), Collections.singletonList(range("A1:A5")));
        assertTrue(graph.wouldCycle(at("A3"), Collections.singletonList(cell("B1"))));
    }

    /**
     * The target's current edges are ignored because they are being replaced.
     */
    @Test
    void testReplacingEdgesIsNotACycle() {
        graph.commitEdges(at("B1"), Collections.singletonList(cell("A1")));
        graph.commitEdges(at("A1"), Collections.singletonList(cell("C1")));
        assertFalse(graph.wouldCycle(at("A1"), Collections.singletonList(cell("D1"))));
    }

    @Test
    void testCommitReplacesOldEdges() {
        graph.commitEdges(at("B1"), Arrays.asList(cell("A1"), cell("A2")));
        graph.commitEdges(at("B1"), Collections.singletonList(cell("A3")));
        assertTrue(graph.dependentsOf(at("A1")).isEmpty());
        assertEquals(Collections.singleton(at("B1")), graph.dependentsOf(at("A3")));

        graph.clearDependencies(at("B1"));
        assertTrue(graph.referencesOf(at("B1")).isEmpty());
        assertTrue(graph.reverseView().isEmpty());
    }

    @Test
    void testAffectedSetIsTransitiveAndOrdered() {
        graph.commitEdges(at("B1"), Collections.singletonList(cell("A1")));
        graph.commitEdges(at("A2"), Collections.singletonList(cell("B1")));
        graph.commitEdges(at("C1"), Collections.singletonList(range("A1:B1")));
        graph.commitEdges(at("D5"), Collections.singletonList(cell("E5")));

        Set<Address> affected = graph.affectedSet(at("A1"));
        List<Address> expected = Arrays.asList(at("A1"), at("B1"), at("C1"), at("A2"));
        assertEquals(expected, Arrays.asList(affected.toArray(new Address[0])));
    }

    @Test
    void testViews() {
        graph.commitEdges(at("B2"), Collections.singletonList(cell("A1")));
        graph.commitEdges(at("B1"), Collections.singletonList(cell("A1")));

        Map<Address, Set<Reference>> forward = graph.forwardView();
        assertEquals(Arrays.asList(at("B1"), at("B2")), Arrays.asList(forward.keySet().toArray(new Address[0])));
        assertEquals(Arrays.asList(at("B1"), at("B2")),
                Arrays.asList(graph.reverseView().get(at("A1")).toArray(new Address[0])));

        graph.clear();
        assertTrue(graph.forwardView().isEmpty());
    }
}
