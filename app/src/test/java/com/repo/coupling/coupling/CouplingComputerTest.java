package com.repo.coupling.coupling;

import com.repo.coupling.core.CouplingMetric;
import com.repo.coupling.model.Changeset;
import com.repo.coupling.model.CouplingStat;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CouplingComputerTest {

    private static final int A = 1;
    private static final int B = 2;
    private static final int C = 3;
    private static final double EPS = 1e-9;

    @Test
    void testThreeCommitScenario() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A));
        computer.accept(changeset("c2", false, A, B));
        computer.accept(changeset("c3", false, A, B));

        CouplingStat stat = computer.stat(A, B).orElseThrow();
        assertEquals(2, stat.pairCount());
        assertEquals(3, stat.aTotal());
        assertEquals(2, stat.bTotal());
        assertEquals(2.0 / 3.0, stat.jaccard(), EPS);
        assertEquals(2.0 / 3.0, stat.probabilityBGivenA(), EPS);
        assertEquals(1.0, stat.probabilityAGivenB(), EPS);
    }

    @Test
    void testWeightedCounts() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A, B));
        computer.accept(changeset("c2", false, A, B, C, 4));

        CouplingStat stat = computer.stat(A, B).orElseThrow();
        assertEquals(0.5 + 0.25, stat.weightedPairCount(), EPS);
        assertEquals(0.75, computer.weightedTotal(A), EPS);
        assertEquals(0.75 / (0.75 + 0.75 - 0.75), stat.weightedJaccard(), EPS);
        assertEquals(0.25, computer.stat(C, 4).orElseThrow().weightedPairCount(), EPS);
    }

    @Test
    void testSymmetry() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A, B, C));
        computer.accept(changeset("c2", false, A, C));

        CouplingStat ac = computer.stat(A, C).orElseThrow();
        CouplingStat ca = computer.stat(C, A).orElseThrow();
        assertEquals(ac.pairCount(), ca.pairCount());
        assertEquals(ac.jaccard(), ca.jaccard(), EPS);
        assertEquals(ac.weightedJaccard(), ca.weightedJaccard(), EPS);
        assertEquals(ac.probabilityBGivenA(), ca.probabilityAGivenB(), EPS);
        assertEquals(ac, ca.reversed());
    }

    @Test
    void testExcludedChangesetContributesNothing() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A, B));
        computer.accept(changeset("c2", true, A, B, C));

        assertEquals(1, computer.stat(A, B).orElseThrow().pairCount());
        assertEquals(1, computer.total(A));
        assertEquals(0, computer.total(C));
        assertTrue(computer.stat(A, C).isEmpty());
        assertEquals(1, computer.changesetsSkipped());
    }

    @Test
    void testPairNeverSeenOrSelf() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A, B));
        assertTrue(computer.stat(A, C).isEmpty());
        assertTrue(computer.stat(A, A).isEmpty());
    }

    @Test
    void testMergedShardsEqualSinglePass() {
        List<Changeset> history = List.of(
                changeset("c1", false, A, B),
                changeset("c2", false, A, B, C),
                changeset("c3", false, B, C),
                changeset("c4", true, A, B, C),
                changeset("c5", false, A));

        CouplingComputer single = new CouplingComputer();
        history.forEach(single::accept);

        CouplingComputer left = new CouplingComputer();
        CouplingComputer right = new CouplingComputer();
        for (int i = 0; i < history.size(); i++) {
            (i % 2 == 0 ? left : right).accept(history.get(i));
        }
        CouplingComputer merged = left.merge(right);

        assertEquals(single.pairCount(), merged.pairCount());
        assertEquals(single.changesetsCounted(), merged.changesetsCounted());
        for (int[] pair : new int[][]{{A, B}, {A, C}, {B, C}}) {
            CouplingStat expected = single.stat(pair[0], pair[1]).orElseThrow();
            CouplingStat actual = merged.stat(pair[0], pair[1]).orElseThrow();
            assertEquals(expected.pairCount(), actual.pairCount());
            assertEquals(expected.aTotal(), actual.aTotal());
            assertEquals(expected.weightedPairCount(), actual.weightedPairCount(), EPS);
        }
    }

    @Test
    void testForEachPairVisitsEachPairOnceLowIdFirst() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A, B, C));

        List<CouplingStat> visited = new ArrayList<>();
        computer.forEachPair(visited::add);

        assertEquals(3, visited.size());
        assertTrue(visited.stream().allMatch(s -> s.fileA() < s.fileB()));
    }

    @Test
    void testMetricSelection() {
        CouplingComputer computer = new CouplingComputer();
        computer.accept(changeset("c1", false, A));
        computer.accept(changeset("c2", false, A, B));

        CouplingStat stat = computer.stat(A, B).orElseThrow();
        assertEquals(0.5, stat.metric(CouplingMetric.JACCARD), EPS);
        assertEquals(0.5, stat.metric(CouplingMetric.CONDITIONAL_PROBABILITY), EPS);
        assertEquals(1.0, stat.reversed().metric(CouplingMetric.CONDITIONAL_PROBABILITY), EPS);
    }

    @Test
    void testPairKeyOrderIndependent() {
        assertEquals(CouplingComputer.pairKey(7, 3), CouplingComputer.pairKey(3, 7));
        assertNotEquals(CouplingComputer.pairKey(1, 2), CouplingComputer.pairKey(2, 3));
    }

    static Changeset changeset(String key, boolean excluded, Integer... files) {
        return new Changeset(key, List.of(files), List.of(key), "ann@example.com", 0, 0, excluded);
    }
}
