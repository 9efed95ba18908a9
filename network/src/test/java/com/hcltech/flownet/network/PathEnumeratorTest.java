package com.hcltech.flownet.network;

import com.hcltech.flownet.network.TestFlowsheet.TestStream;
import com.hcltech.flownet.network.TestFlowsheet.TestUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hcltech.flownet.network.TestFlowsheet.*;
import static org.junit.jupiter.api.Assertions.*;

class PathEnumeratorTest {

    private final DisjunctionRegistry<TestUnit, TestStream> disjunctions = new DisjunctionRegistry<>(TC);
    private final PathEnumerator<TestUnit, TestStream> enumerator = new PathEnumerator<>(TC, disjunctions);

    private static Set<TestStream> ends(TestStream... streams) {
        return new HashSet<>(set(streams));
    }

    @Nested
    class NestedLoops {
        private final TestFlowsheet f = twoNestedLoops();

        @Test
        void rawCyclicPathsStartAtTheSource() {
            var raw = enumerator.rawPaths(f.s("feedstock"), ends(f.s("product")), set(f.units().toArray(new TestUnit[0])));
            assertEquals(List.of(List.of(f.u("P1"), f.u("M1"), f.u("M2"), f.u("S2"), f.u("S1"))), raw.linear());
            assertEquals(List.of(
                    new CyclicPath<>(List.of(f.u("P1"), f.u("M1"), f.u("M2"), f.u("S2")), f.s("inner_recycle")),
                    new CyclicPath<>(List.of(f.u("P1"), f.u("M1"), f.u("M2"), f.u("S2"), f.u("S1")), f.s("recycle"))),
                    raw.cyclic());
        }

        @Test
        void cyclicPathsAreTruncatedToTheLoopAndLongestFirst() {
            var paths = enumerator.linearAndCyclicPaths(f.s("feedstock"), ends(f.s("product")), Set.copyOf(f.units()));
            assertEquals(List.of(
                    new CyclicPath<>(List.of(f.u("M1"), f.u("M2"), f.u("S2"), f.u("S1")), f.s("recycle")),
                    new CyclicPath<>(List.of(f.u("M2"), f.u("S2")), f.s("inner_recycle"))),
                    paths.cyclic());
            assertEquals(List.of(List.of(f.u("P1"), f.u("M1"), f.u("M2"), f.u("S2"), f.u("S1"))), paths.linear());
            assertEquals(List.of(), paths.leadIn());
        }

        @Test
        void recycleStreamsAreAddedToEnds() {
            Set<TestStream> ends = ends(f.s("product"));
            enumerator.rawPaths(f.s("feedstock"), ends, Set.copyOf(f.units()));
            assertEquals(set(f.s("product"), f.s("inner_recycle"), f.s("recycle")), ends);
        }
    }

    @Test
    void diamondBranchesAreWalkedOtherOutletsFirst() {
        TestFlowsheet f = diamond();
        var raw = enumerator.rawPaths(f.s("feed"), ends(f.s("product")), Set.copyOf(f.units()));
        assertEquals(List.of(
                List.of(f.u("A"), f.u("C"), f.u("D")),
                List.of(f.u("A"), f.u("B"), f.u("D"))), raw.linear());
        assertTrue(raw.cyclic().isEmpty());
    }

    @Test
    void unitsOutsideTheAllowedSetEndThePath() {
        TestFlowsheet f = chain();
        var raw = enumerator.rawPaths(f.s("feed"), ends(), set(f.u("A"), f.u("B")));
        assertEquals(List.of(List.of(f.u("A"), f.u("B"))), raw.linear());
    }

    @Test
    void terminalUnitsEndThePath() {
        TestFlowsheet f = chain();
        TestUnit facility = f.unit("F", Kind.FACILITY);
        f.connect("to_facility", f.u("B"), facility);
        var raw = enumerator.rawPaths(f.s("feed"), ends(f.s("product")), Set.copyOf(f.units()));
        assertTrue(raw.linear().contains(List.of(f.u("A"), f.u("B"))));
        assertTrue(raw.linear().stream().noneMatch(p -> p.contains(facility)));
    }

    @Test
    void unitWithoutOutletsEndsAPath() {
        TestFlowsheet f = new TestFlowsheet();
        TestUnit a = f.unit("A"), b = f.unit("B");
        f.feed("feed", a);
        f.connect("ab", a, b);
        var raw = enumerator.rawPaths(f.s("feed"), ends(), set(a, b));
        assertEquals(List.of(List.of(a, b)), raw.linear());
    }

    @Test
    void loopWithoutExitReportsItsLeadIn() {
        TestFlowsheet f = new TestFlowsheet();
        TestUnit a = f.unit("A"), b = f.unit("B"), c = f.unit("C");
        f.feed("feed", a);
        f.connect("ab", a, b);
        f.connect("bc", b, c);
        f.connect("cb", c, b);
        var paths = enumerator.linearAndCyclicPaths(f.s("feed"), ends(), set(a, b, c));
        assertEquals(List.of(), paths.linear());
        assertEquals(List.of(new CyclicPath<>(List.of(b, c), f.s("cb"))), paths.cyclic());
        assertEquals(List.of(a), paths.leadIn());
    }

    @Test
    void loopClosingOnTheFirstUnitHasNoLeadIn() {
        TestFlowsheet f = new TestFlowsheet();
        TestUnit x = f.unit("X"), y = f.unit("Y");
        f.feed("feed", x);
        f.connect("xy", x, y);
        f.connect("yx", y, x);
        var paths = enumerator.linearAndCyclicPaths(f.s("feed"), ends(), set(x, y));
        assertEquals(List.of(new CyclicPath<>(List.of(x, y), f.s("yx"))), paths.cyclic());
        assertEquals(List.of(), paths.leadIn());
    }

    @Test
    void sourceWithoutSinkGivesOneEmptyPath() {
        TestFlowsheet f = chain();
        var raw = enumerator.rawPaths(f.s("product"), ends(), Set.copyOf(f.units()));
        assertEquals(List.of(List.of()), raw.linear());
        assertEquals(List.of(), enumerator.linearAndCyclicPaths(f.s("product"), ends(), Set.copyOf(f.units())).linear());
    }

    @Nested
    class Disjunctions {

        @Test
        void markedStreamNeverClosesALoop() {
            TestFlowsheet f = simpleLoop();
            var unmarked = enumerator.rawPaths(f.s("feed"), ends(f.s("product")), Set.copyOf(f.units()));
            assertEquals(1, unmarked.cyclic().size());

            disjunctions.mark(f.s("recycle"));
            Set<TestStream> ends = ends(f.s("product"));
            var marked = enumerator.rawPaths(f.s("feed"), ends, Set.copyOf(f.units()));
            assertTrue(marked.cyclic().isEmpty());
            assertTrue(marked.linear().contains(List.of(f.u("M"), f.u("S"))));
            assertFalse(ends.contains(f.s("recycle")));
        }

        @Test
        void markedEndStreamIsNotPromotedBySharedSink() {
            TestFlowsheet f = feedForwardLoops(false);
            // r2 is an end and r1 closes on the same unit, so r2 would close a loop too
            var unmarked = enumerator.rawPaths(f.s("feed"), ends(f.s("b_product"), f.s("r2")), Set.copyOf(f.units()));
            assertEquals(List.of(f.s("r1"), f.s("r2")), unmarked.cyclic().stream().map(CyclicPath::recycle).toList());

            disjunctions.mark(f.s("r2"));
            var marked = enumerator.rawPaths(f.s("feed"), ends(f.s("b_product"), f.s("r2")), Set.copyOf(f.units()));
            assertEquals(List.of(f.s("r1")), marked.cyclic().stream().map(CyclicPath::recycle).toList());
        }
    }
}
