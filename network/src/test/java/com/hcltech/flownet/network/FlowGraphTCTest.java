package com.hcltech.flownet.network;

import com.hcltech.flownet.network.TestFlowsheet.TestStream;
import com.hcltech.flownet.network.TestFlowsheet.TestUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hcltech.flownet.network.TestFlowsheet.*;
import static org.junit.jupiter.api.Assertions.*;

class FlowGraphTCTest {

    @Nested
    class Downstream {
        private final TestFlowsheet f = chain();

        @Test
        void unboundedReachesTheWholeChain() {
            assertEquals(set(f.u("B"), f.u("C"), f.u("D")), TC.downstream(f.u("A"), Set.of()));
        }

        @Test
        void hopLimitStopsEarly() {
            assertEquals(set(f.u("B")), TC.downstream(f.u("A"), Set.of(), 1));
            assertEquals(set(f.u("B"), f.u("C")), TC.downstream(f.u("A"), Set.of(), 2));
            assertEquals(Set.of(), TC.downstream(f.u("A"), Set.of(), 0));
        }

        @Test
        void endStreamsAreNotCrossed() {
            assertEquals(set(f.u("B")), TC.downstream(f.u("A"), Set.of(f.s("bc"))));
        }

        @Test
        void terminalUnitsAreNotEntered() {
            TestUnit facility = f.unit("F", Kind.FACILITY);
            f.connect("to_facility", f.u("D"), facility);
            assertFalse(TC.downstream(f.u("A"), Set.of()).contains(facility));
        }

        @Test
        void startUnitIncludedOnlyThroughALoop() {
            TestFlowsheet loop = simpleLoop();
            TestUnit m = loop.u("M");
            assertEquals(set(loop.u("S"), m), TC.downstream(m, Set.of()));
            assertEquals(set(loop.u("S")), TC.downstream(m, Set.of(loop.s("recycle"))));
        }
    }

    @Nested
    class BoundaryStreams {
        private final TestFlowsheet f = diamond();

        @Test
        void feedsAndProductsOfTheWholeGraph() {
            assertEquals(List.of(f.s("feed")), TC.feeds(f.units()));
            assertEquals(List.of(f.s("product")), TC.products(f.units()));
        }

        @Test
        void feedsAndProductsAreRelativeToTheGivenUnits() {
            assertEquals(List.of(f.s("a1"), f.s("a2")), TC.feeds(List.of(f.u("B"), f.u("C"))));
            assertEquals(List.of(f.s("a1"), f.s("a2")), TC.products(List.of(f.u("A"))));
        }

        @Test
        void streamsAreInletsThenOutlets() {
            assertEquals(set(f.s("feed"), f.s("a1"), f.s("a2")), TC.streams(List.of(f.u("A"))));
        }
    }

    @Test
    void streamLabelUsesSourceAndOutletIndex() {
        TestFlowsheet f = diamond();
        assertEquals("A-1", TC.streamLabel(f.s("a2")));
        assertEquals("feed", TC.streamLabel(f.s("feed")));
    }

    @Test
    void boundaryInletHasNoSource() {
        TestFlowsheet f = chain();
        TestStream inlet = TC.boundaryInlet(f.u("A"));
        assertNull(TC.source(inlet));
        assertSame(f.u("A"), TC.sink(inlet));
    }
}
