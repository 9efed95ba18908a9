package com.hcltech.flownet.network;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first walk from a source stream that splits everything reachable into paths which
 * leave the allowed units (linear) and paths which return to a unit already on them (cyclic).
 */
public final class PathEnumerator<N, E> {
    private final FlowGraphTC<N, E> tc;
    private final DisjunctionRegistry<N, E> disjunctions;

    public PathEnumerator(FlowGraphTC<N, E> tc, DisjunctionRegistry<N, E> disjunctions) {
        this.tc = Objects.requireNonNull(tc, "tc");
        this.disjunctions = Objects.requireNonNull(disjunctions, "disjunctions");
    }

    /**
     * Linear paths reduced by {@link PathReducer}, cyclic paths truncated to the loop and ordered
     * longest first. Every recycle stream found is added to {@code ends}.
     * <p>
     * When every path loops back, the units between the source and the first loop are returned
     * as the lead-in.
     */
    public EnumeratedPaths<N, E> linearAndCyclicPaths(E source, Set<E> ends, Set<N> units) {
        EnumeratedPaths<N, E> raw = rawPaths(source, ends, units);
        List<CyclicPath<N, E>> cyclic = new ArrayList<>();
        for (CyclicPath<N, E> withRecycle : raw.cyclic()) cyclic.add(toCycle(withRecycle));
        List<List<N>> linear = PathReducer.simplifiedLinearPaths(tc, raw.linear());
        List<N> leadIn = linear.isEmpty() ? leadIn(raw.cyclic()) : List.of();
        cyclic.sort(Comparator.comparingInt((CyclicPath<N, E> c) -> c.path().size()).reversed());
        return new EnumeratedPaths<>(linear, cyclic, leadIn);
    }

    /** Prefix of the raw path whose loop sorts first: the longest loop, earliest found on ties. */
    private List<N> leadIn(List<CyclicPath<N, E>> withRecycle) {
        CyclicPath<N, E> first = null;
        int longest = -1;
        for (CyclicPath<N, E> candidate : withRecycle) {
            int size = toCycle(candidate).path().size();
            if (size > longest) {
                first = candidate;
                longest = size;
            }
        }
        if (first == null) return List.of();
        List<N> path = first.path();
        return path.subList(0, path.indexOf(tc.sink(first.recycle())));
    }

    /** Paths as walked, cyclic ones still starting at the source. */
    public EnumeratedPaths<N, E> rawPaths(E source, Set<E> ends, Set<N> units) {
        List<List<N>> linear = new ArrayList<>();
        List<CyclicPath<N, E>> withRecycle = new ArrayList<>();
        fillPath(source, new ArrayList<>(), withRecycle, linear, ends, units);
        return new EnumeratedPaths<>(linear, withRecycle);
    }

    private void fillPath(E stream, List<N> path, List<CyclicPath<N, E>> withRecycle,
                          List<List<N>> linear, Set<E> ends, Set<N> units) {
        N unit = tc.sink(stream);
        Boolean hasRecycle = null;
        boolean deterministic = disjunctions.isMarked(stream);
        if (deterministic || ends.contains(stream)) {
            hasRecycle = false;
            if (!deterministic && unit != null && path.contains(unit)) {
                // another loop already closes on this unit
                for (CyclicPath<N, E> other : withRecycle) {
                    hasRecycle = unit.equals(tc.sink(other.recycle()));
                    if (hasRecycle) break;
                }
            }
        }
        if (unit == null || tc.isTerminal(unit) || Boolean.FALSE.equals(hasRecycle) || !units.contains(unit)) {
            linear.add(new ArrayList<>(path));
        } else if (Boolean.TRUE.equals(hasRecycle) || path.contains(unit)) {
            withRecycle.add(new CyclicPath<>(path, stream));
            ends.add(stream);
        } else {
            path.add(unit);
            List<E> outlets = tc.outs(unit);
            if (outlets.isEmpty()) {
                linear.add(new ArrayList<>(path));
                return;
            }
            for (E outlet : outlets.subList(1, outlets.size()))
                fillPath(outlet, new ArrayList<>(path), withRecycle, linear, ends, units);
            fillPath(outlets.get(0), path, withRecycle, linear, ends, units);
        }
    }

    private CyclicPath<N, E> toCycle(CyclicPath<N, E> withRecycle) {
        List<N> path = withRecycle.path();
        int start = path.indexOf(tc.sink(withRecycle.recycle()));
        return new CyclicPath<>(path.subList(start, path.size()), withRecycle.recycle());
    }
}
