package com.hcltech.flownet.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the elements of one path level so that an element comes before anything downstream of it.
 * <p>
 * Repeated passes move an element in front of any earlier element it feeds. This stops at the
 * first pass that moves nothing, or after {@code n * n} passes; feedback can make a stable order
 * impossible, in which case no order is returned.
 */
public final class NetworkOrdering {
    private NetworkOrdering() {}

    /** The settled order, or empty if {@code n * n} passes did not settle it. */
    public static <N, E> Optional<List<NetworkElement<N, E>>> order(
            FlowGraphTC<N, E> tc, List<NetworkElement<N, E>> elements, Set<E> ends) {
        List<PathSource<N, E>> sources = new ArrayList<>(elements.size());
        for (NetworkElement<N, E> element : elements) sources.add(new PathSource<>(tc, element, ends));
        int n = sources.size();
        if (n == 0) return Optional.of(List.of());
        for (int pass = 0; pass < n * n; pass++) {
            boolean stop = true;
            for (int i = 0; i < n - 1; i++) {
                PathSource<N, E> upstream = sources.get(i);
                for (int j = i + 1; j < n; j++) {
                    PathSource<N, E> downstream = sources.get(j);
                    if (upstream.downstreamFrom(downstream)) {
                        sources.remove(j);
                        sources.add(i, downstream);
                        upstream = downstream;
                        stop = false;
                    }
                }
            }
            if (stop) {
                List<NetworkElement<N, E>> ordered = new ArrayList<>(n);
                for (PathSource<N, E> source : sources) ordered.add(source.element);
                return Optional.of(ordered);
            }
        }
        return Optional.empty();
    }

    /** An element together with everything reachable from it. */
    static final class PathSource<N, E> {
        final NetworkElement<N, E> element;
        final Set<N> reach;

        PathSource(FlowGraphTC<N, E> tc, NetworkElement<N, E> element, Set<E> ends) {
            this.element = element;
            if (element instanceof UnitElement<N, E> u) {
                this.reach = tc.downstream(u.unit(), ends);
            } else {
                Set<N> union = new LinkedHashSet<>();
                for (N unit : element.units()) union.addAll(tc.downstream(unit, ends));
                this.reach = union;
            }
        }

        /** True when this element can be reached from {@code other}. */
        boolean downstreamFrom(PathSource<N, E> other) {
            if (element instanceof UnitElement<N, E> u) return other.reach.contains(u.unit());
            return this != other && !Collections.disjoint(element.units(), other.reach);
        }

        @Override
        public String toString() {
            return "PathSource(" + element + ")";
        }
    }
}
