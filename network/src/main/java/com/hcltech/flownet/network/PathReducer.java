package com.hcltech.flownet.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns overlapping linear paths into a disjoint covering: a shorter path gives up every unit
 * that a longer path also visits.
 */
public final class PathReducer {
    private PathReducer() {}

    /**
     * Shortest paths are trimmed first, survivors get back the units their last unit feeds into,
     * and the result is returned longest first.
     */
    public static <N, E> List<List<N>> simplifiedLinearPaths(FlowGraphTC<N, E> tc, List<List<N>> linearPaths) {
        if (linearPaths.isEmpty()) return List.of();
        List<List<N>> paths = new ArrayList<>();
        for (List<N> path : linearPaths) paths.add(new ArrayList<>(path));
        paths.sort(Comparator.comparingInt(List::size));

        Set<N> units = new HashSet<>(paths.get(0));
        List<Set<N>> unitSets = new ArrayList<>();
        for (List<N> path : paths.subList(1, paths.size())) {
            Set<N> unitSet = new HashSet<>(path);
            unitSets.add(unitSet);
            units.addAll(unitSet);
        }

        List<List<N>> simplified = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            List<N> path = paths.get(i);
            simplifyLinearPath(path, unitSets.subList(i, unitSets.size()));
            if (!path.isEmpty()) {
                addBackEnds(tc, path, units);
                simplified.add(path);
            }
        }
        Collections.reverse(simplified);
        return simplified;
    }

    static <N> void simplifyLinearPath(List<N> path, List<Set<N>> longerUnitSets) {
        if (path.isEmpty() || longerUnitSets.isEmpty()) return;
        path.removeIf(unit -> longerUnitSets.stream().anyMatch(s -> s.contains(unit)));
    }

    /** Re-attach sinks of the last unit that belong to some path but were trimmed from this one. */
    static <N, E> void addBackEnds(FlowGraphTC<N, E> tc, List<N> path, Set<N> units) {
        N last = path.get(path.size() - 1);
        for (E outlet : tc.outs(last)) {
            N sink = tc.sink(outlet);
            if (sink != null && units.contains(sink) && !path.contains(sink)) path.add(sink);
        }
    }
}
