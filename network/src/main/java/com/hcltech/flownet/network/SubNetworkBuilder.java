package com.hcltech.flownet.network;

import com.hcltech.flownet.common.IEnvGetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles the nested {@link SubNetwork} describing the order in which units run and which
 * streams have to be converged.
 */
public final class SubNetworkBuilder<N, E> {
    private static final Logger log = LoggerFactory.getLogger(SubNetworkBuilder.class);

    private final FlowGraphTC<N, E> tc;
    private final DisjunctionRegistry<N, E> disjunctions;
    private final NetworkConfig config;
    private final NetworkDiagnostics diagnostics;
    private final PathEnumerator<N, E> pathEnumerator;

    public SubNetworkBuilder(FlowGraphTC<N, E> tc, DisjunctionRegistry<N, E> disjunctions,
                             NetworkConfig config, NetworkDiagnostics diagnostics) {
        this.tc = Objects.requireNonNull(tc, "tc");
        this.disjunctions = Objects.requireNonNull(disjunctions, "disjunctions");
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = config.diagnostics(Objects.requireNonNull(diagnostics, "diagnostics"));
        this.pathEnumerator = new PathEnumerator<>(tc, disjunctions);
    }

    /** Settings from the process environment, see {@link NetworkConfig#fromEnv(IEnvGetter)}. */
    public SubNetworkBuilder(FlowGraphTC<N, E> tc, DisjunctionRegistry<N, E> disjunctions) {
        this(tc, disjunctions, NetworkConfig.fromEnv(IEnvGetter.env), NetworkDiagnostics.logging);
    }

    /**
     * Network of all {@code units}. Feeds are discovered from the units themselves; when
     * {@code ends} is empty the products and the marked disjunctions are used. A unit no feed
     * reaches, such as one on a closed loop, is entered through its own boundary inlet.
     *
     * @throws IllegalArgumentException if units and streams are inconsistent
     */
    public SubNetwork<N, E> fromUnits(Collection<N> units, Collection<E> ends) {
        FlowGraphValidation.validate(units, tc).valueOrThrow(
                errors -> new IllegalArgumentException("Invalid flow graph: " + String.join("; ", errors)));
        List<N> unitList = List.copyOf(units);
        List<E> feeds = new ArrayList<>(tc.feeds(unitList));
        for (N unit : unitList)
            if (tc.ins(unit).isEmpty()) feeds.add(tc.boundaryInlet(unit));
        feeds.sort(tc.feedPriority());
        feeds.addAll(unreachedInlets(unitList, feeds));
        if (feeds.isEmpty()) {
            log.debug("No feeds found among {} units", unitList.size());
            return SubNetwork.empty(tc);
        }
        Set<E> endSet = new LinkedHashSet<>();
        if (ends == null || ends.isEmpty()) {
            endSet.addAll(tc.products(unitList));
            endSet.addAll(disjunctions.streams());
        } else {
            endSet.addAll(ends);
        }
        return fromSource(feeds.get(0), feeds.subList(1, feeds.size()), endSet, unitList);
    }

    /** Boundary inlets for units that none of {@code feeds} reaches, first unreached unit first. */
    private List<E> unreachedInlets(List<N> units, List<E> feeds) {
        Set<N> reached = new HashSet<>();
        for (E feed : feeds) reach(tc.sink(feed), reached);
        List<E> inlets = new ArrayList<>();
        for (N unit : units) {
            if (reached.contains(unit) || tc.isTerminal(unit)) continue;
            log.debug("No feed reaches {}; entering it through a boundary inlet", tc.label(unit));
            inlets.add(tc.boundaryInlet(unit));
            reach(unit, reached);
        }
        return inlets;
    }

    private void reach(N unit, Set<N> reached) {
        if (unit == null || tc.isTerminal(unit)) return;
        reached.add(unit);
        reached.addAll(tc.downstream(unit, Set.of()));
    }

    /**
     * Network reachable from {@code source}, with each further feed merged in where it connects.
     *
     * @param ends  streams that are not crossed; left unchanged
     * @param units the units a path may visit
     */
    public SubNetwork<N, E> fromSource(E source, Collection<E> feeds, Collection<E> ends, Collection<N> units) {
        List<E> feedList = feeds == null ? List.of() : new ArrayList<>(feeds);
        if (source == null) {
            if (feedList.isEmpty()) return SubNetwork.empty(tc);
            source = feedList.remove(0);
        }
        Set<E> endSet = ends == null ? new LinkedHashSet<>() : new LinkedHashSet<>(ends);
        Set<N> unitSet = units == null ? Set.of() : Set.copyOf(units);
        Set<E> recycleEnds = new LinkedHashSet<>(endSet);

        EnumeratedPaths<N, E> paths = pathEnumerator.linearAndCyclicPaths(source, endSet, unitSet);
        log.debug("From {}: {} linear and {} cyclic paths", tc.streamLabel(source),
                paths.linear().size(), paths.cyclic().size());
        SubNetwork<N, E> network = joinPaths(paths);

        endSet.addAll(network.streams());
        Set<E> disjunctionStreams = disjunctions.streams();
        for (E feed : feedList) {
            N feedSink = tc.sink(feed);
            if (endSet.contains(feed) || (feedSink != null && tc.isTerminal(feedSink))) continue;
            SubNetwork<N, E> downstream = fromSource(feed, List.of(), endSet, unitSet);
            if (downstream.isEmpty()) continue;
            Set<E> newStreams = downstream.streams();
            Set<N> connectingUnits = new LinkedHashSet<>();
            for (E stream : newStreams) {
                if (!endSet.contains(stream)) continue;
                N from = tc.source(stream);
                N to = tc.sink(stream);
                if (from != null && to != null && !disjunctionStreams.contains(stream) && unitSet.contains(to))
                    connectingUnits.add(to);
            }
            endSet.addAll(newStreams);
            joinFeedNetwork(network, downstream, connectingUnits);
        }

        recycleEnds.addAll(network.allRecycles());
        recycleEnds.addAll(tc.products(network.units()));
        network.sort(recycleEnds, diagnostics);
        if (config.pairProcessHeatExchangers()) network.addProcessHeatExchangers();
        if (config.reduceRecycles()) network.reduceRecycles();
        return network;
    }

    private SubNetwork<N, E> joinPaths(EnumeratedPaths<N, E> paths) {
        SubNetwork<N, E> network;
        List<List<N>> linear = paths.linear();
        List<CyclicPath<N, E>> cyclic = paths.cyclic();
        int joined = 0;
        if (!linear.isEmpty()) {
            network = SubNetwork.linear(tc, linear.get(0));
            for (List<N> path : linear.subList(1, linear.size()))
                network.joinLinearNetwork(SubNetwork.linear(tc, path));
        } else if (cyclic.isEmpty()) {
            network = SubNetwork.empty(tc);
        } else if (paths.leadIn().isEmpty()) {
            network = SubNetwork.cyclic(tc, cyclic.get(0));
            joined = 1;
        } else {
            // every path from the source loops back: the lead-in runs first, then the loop
            log.debug("No linear path; {} leads into the first loop", paths.leadIn());
            network = SubNetwork.linear(tc, paths.leadIn());
            network.appendNetwork(SubNetwork.cyclic(tc, cyclic.get(0)));
            joined = 1;
        }
        for (CyclicPath<N, E> path : cyclic.subList(joined, cyclic.size()))
            network.joinRecycleNetwork(SubNetwork.cyclic(tc, path));
        return network;
    }

    private void joinFeedNetwork(SubNetwork<N, E> network, SubNetwork<N, E> downstream, Set<N> connectingUnits) {
        switch (connectingUnits.size()) {
            case 0 -> {
                log.debug("Appending unconnected feed network {}", downstream.units());
                network.appendNetwork(downstream);
            }
            case 1 -> {
                N unit = connectingUnits.iterator().next();
                log.debug("Joining feed network {} at {}", downstream.units(), tc.label(unit));
                network.joinNetworkAtUnit(downstream, unit);
            }
            default -> {
                N unit = network.firstUnit(connectingUnits);
                log.debug("Joining feed network {} at {}, first of {}", downstream.units(), tc.label(unit), connectingUnits);
                network.joinNetworkAtUnit(downstream, unit);
            }
        }
    }
}
