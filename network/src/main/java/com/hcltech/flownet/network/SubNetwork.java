package com.hcltech.flownet.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered path of units and nested sub-networks, optionally closed by a recycle.
 * <p>
 * A linear sub-network is run once in order. A cyclic one is run repeatedly as a block until its
 * recycle streams converge. Nested sub-networks are owned by exactly one parent: a network passed
 * to one of the {@code join}/{@code append} methods is consumed and must not be used afterwards.
 * <p>
 * {@link #units()} always equals the units reachable by walking {@link #elements()}.
 */
public final class SubNetwork<N, E> implements NetworkElement<N, E> {
    private final FlowGraphTC<N, E> tc;
    private List<NetworkElement<N, E>> elements;
    private Set<N> units;
    private Recycle<E> recycle;

    public SubNetwork(FlowGraphTC<N, E> tc, List<? extends NetworkElement<N, E>> elements, Recycle<E> recycle) {
        this.tc = Objects.requireNonNull(tc, "tc");
        this.elements = new ArrayList<>(elements);
        this.recycle = Objects.requireNonNull(recycle, "recycle");
        checkSharedSink(recycle.streams());
        refreshUnits();
    }

    public static <N, E> SubNetwork<N, E> empty(FlowGraphTC<N, E> tc) {
        return new SubNetwork<>(tc, List.of(), Recycle.none());
    }

    public static <N, E> SubNetwork<N, E> linear(FlowGraphTC<N, E> tc, List<N> path) {
        return new SubNetwork<>(tc, unitElements(path), Recycle.none());
    }

    public static <N, E> SubNetwork<N, E> cyclic(FlowGraphTC<N, E> tc, List<N> path, E recycle) {
        return new SubNetwork<>(tc, unitElements(path), Recycle.of(Objects.requireNonNull(recycle, "recycle")));
    }

    public static <N, E> SubNetwork<N, E> cyclic(FlowGraphTC<N, E> tc, CyclicPath<N, E> cyclicPath) {
        return cyclic(tc, cyclicPath.path(), cyclicPath.recycle());
    }

    static <N, E> List<NetworkElement<N, E>> unitElements(List<N> path) {
        List<NetworkElement<N, E>> result = new ArrayList<>(path.size());
        for (N unit : path) result.add(new UnitElement<>(unit));
        return result;
    }

    public List<NetworkElement<N, E>> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Set<N> units() {
        return Collections.unmodifiableSet(units);
    }

    public Recycle<E> recycle() {
        return recycle;
    }

    /** The unit the recycle streams feed, {@code null} for a linear network. */
    public N recycleSink() {
        return recycle.sink(tc);
    }

    public boolean isCyclic() {
        return recycle.isPresent();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean isDisjoint(SubNetwork<N, E> other) {
        return Collections.disjoint(units, other.units);
    }

    /** Inlets and outlets of every member unit. */
    public Set<E> streams() {
        return tc.streams(units);
    }

    /** Recycle streams of this network and of every nested one. */
    public Set<E> allRecycles() {
        Set<E> all = new LinkedHashSet<>();
        collectRecycles(all);
        return all;
    }

    private void collectRecycles(Set<E> all) {
        all.addAll(recycle.streams());
        for (NetworkElement<N, E> element : elements)
            if (element instanceof SubNetwork<N, E> nested) nested.collectRecycles(all);
    }

    /** The first of {@code candidates} met walking the path, descending into nested networks. */
    public N firstUnit(Collection<N> candidates) {
        for (NetworkElement<N, E> element : elements) {
            if (element instanceof SubNetwork<N, E> nested) {
                if (!Collections.disjoint(nested.units, candidates)) return nested.firstUnit(candidates);
            } else if (element instanceof UnitElement<N, E> u && candidates.contains(u.unit())) {
                return u.unit();
            }
        }
        throw new IllegalStateException("Network does not contain any of the given units: " + labels(candidates));
    }

    // ---------------------------------------------------------------------
    // Recycles
    // ---------------------------------------------------------------------

    public void addRecycle(E stream) {
        addRecycle(Recycle.of(stream));
    }

    /** Union with the current recycle. All recycle streams must feed the same unit. */
    public void addRecycle(Recycle<E> added) {
        Objects.requireNonNull(added, "added");
        Set<E> combined = new LinkedHashSet<>(recycle.streams());
        combined.addAll(added.streams());
        checkSharedSink(combined);
        recycle = recycle.add(added);
    }

    private void checkSharedSink(Set<E> streams) {
        Set<N> sinks = new LinkedHashSet<>();
        for (E stream : streams) sinks.add(tc.sink(stream));
        if (sinks.size() > 1)
            throw new IllegalArgumentException("Recycle streams must share one sink; got sinks " + labels(sinks));
    }

    /** A set of recycles feeding a unit with a single outlet is replaced by that outlet. */
    public void reduceRecycles() {
        if (recycle instanceof Recycle.Multi<E> multi) {
            Set<N> sinks = new LinkedHashSet<>();
            for (E stream : multi.streams()) sinks.add(tc.sink(stream));
            if (sinks.size() == 1) {
                N sink = sinks.iterator().next();
                List<E> outs = sink == null ? List.of() : tc.outs(sink);
                if (outs.size() == 1) recycle = Recycle.of(outs.get(0));
            }
        }
        for (NetworkElement<N, E> element : elements)
            if (element instanceof SubNetwork<N, E> nested) nested.reduceRecycles();
    }

    // ---------------------------------------------------------------------
    // Joins
    // ---------------------------------------------------------------------

    /**
     * Splice a linear network in at the first direct member it shares, or append it. Units it shares
     * with this path are taken out of this path first.
     */
    public void joinLinearNetwork(SubNetwork<N, E> linear) {
        if (linear.isCyclic())
            throw new IllegalArgumentException("Expected a linear network but it recycles " + linear.recycle);
        List<NetworkElement<N, E>> snapshot = List.copyOf(elements);
        removeOverlap(linear, snapshot);
        for (int index = 0; index < snapshot.size(); index++) {
            if (snapshot.get(index) instanceof UnitElement<N, E> u && linear.units.contains(u.unit())) {
                insertLinearNetwork(index, linear);
                return;
            }
        }
        appendLinearNetwork(linear);
    }

    /**
     * Nest a cyclic network. A loop closing on the same unit as this one is folded into this loop;
     * otherwise it goes into the nested network it overlaps, or in front of the first direct member
     * it shares.
     *
     * @throws IllegalArgumentException if the networks share no unit
     */
    public void joinRecycleNetwork(SubNetwork<N, E> network) {
        if (Objects.equals(recycleSink(), network.recycleSink())) {
            addRecycle(network.recycle);
            network.recycle = Recycle.none();
            addLinearNetwork(network);
            return;
        }
        List<NetworkElement<N, E>> snapshot = List.copyOf(elements);
        removeOverlap(network, snapshot);
        for (NetworkElement<N, E> element : snapshot) {
            if (element instanceof SubNetwork<N, E> nested && !network.isDisjoint(nested)) {
                nested.joinRecycleNetwork(network);
                refreshUnits();
                return;
            }
        }
        for (int index = 0; index < snapshot.size(); index++) {
            if (snapshot.get(index) instanceof UnitElement<N, E> u && network.units.contains(u.unit())) {
                insertRecycleNetwork(index, network);
                return;
            }
        }
        throw new IllegalArgumentException("Networks must have units in common to join; "
                + labels(network.units) + " shares nothing with " + labels(units));
    }

    /**
     * Place {@code network} where {@code unit} sits. Cyclic networks stay nested, linear ones are
     * spliced open.
     *
     * @throws IllegalStateException if {@code unit} is not in this path
     */
    public void joinNetworkAtUnit(SubNetwork<N, E> network, N unit) {
        removeOverlap(network, List.copyOf(elements));
        for (int index = 0; index < elements.size(); index++) {
            NetworkElement<N, E> element = elements.get(index);
            if (element instanceof SubNetwork<N, E> nested && nested.contains(unit)) {
                if (network.isCyclic()) {
                    nested.joinNetworkAtUnit(network, unit);
                    refreshUnits();
                } else {
                    insertLinearNetwork(index, network);
                }
                return;
            } else if (element instanceof UnitElement<N, E> u && u.unit().equals(unit)) {
                if (network.isCyclic()) insertRecycleNetwork(index, network);
                else insertLinearNetwork(index, network);
                return;
            }
        }
        throw new IllegalStateException(tc.label(unit) + " not in path " + labels(units));
    }

    /**
     * Append {@code network} with no connection to this path. A cyclic receiver is first wrapped
     * so the appended part stays out of its loop.
     */
    public void appendNetwork(SubNetwork<N, E> network) {
        if (isCyclic()) {
            SubNetwork<N, E> loop = new SubNetwork<>(tc, elements, recycle);
            recycle = Recycle.none();
            elements = new ArrayList<>();
            elements.add(loop);
            if (network.isCyclic()) elements.add(network);
            else elements.addAll(network.elements);
            refreshUnits();
        } else if (network.isCyclic()) {
            elements.add(network);
            refreshUnits();
        } else {
            appendLinearNetwork(network);
        }
    }

    private void addLinearNetwork(SubNetwork<N, E> network) {
        List<NetworkElement<N, E>> snapshot = List.copyOf(elements);
        removeOverlap(network, snapshot);
        for (NetworkElement<N, E> element : snapshot) {
            if (element instanceof SubNetwork<N, E> nested && !network.isDisjoint(nested)) {
                nested.addLinearNetwork(network);
                refreshUnits();
                return;
            }
        }
        for (int index = 0; index < snapshot.size(); index++) {
            if (snapshot.get(index) instanceof UnitElement<N, E> u && network.units.contains(u.unit())) {
                insertLinearNetwork(index, network);
                return;
            }
        }
        appendLinearNetwork(network);
    }

    /** Drop direct members that {@code network} also covers. */
    private void removeOverlap(SubNetwork<N, E> network, List<NetworkElement<N, E>> snapshot) {
        for (NetworkElement<N, E> element : snapshot)
            if (element instanceof UnitElement<N, E> u && network.units.contains(u.unit())) elements.remove(element);
    }

    private void appendLinearNetwork(SubNetwork<N, E> network) {
        elements.addAll(network.elements);
        refreshUnits();
    }

    private void insertLinearNetwork(int index, SubNetwork<N, E> network) {
        elements.addAll(index, network.elements);
        refreshUnits();
    }

    private void insertRecycleNetwork(int index, SubNetwork<N, E> network) {
        elements.add(index, network);
        if (elements.size() == 1) {
            elements = new ArrayList<>(network.elements);
            recycle = network.recycle;
        }
        refreshUnits();
    }

    private void refreshUnits() {
        Set<N> flattened = new LinkedHashSet<>();
        for (NetworkElement<N, E> element : elements) flattened.addAll(element.units());
        units = flattened;
    }

    // ---------------------------------------------------------------------
    // Passes run once the network is assembled
    // ---------------------------------------------------------------------

    /**
     * Order every level, innermost first, so producers come before consumers. Reachability does not
     * cross {@code ends}. A level that does not settle keeps its order and is reported to
     * {@code diagnostics}.
     */
    public void sort(Set<E> ends, NetworkDiagnostics diagnostics) {
        for (NetworkElement<N, E> element : elements)
            if (element instanceof SubNetwork<N, E> nested) nested.sort(ends, diagnostics);
        int size = elements.size();
        NetworkOrdering.order(tc, elements, ends).ifPresentOrElse(
                ordered -> elements = new ArrayList<>(ordered),
                () -> diagnostics.unresolvedOrder(this, size * size));
    }

    /**
     * Re-run a paired heat exchanger right after the unit feeding its second side when that unit
     * comes later in the path than the exchanger.
     */
    public void addProcessHeatExchangers() {
        addProcessHeatExchangers(new HashSet<>());
    }

    void addProcessHeatExchangers(Set<N> excluded) {
        for (int i = 0; i < elements.size(); i++) {
            NetworkElement<N, E> element = elements.get(i);
            if (element instanceof SubNetwork<N, E> nested) {
                nested.addProcessHeatExchangers(excluded);
                continue;
            }
            N unit = ((UnitElement<N, E>) element).unit();
            if (tc.isPairedExchanger(unit)) excluded.add(unit);
            if (excluded.contains(unit)) continue;
            for (E outlet : tc.outs(unit)) {
                N sink = tc.sink(outlet);
                if (sink != null && tc.isPairedExchanger(sink) && isDirectMemberBefore(sink, i) && !isCoveredAfter(sink, i)) {
                    excluded.add(sink);
                    elements.add(i + 1, new UnitElement<>(sink));
                }
            }
        }
        int last = elements.size() - 1;
        if (last > 0 && elements.get(0) instanceof UnitElement && elements.get(last).equals(elements.get(0)))
            elements.remove(last);
    }

    private boolean isDirectMemberBefore(N unit, int index) {
        for (NetworkElement<N, E> element : elements.subList(0, index))
            if (element instanceof UnitElement<N, E> u && u.unit().equals(unit)) return true;
        return false;
    }

    private boolean isCoveredAfter(N unit, int index) {
        for (NetworkElement<N, E> element : elements.subList(index + 1, elements.size()))
            if (element.contains(unit)) return true;
        return false;
    }

    // ---------------------------------------------------------------------

    private String labels(Collection<N> unitsToLabel) {
        List<String> labels = new ArrayList<>();
        for (N unit : unitsToLabel) labels.add(unit == null ? "null" : tc.label(unit));
        return labels.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof SubNetwork<?, ?> other && elements.equals(other.elements) && recycle.equals(other.recycle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, recycle);
    }

    @Override
    public String toString() {
        return info("");
    }

    private String info(String spaces) {
        String indent = spaces + "    ";
        String end = ",\n" + indent;
        List<String> pathInfo = new ArrayList<>();
        for (NetworkElement<N, E> element : elements) {
            if (element instanceof SubNetwork<N, E> nested) pathInfo.add(nested.info(indent));
            else pathInfo.add(tc.label(((UnitElement<N, E>) element).unit()));
        }
        StringBuilder info = new StringBuilder("SubNetwork(\n").append(indent)
                .append('[').append(String.join(end + " ", pathInfo)).append(']');
        if (recycle instanceof Recycle.Single<E> single) {
            info.append(end).append("recycle=").append(tc.streamLabel(single.stream())).append(')');
        } else if (recycle.isPresent()) {
            List<String> streams = new ArrayList<>();
            for (E stream : recycle.streams()) streams.add(tc.streamLabel(stream));
            info.append(end).append("recycle=[").append(String.join(", ", streams)).append("])");
        } else {
            info.append(')');
        }
        return info.toString();
    }
}
