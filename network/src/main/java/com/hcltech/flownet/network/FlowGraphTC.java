package com.hcltech.flownet.network;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What the network algorithms need to know about units ({@code N}) and the streams ({@code E})
 * connecting them. Units and streams are owned by the caller; they are compared with
 * {@code equals}, so identity equality is the norm.
 */
public interface FlowGraphTC<N, E> {

    /** Inlet streams of {@code unit}, in slot order. */
    List<E> ins(N unit);

    /** Outlet streams of {@code unit}, in slot order. */
    List<E> outs(N unit);

    /** Unit producing {@code stream}, or {@code null} at a graph boundary. */
    N source(E stream);

    /** Unit consuming {@code stream}, or {@code null} for a product. */
    N sink(E stream);

    /**
     * Stream with no source feeding {@code unit}. Used as the entry point for units
     * that have no inlets at all.
     */
    E boundaryInlet(N unit);

    /** Facility-class units halt traversal and are never placed inside a path. */
    default boolean isTerminal(N unit) { return false; }

    /** Units that exchange heat between two of their own streams and must be re-run after their hot side. */
    default boolean isPairedExchanger(N unit) { return false; }

    /** Order in which discovered feeds are processed; the first becomes the main source. */
    default Comparator<E> feedPriority() { return (a, b) -> 0; }

    default String label(N unit) { return String.valueOf(unit); }

    /** "source-index" for streams with a source, {@code toString} otherwise. */
    default String streamLabel(E stream) {
        N source = source(stream);
        if (source == null) return String.valueOf(stream);
        return label(source) + "-" + outs(source).indexOf(stream);
    }

    /** All units reachable from {@code unit}, see {@link #downstream(Object, Set, int)}. */
    default Set<N> downstream(N unit, Set<E> ends) {
        return downstream(unit, ends, Integer.MAX_VALUE);
    }

    /**
     * Units reachable from {@code unit} in at most {@code maxHops} streams. Streams in
     * {@code ends} are not crossed and terminal units are not entered. {@code unit} itself is
     * only included when a loop leads back to it.
     */
    default Set<N> downstream(N unit, Set<E> ends, int maxHops) {
        Set<N> result = new LinkedHashSet<>();
        Deque<N> frontier = new ArrayDeque<>();
        frontier.add(unit);
        for (int hop = 0; hop < maxHops && !frontier.isEmpty(); hop++) {
            Deque<N> next = new ArrayDeque<>();
            for (N from : frontier) {
                for (E out : outs(from)) {
                    if (ends.contains(out)) continue;
                    N sink = sink(out);
                    if (sink == null || isTerminal(sink)) continue;
                    if (result.add(sink)) next.add(sink);
                }
            }
            frontier = next;
        }
        return result;
    }

    /** Every inlet and outlet of the given units. */
    default Set<E> streams(Collection<N> units) {
        Set<E> streams = new LinkedHashSet<>();
        for (N unit : units) {
            streams.addAll(ins(unit));
            streams.addAll(outs(unit));
        }
        return streams;
    }

    /** Inlets whose source is missing or outside {@code units}. */
    default List<E> feeds(Collection<N> units) {
        Set<N> unitSet = new HashSet<>(units);
        Set<E> feeds = new LinkedHashSet<>();
        for (N unit : units)
            for (E in : ins(unit)) {
                N source = source(in);
                if (source == null || !unitSet.contains(source)) feeds.add(in);
            }
        return List.copyOf(feeds);
    }

    /** Outlets whose sink is missing or outside {@code units}. */
    default List<E> products(Collection<N> units) {
        Set<N> unitSet = new HashSet<>(units);
        Set<E> products = new LinkedHashSet<>();
        for (N unit : units)
            for (E out : outs(unit)) {
                N sink = sink(out);
                if (sink == null || !unitSet.contains(sink)) products.add(out);
            }
        return List.copyOf(products);
    }
}
