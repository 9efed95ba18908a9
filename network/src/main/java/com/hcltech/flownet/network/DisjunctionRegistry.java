package com.hcltech.flownet.network;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Streams marked as deterministic: their flow will not change while recycle loops are solved,
 * so no recycle loop is ever closed through them.
 * <p>
 * Streams are held by {@link OutletPort}, so a marking survives the stream object in that slot
 * being replaced. Not thread safe.
 */
public final class DisjunctionRegistry<N, E> {
    private final FlowGraphTC<N, E> tc;
    private final Set<OutletPort<N>> ports = new LinkedHashSet<>();

    public DisjunctionRegistry(FlowGraphTC<N, E> tc) {
        this.tc = Objects.requireNonNull(tc, "tc");
    }

    /** @return true if the stream was not already marked */
    public boolean mark(E stream) {
        return ports.add(OutletPort.fromOutlet(tc, stream));
    }

    /** @return true if the stream was marked */
    public boolean unmark(E stream) {
        return ports.remove(OutletPort.fromOutlet(tc, stream));
    }

    public boolean isMarked(E stream) {
        N source = tc.source(stream);
        if (source == null) return false;
        int index = tc.outs(source).indexOf(stream);
        return index >= 0 && ports.contains(new OutletPort<>(source, index));
    }

    /** The streams currently sitting in the marked ports. */
    public Set<E> streams() {
        Set<E> streams = new LinkedHashSet<>();
        for (OutletPort<N> port : ports) port.stream(tc).ifPresent(streams::add);
        return streams;
    }

    public Set<OutletPort<N>> ports() {
        return Collections.unmodifiableSet(ports);
    }

    public int size() {
        return ports.size();
    }

    public void clear() {
        ports.clear();
    }
}
