package com.hcltech.flownet.network;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Stable address of an outlet: the producing unit and the slot index in its outlets. */
public record OutletPort<N>(N source, int index) {
    public OutletPort {
        Objects.requireNonNull(source, "source");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0, was " + index);
    }

    public static <N, E> OutletPort<N> fromOutlet(FlowGraphTC<N, E> tc, E stream) {
        N source = tc.source(stream);
        if (source == null)
            throw new IllegalArgumentException("Stream " + stream + " has no source; only outlets have ports");
        int index = tc.outs(source).indexOf(stream);
        if (index < 0)
            throw new IllegalArgumentException("Stream " + stream + " is not an outlet of " + tc.label(source));
        return new OutletPort<>(source, index);
    }

    /** The stream currently in this slot, empty if the unit no longer has that many outlets. */
    public <E> Optional<E> stream(FlowGraphTC<N, E> tc) {
        List<E> outs = tc.outs(source);
        return index < outs.size() ? Optional.ofNullable(outs.get(index)) : Optional.empty();
    }
}
