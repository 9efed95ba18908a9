package com.hcltech.flownet.network;

import java.util.List;

/**
 * Result of walking the graph from one source stream.
 *
 * @param linear paths ending at a product, a boundary or an end stream
 * @param cyclic paths closed by a recycle stream, truncated to start where the loop closes
 * @param leadIn when no linear path exists, the units walked before the first cyclic path's loop starts
 */
public record EnumeratedPaths<N, E>(List<List<N>> linear, List<CyclicPath<N, E>> cyclic, List<N> leadIn) {
    public EnumeratedPaths {
        linear = List.copyOf(linear);
        cyclic = List.copyOf(cyclic);
        leadIn = List.copyOf(leadIn);
    }

    public EnumeratedPaths(List<List<N>> linear, List<CyclicPath<N, E>> cyclic) {
        this(linear, cyclic, List.of());
    }
}
