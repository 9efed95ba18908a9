package com.hcltech.flownet.network;

import java.util.Set;

/** An entry in a {@link SubNetwork} path: a single unit or a nested sub-network. */
public sealed interface NetworkElement<N, E> permits UnitElement, SubNetwork {

    /** The units covered by this element. */
    Set<N> units();

    default boolean contains(N unit) {
        return units().contains(unit);
    }
}
