package com.hcltech.flownet.network;

import java.util.Objects;
import java.util.Set;

public record UnitElement<N, E>(N unit) implements NetworkElement<N, E> {
    public UnitElement {
        Objects.requireNonNull(unit, "unit");
    }

    @Override
    public Set<N> units() {
        return Set.of(unit);
    }

    @Override
    public boolean contains(N other) {
        return unit.equals(other);
    }
}
