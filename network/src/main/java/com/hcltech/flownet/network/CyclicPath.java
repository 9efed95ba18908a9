package com.hcltech.flownet.network;

import java.util.List;
import java.util.Objects;

/** A path of units together with the stream that closes it into a loop. */
public record CyclicPath<N, E>(List<N> path, E recycle) {
    public CyclicPath {
        path = List.copyOf(path);
        Objects.requireNonNull(recycle, "recycle");
    }
}
