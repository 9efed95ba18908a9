package com.hcltech.flownet.network;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The feedback streams a sub-network iterates on: none (linear), a single stream, or a set of
 * streams that all close on the same unit.
 */
public sealed interface Recycle<E> permits Recycle.None, Recycle.Single, Recycle.Multi {

    record None<E>() implements Recycle<E> {
        @Override public Set<E> streams() { return Set.of(); }
    }

    record Single<E>(E stream) implements Recycle<E> {
        public Single {
            Objects.requireNonNull(stream, "stream");
        }

        @Override public Set<E> streams() { return Set.of(stream); }
    }

    record Multi<E>(Set<E> streams) implements Recycle<E> {
        public Multi {
            if (streams.isEmpty()) throw new IllegalArgumentException("A recycle set must not be empty");
            streams = Collections.unmodifiableSet(new LinkedHashSet<>(streams));
        }
    }

    Set<E> streams();

    default boolean isPresent() {
        return !(this instanceof None);
    }

    static <E> Recycle<E> none() {
        return new None<>();
    }

    static <E> Recycle<E> of(E stream) {
        return stream == null ? none() : new Single<>(stream);
    }

    static <E> Recycle<E> of(Collection<E> streams) {
        return new Multi<>(new LinkedHashSet<>(streams));
    }

    /**
     * Union of this and {@code other}. Adding a stream already present changes nothing; a second
     * distinct stream turns a single recycle into a set.
     */
    default Recycle<E> add(Recycle<E> other) {
        Objects.requireNonNull(other, "other");
        if (!other.isPresent()) return this;
        if (!isPresent()) return other;
        if (this instanceof Single<E> single && other instanceof Single<E> added && single.equals(added))
            return this;
        Set<E> union = new LinkedHashSet<>(streams());
        if (this instanceof Multi && union.containsAll(other.streams())) return this;
        union.addAll(other.streams());
        return new Multi<>(union);
    }

    /** Unit every recycle stream feeds into, {@code null} when there is no recycle. */
    default <N> N sink(FlowGraphTC<N, E> tc) {
        for (E stream : streams()) return tc.sink(stream);
        return null;
    }
}
