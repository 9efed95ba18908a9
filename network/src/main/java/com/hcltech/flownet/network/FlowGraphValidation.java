package com.hcltech.flownet.network;

import com.hcltech.flownet.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Checks that units and streams agree about how they are connected. Never throws. */
public interface FlowGraphValidation {

    static <N, E> ErrorsOr<Boolean> validate(Collection<N> units, FlowGraphTC<N, E> tc) {
        Objects.requireNonNull(units);
        Objects.requireNonNull(tc);
        List<String> errors = new ArrayList<>();
        Set<N> seen = new HashSet<>();
        for (N unit : units) {
            if (unit == null) {
                errors.add("Null unit in unit list");
                continue;
            }
            if (!seen.add(unit)) errors.add("Unit " + tc.label(unit) + " is listed more than once");
            List<E> ins = tc.ins(unit);
            for (int i = 0; i < ins.size(); i++) {
                N sink = tc.sink(ins.get(i));
                if (!unit.equals(sink))
                    errors.add("Inlet " + i + " of " + tc.label(unit) + " has sink " + label(tc, sink));
            }
            List<E> outs = tc.outs(unit);
            for (int i = 0; i < outs.size(); i++) {
                N source = tc.source(outs.get(i));
                if (!unit.equals(source))
                    errors.add("Outlet " + i + " of " + tc.label(unit) + " has source " + label(tc, source));
            }
        }
        return ErrorsOr.liftOrErrors(Boolean.TRUE, errors);
    }

    private static <N, E> String label(FlowGraphTC<N, E> tc, N unit) {
        return unit == null ? "none" : tc.label(unit);
    }
}
