package com.hcltech.flownet.network;

import com.hcltech.flownet.common.IEnvGetter;

/**
 * Switches for the passes run after a network has been assembled.
 *
 * @param pairProcessHeatExchangers re-run paired heat exchangers after the unit feeding their second side
 * @param reduceRecycles            collapse recycle sets that feed a single-outlet unit
 * @param failOnUnresolvedOrder     fail instead of warning when a path level cannot be ordered
 */
public record NetworkConfig(boolean pairProcessHeatExchangers, boolean reduceRecycles, boolean failOnUnresolvedOrder) {

    public static final String PAIR_HEAT_EXCHANGERS = "FLOWNET_PAIR_HEAT_EXCHANGERS";
    public static final String REDUCE_RECYCLES = "FLOWNET_REDUCE_RECYCLES";
    public static final String FAIL_ON_UNRESOLVED_ORDER = "FLOWNET_FAIL_ON_UNRESOLVED_ORDER";

    public static NetworkConfig defaults() {
        return new NetworkConfig(true, true, false);
    }

    /** Unset names keep their default. */
    public static NetworkConfig fromEnv(IEnvGetter env) {
        NetworkConfig d = defaults();
        return new NetworkConfig(
                IEnvGetter.getBooleanOr(env, PAIR_HEAT_EXCHANGERS, d.pairProcessHeatExchangers()),
                IEnvGetter.getBooleanOr(env, REDUCE_RECYCLES, d.reduceRecycles()),
                IEnvGetter.getBooleanOr(env, FAIL_ON_UNRESOLVED_ORDER, d.failOnUnresolvedOrder()));
    }

    /** {@link NetworkDiagnostics#failing} when strict, otherwise {@code fallback}. */
    public NetworkDiagnostics diagnostics(NetworkDiagnostics fallback) {
        return failOnUnresolvedOrder ? NetworkDiagnostics.failing : fallback;
    }
}
