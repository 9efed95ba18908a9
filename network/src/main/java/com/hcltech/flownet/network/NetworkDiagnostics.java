package com.hcltech.flownet.network;

/** Receives soft failures found while a network is being built. */
@FunctionalInterface
public interface NetworkDiagnostics {

    /** Logs a warning and carries on. */
    NetworkDiagnostics logging = new LoggingNetworkDiagnostics();

    /** Turns an unresolved order into an {@link IllegalStateException}. */
    NetworkDiagnostics failing = (network, passes) -> {
        throw new IllegalStateException("Network path could not be determined after " + passes + " passes: " + network);
    };

    /**
     * The ordering pass gave up on one level of {@code network}; that level keeps the order it had.
     *
     * @param passes the number of passes tried
     */
    void unresolvedOrder(SubNetwork<?, ?> network, int passes);
}
