package com.hcltech.flownet.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNetworkDiagnostics implements NetworkDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(LoggingNetworkDiagnostics.class);

    @Override
    public void unresolvedOrder(SubNetwork<?, ?> network, int passes) {
        log.warn("Network path could not be determined after {} passes; keeping units={} in their current order",
                passes, network.units());
    }
}
