package com.hcltech.flownet.network;

import com.hcltech.flownet.common.IEnvGetter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class NetworkConfigTest {

    @Test
    void defaultsPairExchangersAndReduceRecyclesButOnlyWarn() {
        assertEquals(new NetworkConfig(true, true, false), NetworkConfig.defaults());
    }

    @Test
    void unsetNamesKeepTheirDefaults() {
        assertEquals(NetworkConfig.defaults(), NetworkConfig.fromEnv(IEnvGetter.mock(Map.of())));
    }

    @Test
    void valuesAreReadFromTheEnvironment() {
        IEnvGetter env = IEnvGetter.mock(Map.of(
                NetworkConfig.PAIR_HEAT_EXCHANGERS, "false",
                NetworkConfig.REDUCE_RECYCLES, " FALSE ",
                NetworkConfig.FAIL_ON_UNRESOLVED_ORDER, "True"));
        assertEquals(new NetworkConfig(false, false, true), NetworkConfig.fromEnv(env));
    }

    @Test
    void invalidBooleanNamesTheSetting() {
        IEnvGetter env = IEnvGetter.mock(Map.of(NetworkConfig.REDUCE_RECYCLES, "yes"));
        var e = assertThrows(IllegalStateException.class, () -> NetworkConfig.fromEnv(env));
        assertTrue(e.getMessage().contains(NetworkConfig.REDUCE_RECYCLES), e.getMessage());
    }

    @Test
    void strictConfigFailsInsteadOfUsingTheFallback() {
        NetworkDiagnostics fallback = mock(NetworkDiagnostics.class);
        assertSame(fallback, NetworkConfig.defaults().diagnostics(fallback));
        assertSame(NetworkDiagnostics.failing, new NetworkConfig(true, true, true).diagnostics(fallback));
    }
}
