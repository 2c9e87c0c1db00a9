package dev.abstats.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.abstats.ConfigurationException;
import org.junit.jupiter.api.Test;

class StatsEngineConfigTest {

    @Test
    void defaultsApplyWithoutOverrides() {
        var config = StatsEngineConfig.of();
        assertEquals(20, config.defaultMaxDimensions());
        assertEquals(64, config.errorMessageLimit());
        assertEquals(10_000, config.banditDraws());
        assertEquals(0.01, config.banditMinWeight());
        assertFalse(config.parallel());
    }

    @Test
    void overridesTakePrecedence() {
        var config =
                StatsEngineConfig.of(
                        "ABSTATS_DEFAULT_MAX_DIMENSIONS", "5",
                        "ABSTATS_ERROR_MESSAGE_LIMIT", "10",
                        "ABSTATS_PARALLEL", "true");
        assertEquals(5, config.defaultMaxDimensions());
        assertEquals(10, config.errorMessageLimit());
        assertTrue(config.parallel());
    }

    @Test
    void banditPriorIsProperAndConfigurable() {
        var prior =
                StatsEngineConfig.of(
                                "ABSTATS_BANDIT_PRIOR_MEAN", "1.5",
                                "ABSTATS_BANDIT_PRIOR_VARIANCE", "4")
                        .banditPrior();
        assertEquals(1.5, prior.mean());
        assertEquals(4.0, prior.variance());
        assertTrue(prior.proper());

        var defaults = StatsEngineConfig.of().banditPrior();
        assertEquals(0.0, defaults.mean());
        assertEquals(1e4, defaults.variance());
    }

    @Test
    void danglingKeyIsRejected() {
        var e =
                assertThrows(
                        ConfigurationException.class,
                        () -> StatsEngineConfig.of("ABSTATS_PARALLEL"));
        assertTrue(e.getMessage().contains("ABSTATS_PARALLEL"));
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(
                ConfigurationException.class,
                () -> StatsEngineConfig.of("ABSTATS_BANDIT_DRAWS", "lots"));
        assertThrows(
                ConfigurationException.class,
                () -> StatsEngineConfig.of("ABSTATS_BANDIT_PRIOR_VARIANCE", "0"));
        assertThrows(
                ConfigurationException.class,
                () -> StatsEngineConfig.of("ABSTATS_BANDIT_MIN_WEIGHT", "1"));
        assertThrows(
                ConfigurationException.class,
                () -> StatsEngineConfig.of("ABSTATS_DEFAULT_MAX_DIMENSIONS", "0"));
    }
}
