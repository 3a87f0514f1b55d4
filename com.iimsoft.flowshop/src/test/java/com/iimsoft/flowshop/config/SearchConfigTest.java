package com.iimsoft.flowshop.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.flowshop.exception.ConfigurationException;
import com.iimsoft.flowshop.improvement.AcceptancePolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(SearchConfig.SEARCH_CONFIG_JSON_PROPERTY);
    }

    @Test
    void defaults() {
        SearchConfig config = SearchConfig.defaults();
        assertEquals(1000, config.getMaxIterations());
        assertEquals(100, config.getVnsMaxIterations());
        assertEquals(2, config.getVnsPerturbationSize());
        assertEquals(400, config.getAdjacentSwapMaxIterations());
        assertNull(config.getAdjacentSwapTopK());
        assertEquals(30_000L, config.getAdjacentSwapTimeBudgetMillis());
        assertEquals(50, config.getGaPopulationSize());
        assertEquals(0.1, config.getGaMutationRate());
        assertEquals(0.8, config.getGaCrossoverRate());
        assertEquals(5, config.getGaEliteSize());
        assertEquals(50, config.getGaGenerations());
        assertEquals(100, config.getGaStandaloneGenerations());
        assertEquals(AcceptancePolicy.BEST, config.getLocalSearchPolicy());
        assertNull(config.getRandomSeed());
        assertSame(config, config.validate());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        SearchConfig zeroPopulation = SearchConfig.defaults();
        zeroPopulation.setGaPopulationSize(0);
        ConfigurationException e = assertThrows(ConfigurationException.class, zeroPopulation::validate);
        assertTrue(e.getMessage().contains("gaPopulationSize"));

        SearchConfig tooManyElites = SearchConfig.defaults();
        tooManyElites.setGaEliteSize(51);
        assertThrows(ConfigurationException.class, tooManyElites::validate);

        SearchConfig badRate = SearchConfig.defaults();
        badRate.setGaMutationRate(1.5);
        assertThrows(ConfigurationException.class, badRate::validate);

        SearchConfig noIterations = SearchConfig.defaults();
        noIterations.setMaxIterations(0);
        assertThrows(ConfigurationException.class, noIterations::validate);

        SearchConfig zeroTopK = SearchConfig.defaults();
        zeroTopK.setAdjacentSwapTopK(0);
        assertThrows(ConfigurationException.class, zeroTopK::validate);

        SearchConfig negativePerturbation = SearchConfig.defaults();
        negativePerturbation.setVnsPerturbationSize(-1);
        assertThrows(ConfigurationException.class, negativePerturbation::validate);
    }

    @Test
    void partialJsonKeepsTheRemainingDefaults() throws Exception {
        SearchConfig config = new ObjectMapper().readValue(
                "{\"gaPopulationSize\": 30, \"randomSeed\": 7, \"localSearchPolicy\": \"FIRST\", \"unknown\": 1}",
                SearchConfig.class);
        assertEquals(30, config.getGaPopulationSize());
        assertEquals(7L, config.getRandomSeed());
        assertEquals(AcceptancePolicy.FIRST, config.getLocalSearchPolicy());
        assertEquals(1000, config.getMaxIterations());
    }

    @Test
    void systemPropertyOverridesDefaults() {
        System.setProperty(SearchConfig.SEARCH_CONFIG_JSON_PROPERTY, "{\"vnsMaxIterations\": 12}");
        assertEquals(12, SearchConfig.fromSystemProperty().getVnsMaxIterations());
    }

    @Test
    void malformedSystemPropertyIsAConfigurationError() {
        System.setProperty(SearchConfig.SEARCH_CONFIG_JSON_PROPERTY, "{not json");
        assertThrows(ConfigurationException.class, SearchConfig::fromSystemProperty);
    }

    @Test
    void seededRandomIsReproducible() {
        SearchConfig config = SearchConfig.defaults();
        config.setRandomSeed(5L);
        assertEquals(config.newRandom().nextLong(), config.newRandom().nextLong());
    }
}
