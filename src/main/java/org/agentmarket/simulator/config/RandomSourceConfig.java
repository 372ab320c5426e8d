package org.agentmarket.simulator.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Provides the single random generator shared by trader initialization and noise traders.
 * A configured seed makes a run reproducible; without one the generator is entropy-seeded.
 */
@Slf4j
@Configuration
public class RandomSourceConfig {

    @Bean
    public Random simulationRandom(SimulatorProperties properties) {
        Long seed = properties.getSeed();
        if (seed == null) {
            log.info("No simulator.seed configured, using entropy-seeded generator (run is not reproducible)");
            return new Random();
        }
        log.info("Using seeded generator: seed={}", seed);
        return new Random(seed);
    }
}
