package com.gravitychain.config;

import com.gravitychain.access.RoleProperties;
import com.gravitychain.genesis.Genesis;
import com.gravitychain.genesis.GenesisProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration class used to instantiate beans.
 */
@Configuration
@EnableConfigurationProperties({RoleProperties.class, GenesisProperties.class})
public class CommonConfig {

    @Bean
    @ConditionalOnProperty(prefix = "gravity.genesis", name = "run-on-startup", havingValue = "true",
            matchIfMissing = true)
    public CommandLineRunner genesisRunner(Genesis genesis) {
        return args -> genesis.execute();
    }
}
