package com.electionlens.boothrecon.config;

import com.electionlens.boothrecon.service.mapping.ColumnMappingStrategy;
import com.electionlens.boothrecon.service.mapping.impl.PositionalMappingStrategy;
import com.electionlens.boothrecon.service.mapping.impl.VoteTotalMappingStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the column mapping strategies. Which ones run, and in what order, is decided per
 * contest by {@code contest.mapping-strategies}.
 */
@Configuration
public class MappingConfig {

    @Bean
    public ColumnMappingStrategy positionalMappingStrategy() {
        return new PositionalMappingStrategy();
    }

    @Bean
    public ColumnMappingStrategy voteTotalMappingStrategy() {
        return new VoteTotalMappingStrategy(false);
    }

    @Bean
    public ColumnMappingStrategy scaledVoteTotalMappingStrategy() {
        return new VoteTotalMappingStrategy(true);
    }
}
