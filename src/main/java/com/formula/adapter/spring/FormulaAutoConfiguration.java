package com.formula.adapter.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formula.cli.FormulaConsole;
import com.formula.core.DefaultMoleculeAnalyzer;
import com.formula.core.MoleculeAnalyzer;
import com.formula.exception.ConfigurationException;
import com.formula.table.AtomicMassTable;
import com.formula.table.AtomicMassTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for formula handling.
 */
@Configuration
@ConditionalOnProperty(prefix = "formula", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FormulaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AtomicMassTable atomicMassTable(FormulaProperties properties) {
        String path = properties.getMassTablePath();
        if (path == null || path.isBlank() || AtomicMassTable.DEFAULT_PATH.equals(path)) {
            return AtomicMassTable.standard();
        }
        return AtomicMassTableLoader.load(path);
    }

    @Bean
    @ConditionalOnMissingBean
    public MoleculeAnalyzer moleculeAnalyzer(AtomicMassTable table, FormulaProperties properties) {
        int maxDepth = properties.getMaxNestingDepth();
        if (maxDepth < 0) {
            throw new ConfigurationException("formula.max-nesting-depth must not be negative, got " + maxDepth);
        }
        log.info("Creating MoleculeAnalyzer: {} elements, max nesting depth {}", table.size(), maxDepth);
        return new DefaultMoleculeAnalyzer(table, maxDepth);
    }

    @Bean
    @ConditionalOnMissingBean
    public FormulaConsole formulaConsole(MoleculeAnalyzer analyzer, FormulaProperties properties,
                                         ObjectProvider<ObjectMapper> objectMapper) {
        return new FormulaConsole(analyzer, properties.getOutputFormat(),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
