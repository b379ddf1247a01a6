package com.formula.adapter.spring;

import com.formula.cli.OutputFormat;
import com.formula.parser.FormulaSyntax;
import com.formula.table.AtomicMassTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for formula handling.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /**
     * Whether formula beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the atomic mass table.
     * Supports classpath: prefix for classpath resources.
     */
    private String massTablePath = AtomicMassTable.DEFAULT_PATH;

    /**
     * Deepest accepted group nesting.
     */
    private int maxNestingDepth = FormulaSyntax.DEFAULT_MAX_NESTING_DEPTH;

    /**
     * Console output format.
     */
    private OutputFormat outputFormat = OutputFormat.TEXT;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getMassTablePath() {
        return massTablePath;
    }

    public void setMassTablePath(String massTablePath) {
        this.massTablePath = massTablePath;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }
}
