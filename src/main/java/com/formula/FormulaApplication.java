package com.formula;

import com.formula.cli.FormulaConsole;
import com.formula.spring.EnableFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command-line molecular mass calculator.
 * <p>
 * Formulas given as arguments are analysed in order; without arguments the
 * application prompts for formulas on standard input until a blank line.
 */
@SpringBootApplication
@EnableFormula
public class FormulaApplication {

    private static final Logger log = LoggerFactory.getLogger(FormulaApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FormulaApplication.class, args);
    }

    @Bean
    public ApplicationRunner formulaRunner(FormulaConsole console) {
        return args -> {
            List<String> formulas = args.getNonOptionArgs();
            int failures;
            if (formulas.isEmpty()) {
                BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                failures = console.run(in, System.out);
            } else {
                failures = console.analyzeAll(formulas, System.out);
            }
            if (failures > 0) {
                log.warn("{} formula(s) could not be analysed", failures);
            }
        };
    }
}
