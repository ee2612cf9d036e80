package com.whodunit.engine;

import com.whodunit.config.WhodunitProperties;
import com.whodunit.generation.PropositionGenerator;
import com.whodunit.generation.PropositionTemplates;
import com.whodunit.logic.Sat4jSatisfiabilityOracle;
import com.whodunit.logic.SatisfiabilityOracle;
import com.whodunit.scenario.ScenarioInitializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public SatisfiabilityOracle satisfiabilityOracle() {
        return new Sat4jSatisfiabilityOracle();
    }

    @Bean
    public PropositionGenerator propositionGenerator() {
        return new PropositionGenerator(PropositionTemplates.standard());
    }

    @Bean
    public SuspectCounter suspectCounter(SatisfiabilityOracle oracle) {
        return new SuspectCounter(oracle);
    }

    @Bean
    public FeasibilityOracle feasibilityOracle(SatisfiabilityOracle oracle) {
        return new FeasibilityOracle(oracle);
    }

    @Bean
    public ConvergenceController convergenceController(ScenarioInitializer initializer,
                                                       PropositionGenerator generator,
                                                       FeasibilityOracle feasibilityOracle,
                                                       SuspectCounter suspectCounter,
                                                       WhodunitProperties properties) {
        return new ConvergenceController(initializer, generator, feasibilityOracle, suspectCounter,
            properties.getEngine().getMaxAttempts());
    }
}
