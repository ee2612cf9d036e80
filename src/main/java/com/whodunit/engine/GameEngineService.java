package com.whodunit.engine;

import com.whodunit.config.WhodunitProperties;
import com.whodunit.contract.GameConfiguration;
import com.whodunit.contract.GameConfigurationValidator;
import com.whodunit.contract.GameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point for generating games: validates the configuration, fixes the
 * seed and hands the game to the {@link ConvergenceController}.
 */
@Service
public class GameEngineService {

    private static final Logger log = LoggerFactory.getLogger(GameEngineService.class);

    private final GameConfigurationValidator validator;
    private final ConvergenceController controller;
    private final WhodunitProperties properties;

    public GameEngineService(GameConfigurationValidator validator,
                             ConvergenceController controller,
                             WhodunitProperties properties) {
        this.validator = validator;
        this.controller = controller;
        this.properties = properties;
    }

    public GameConfiguration defaultConfiguration() {
        return properties.getDefaults().toConfiguration();
    }

    /**
     * Plays one game.
     *
     * @param configuration game configuration, or null for the default one
     * @param seed random seed, or null to draw one; the seed used is in the record
     * @throws com.whodunit.contract.ConfigurationException if the configuration is invalid
     */
    public GameOutcome play(GameConfiguration configuration, Long seed) {
        GameConfiguration effective = configuration != null ? configuration : defaultConfiguration();
        validator.validate(effective);
        long effectiveSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();
        return controller.run(effective, effectiveSeed);
    }

    /**
     * Plays one game and insists on convergence.
     *
     * @throws EngineFaultException with {@link FaultKind#ATTEMPTS_EXHAUSTED} if the
     *         attempt bound ran out
     */
    public GameRecord generate(GameConfiguration configuration, Long seed) {
        GameOutcome outcome = play(configuration, seed);
        if (outcome instanceof GameOutcome.Exhausted exhausted) {
            log.warn("Game seed={} did not converge, {} suspects left",
                exhausted.record().seed(), exhausted.remainingSuspects().size());
            throw new EngineFaultException(FaultKind.ATTEMPTS_EXHAUSTED,
                "seed " + exhausted.record().seed() + " did not converge within "
                    + exhausted.attempts() + " attempts; remaining suspects "
                    + exhausted.remainingSuspects());
        }
        return outcome.record();
    }
}
