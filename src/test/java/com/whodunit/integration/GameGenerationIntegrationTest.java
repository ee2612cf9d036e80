package com.whodunit.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whodunit.batch.BatchFault;
import com.whodunit.batch.BatchGenerationService;
import com.whodunit.batch.BatchReport;
import com.whodunit.contract.GameRecord;
import com.whodunit.engine.ConvergenceController;
import com.whodunit.engine.GameEngineService;
import com.whodunit.engine.GameOutcome;
import com.whodunit.engine.SuspectCounter;
import com.whodunit.logic.AtomSpace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end through the wired engine: seed, scenario, proposition loop,
 * record and JSON.
 */
@SpringBootTest
class GameGenerationIntegrationTest {

    @Autowired GameEngineService engine;
    @Autowired BatchGenerationService batch;
    @Autowired ConvergenceController controller;
    @Autowired SuspectCounter suspectCounter;
    @Autowired ObjectMapper objectMapper;

    @Test
    @DisplayName("Same seed and configuration produce byte-identical JSON")
    void replay_isByteIdentical() throws Exception {
        String first = objectMapper.writeValueAsString(engine.generate(null, 31337L));
        String second = objectMapper.writeValueAsString(engine.generate(null, 31337L));

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Recorded JSON reads back into an equal record")
    void record_readsBack() throws Exception {
        GameRecord record = engine.generate(null, 5L);

        GameRecord read = objectMapper.readValue(objectMapper.writeValueAsString(record), GameRecord.class);

        assertEquals(record, read);
    }

    @Test
    @DisplayName("Default configuration converges on the recorded killer for nearly every seed")
    void defaultConfiguration_converges() {
        BatchReport report = batch.run(null, 1, 500);

        assertTrue(report.converged() >= 495, "converged " + report.converged() + ", faults " + report.faults());
        for (BatchFault fault : report.faults()) {
            assertEquals("ATTEMPTS_EXHAUSTED", fault.kind(), "unexpected fault " + fault);
        }
        assertTrue(report.minPropositions() >= 1);
    }

    @Test
    @DisplayName("Final knowledge leaves exactly the recorded killer")
    void finalKnowledge_identifiesKiller() {
        for (long seed = 500; seed < 520; seed++) {
            GameOutcome outcome = engine.play(null, seed);
            if (outcome instanceof GameOutcome.Converged converged) {
                List<String> suspects = suspectCounter
                    .count(converged.knowledge(), AtomSpace.build(engine.defaultConfiguration()))
                    .suspects();
                assertEquals(List.of(converged.record().killer()), suspects, "seed " + seed);
            }
        }
    }

    @Test
    @DisplayName("Attempt bound comes from configuration")
    void attemptBound_isConfigured() {
        assertEquals(1000, controller.getMaxAttempts());
    }
}
