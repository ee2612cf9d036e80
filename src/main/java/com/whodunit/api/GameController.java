package com.whodunit.api;

import com.whodunit.batch.BatchGenerationService;
import com.whodunit.batch.BatchReport;
import com.whodunit.contract.GameRecord;
import com.whodunit.engine.GameEngineService;
import com.whodunit.render.PropositionRenderer;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for generating games.
 *
 * POST /v1/games                    one game, optional seed and configuration
 * GET  /v1/games/{seed}             one game on the default configuration
 * GET  /v1/games/{seed}/transcript  the same game rendered as text
 * POST /v1/games/batch              one game per seed over a range
 */
@RestController
@RequestMapping("/v1/games")
public class GameController {

    private final GameEngineService engine;
    private final BatchGenerationService batch;

    public GameController(GameEngineService engine, BatchGenerationService batch) {
        this.engine = engine;
        this.batch = batch;
    }

    @PostMapping
    public GameRecord generate(@RequestBody(required = false) GameRequest request) {
        if (request == null) {
            return engine.generate(null, null);
        }
        return engine.generate(request.configuration(), request.seed());
    }

    @GetMapping("/{seed}")
    public GameRecord generateForSeed(@PathVariable long seed) {
        return engine.generate(null, seed);
    }

    @GetMapping("/{seed}/transcript")
    public GameTranscript transcript(@PathVariable long seed) {
        GameRecord record = engine.generate(null, seed);
        return new GameTranscript(
            record.seed(),
            record.killer(),
            PropositionRenderer.renderScenario(record),
            PropositionRenderer.renderPropositions(record));
    }

    @PostMapping("/batch")
    public BatchReport batch(@RequestBody BatchRequest request) {
        return batch.run(request.configuration(), request.seedStart(), request.count());
    }
}
