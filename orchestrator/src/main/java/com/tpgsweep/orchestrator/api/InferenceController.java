package com.tpgsweep.orchestrator.api;

import com.tpgsweep.orchestrator.aggregate.InferenceResultsAggregator;
import com.tpgsweep.orchestrator.api.dto.InferenceRequest;
import com.tpgsweep.orchestrator.api.dto.ResumeResponse;
import com.tpgsweep.orchestrator.reconcile.InferencePlanner;
import com.tpgsweep.orchestrator.service.InferenceService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST API for the inference phase.
 *
 * POST /inference/plan     : write one simulator config per TPG, core and ISA variant
 * POST /inference/resume   : list (and optionally dispatch) configs without a result
 * POST /inference/aggregate: write the per-seed and averaged latency tables
 *
 * A root without training_results answers 404.
 */
@RestController
@RequestMapping("/inference")
public class InferenceController {

    private final InferenceService inferenceService;

    public InferenceController(InferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    @PostMapping("/plan")
    public Map<String, Object> plan(@RequestBody(required = false) InferenceRequest req) {
        InferenceRequest r = orEmpty(req);
        InferencePlanner.InferencePlan plan = guarded(() -> inferenceService.plan(path(r.root()), r.mini()));
        return Map.of(
                "configs", plan.configFiles().size(),
                "skippedTpgs", plan.skippedTpgs());
    }

    @PostMapping("/resume")
    public ResumeResponse resume(@RequestBody(required = false) InferenceRequest req) {
        InferenceRequest r = orEmpty(req);
        InferenceService.Resume resume = guarded(() -> inferenceService.resume(path(r.root()), r.dispatch()));
        return ResumeResponse.from(resume, r.dispatch());
    }

    @PostMapping("/aggregate")
    public Map<String, Object> aggregate(@RequestBody(required = false) InferenceRequest req) {
        InferenceRequest r = orEmpty(req);
        InferenceResultsAggregator.Summary summary =
                guarded(() -> inferenceService.aggregate(path(r.root()), path(r.outDir())));
        return Map.of(
                "rows", summary.perSeed().size(),
                "groups", summary.averaged().size(),
                "skipped", summary.skipped());
    }

    private static <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }

    private static InferenceRequest orEmpty(InferenceRequest req) {
        return req != null ? req : new InferenceRequest(null, null, null, null);
    }

    private static Path path(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
