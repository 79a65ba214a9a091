package com.tpgsweep.orchestrator.api;

import com.tpgsweep.orchestrator.api.dto.LaunchSweepRequest;
import com.tpgsweep.orchestrator.api.dto.SweepResponse;
import com.tpgsweep.orchestrator.api.dto.UnitResponse;
import com.tpgsweep.orchestrator.materialize.MaterializationException;
import com.tpgsweep.orchestrator.model.SweepRun;
import com.tpgsweep.orchestrator.service.CancelResult;
import com.tpgsweep.orchestrator.service.SweepService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for sweep lifecycle.
 *
 * POST   /sweeps           : expand, materialize and dispatch a new sweep
 * GET    /sweeps/{id}      : poll the state of a sweep
 * GET    /sweeps/{id}/units: list the experiment units with their state
 * DELETE /sweeps/{id}      : cancel a sweep (best effort on running jobs)
 */
@RestController
@RequestMapping("/sweeps")
public class SweepController {

    private final SweepService sweepService;

    public SweepController(SweepService sweepService) {
        this.sweepService = sweepService;
    }

    /**
     * Launch a sweep. Returns 400 for a malformed definition or a missing
     * trainer template, and 409 when a unit directory belongs to a sweep
     * still in flight; nothing is dispatched in those cases.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sweeps \
     *     -H "Content-Type: application/json" \
     *     -d '{"seedTo":2,"dataTypes":["double","int"],
     *          "instructionSets":[{"name":"base","flags":{"useInstrTrig":true}}]}'
     */
    @PostMapping
    public ResponseEntity<SweepResponse> launch(@RequestBody LaunchSweepRequest req) {
        SweepRun run;
        try {
            run = sweepService.launch(req.toDefinition());
        } catch (IllegalArgumentException | MaterializationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(SweepResponse.from(run));
    }

    @GetMapping("/{id}")
    public SweepResponse getSweep(@PathVariable UUID id) {
        return SweepResponse.from(find(id));
    }

    @GetMapping("/{id}/units")
    public List<UnitResponse> getUnits(@PathVariable UUID id) {
        return find(id).getUnits().stream()
                .map(UnitResponse::from)
                .toList();
    }

    /**
     * Cancel a sweep. Units not yet submitted are never started; running jobs
     * get a scheduler cancel, which the scheduler may not honour. A sweep
     * that has already finished answers 200 with its unchanged state.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID id) {
        CancelResult result = sweepService.cancel(id).orElseThrow(() -> notFound(id));
        return ResponseEntity.status(result.cancelled() ? HttpStatus.ACCEPTED : HttpStatus.OK)
                .body(Map.of("id", id.toString(),
                        "state", result.state().name(),
                        "jobsCancelled", result.jobsCancelled()));
    }

    private SweepRun find(UUID id) {
        return sweepService.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Sweep not found: " + id);
    }
}
