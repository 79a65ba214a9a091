package com.tpgsweep.orchestrator.api.dto;

import com.tpgsweep.orchestrator.service.InferenceService;

import java.nio.file.Path;
import java.util.List;

/**
 * Response body for POST /inference/resume.
 */
public record ResumeResponse(
        int          expected,
        int          present,
        String       missingList,
        boolean      dispatched,
        List<String> missing
) {
    public static ResumeResponse from(InferenceService.Resume resume, boolean dispatched) {
        return new ResumeResponse(
                resume.plan().expected(),
                resume.plan().present(),
                resume.missingList().toString(),
                dispatched && !resume.plan().complete(),
                resume.plan().missing().stream().map(Path::toString).toList()
        );
    }
}
