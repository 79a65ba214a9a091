package com.tpgsweep.orchestrator.api.dto;

/**
 * Request body for the /inference endpoints. Every field is optional.
 *
 * @param root     sweep root holding training_results; defaults to tpgsweep.root
 * @param mini     plan only: keep the first N configs of the whole plan
 * @param dispatch resume only: submit the missing runs, not just list them
 * @param outDir   aggregate only: where the CSV files go; defaults to the root
 */
public record InferenceRequest(String root, Integer mini, Boolean dispatch, String outDir) {

    public InferenceRequest {
        if (mini == null)     mini = 0;
        if (dispatch == null) dispatch = false;
    }
}
