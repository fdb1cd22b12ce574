package com.firesim.core.postprocess;

import com.firesim.core.model.GenerationRequest;
import com.firesim.core.model.RunProgress;
import com.firesim.core.model.VegetationContext;
import com.firesim.core.prompt.PromptSet;

import java.time.Instant;
import java.util.List;

/**
 * Everything post-processing needs about a run that has already reached a terminal state.
 *
 * @param request            the request with its resolved seed
 * @param progress           terminal snapshot
 * @param modelResponses     free text the model returned per viewpoint
 * @param vegetationContext  nullable
 * @param consistencyReport  rendered report; nullable when the set was not scored
 * @param uploadedBytes      total image bytes written to the artifact store
 */
public record CompletedRun(
    String runId,
    GenerationRequest request,
    PromptSet promptSet,
    RunProgress progress,
    String modelId,
    String quality,
    List<ModelResponse> modelResponses,
    VegetationContext vegetationContext,
    String consistencyReport,
    long uploadedBytes,
    Instant finishedAt
) {

    public record ModelResponse(String viewpoint, String text) {}

    public CompletedRun {
        modelResponses = modelResponses != null ? List.copyOf(modelResponses) : List.of();
    }
}
