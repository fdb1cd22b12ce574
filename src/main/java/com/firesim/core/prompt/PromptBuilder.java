package com.firesim.core.prompt;

import com.firesim.core.model.GenerationRequest;

/**
 * Turns a scenario into one prompt per requested viewpoint. Pure; no I/O.
 */
public interface PromptBuilder {

    /**
     * @return prompts in request order, duplicates included
     * @throws PromptBuildException if the scenario cannot be rendered safely
     */
    PromptSet build(GenerationRequest request);
}
