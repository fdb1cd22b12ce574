package com.firesim.core.prompt;

import com.firesim.core.model.ViewPoint;

import java.util.List;
import java.util.Optional;

public record PromptSet(List<ViewpointPrompt> prompts, String templateVersion) {

    public record ViewpointPrompt(ViewPoint viewpoint, String promptText) {}

    public PromptSet {
        prompts = List.copyOf(prompts);
    }

    /** Prompt at the given request position, if it was built for that viewpoint. */
    public Optional<String> promptAt(int position, ViewPoint viewpoint) {
        if (position >= 0 && position < prompts.size() && prompts.get(position).viewpoint() == viewpoint) {
            return Optional.of(prompts.get(position).promptText());
        }
        return promptFor(viewpoint);
    }

    public Optional<String> promptFor(ViewPoint viewpoint) {
        return prompts.stream()
                .filter(p -> p.viewpoint() == viewpoint)
                .map(ViewpointPrompt::promptText)
                .findFirst();
    }
}
