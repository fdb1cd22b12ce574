package com.firesim.core.postprocess;

import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Renders the human-readable markdown log stored next to a run's images.
 */
@Component
public class GenerationLogWriter {

    public String render(CompletedRun run) {
        var progress = run.progress();
        var sb = new StringBuilder();
        sb.append("# Generation Log: ").append(run.runId()).append("\n\n");
        sb.append("- **Status:** ").append(progress.getStatus().wireValue()).append('\n');
        sb.append("- **Model:** ").append(run.modelId()).append('\n');
        sb.append("- **Seed:** ").append(progress.getSeed() != null ? progress.getSeed() : "none").append('\n');
        sb.append("- **Template version:** ").append(run.promptSet() != null ? run.promptSet().templateVersion() : "n/a").append('\n');
        sb.append("- **Timestamp:** ").append(run.finishedAt()).append('\n');
        if (progress.getCreatedAt() != null) {
            sb.append("- **Duration:** ")
                    .append(Duration.between(progress.getCreatedAt(), run.finishedAt()).toMillis())
                    .append(" ms\n");
        }
        sb.append("- **Images:** ").append(progress.getCompletedImages()).append(" succeeded, ")
                .append(progress.getFailedImages()).append(" failed of ")
                .append(progress.getTotalImages()).append('\n');
        sb.append("- **Vegetation map screenshot:** ")
                .append(run.request().vegetationMapScreenshot() != null ? "yes" : "no").append("\n\n");

        if (run.vegetationContext() != null) {
            sb.append("## Vegetation Context\n\n")
                    .append(run.vegetationContext().toPromptText()).append("\n\n");
        }

        sb.append("## Prompts\n\n");
        if (run.promptSet() != null) {
            for (var prompt : run.promptSet().prompts()) {
                sb.append("### ").append(prompt.viewpoint().id()).append("\n\n")
                        .append("```\n").append(prompt.promptText()).append("\n```\n\n");
            }
        }

        if (progress.getThinkingText() != null && !progress.getThinkingText().isBlank()) {
            sb.append("## Model Thinking\n\n").append(progress.getThinkingText()).append("\n\n");
        }

        var responses = run.modelResponses().stream()
                .filter(r -> r.text() != null && !r.text().isBlank())
                .toList();
        if (!responses.isEmpty()) {
            sb.append("## Model Responses\n\n");
            for (var response : responses) {
                sb.append("- **").append(response.viewpoint()).append(":** ").append(response.text()).append('\n');
            }
            sb.append('\n');
        }

        if (run.consistencyReport() != null) {
            sb.append("## Consistency\n\n```\n").append(run.consistencyReport()).append("\n```\n\n");
        }

        if (progress.getError() != null) {
            sb.append("## Errors\n\n").append(progress.getError()).append('\n');
        }
        return sb.toString();
    }
}
