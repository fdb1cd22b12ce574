package com.firesim.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable lifecycle record of one run.
 * <p>
 * Only the orchestrator executing the run mutates an instance, and only through
 * the progress store. Readers always receive a {@link #copy()}. The setters exist
 * for JSON rehydration; runtime code goes through the guarded transition methods.
 */
public class RunProgress {

    private String runId;
    private RunStatus status = RunStatus.PENDING;
    private int totalImages;
    private int completedImages;
    private int failedImages;
    private List<GeneratedImage> images = new ArrayList<>();
    private GeneratedImage anchorImage;
    private Integer seed;
    private String error;
    private String thinkingText;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public RunProgress() {
    }

    public static RunProgress pending(String runId, int totalImages, Integer seed, Instant now) {
        var progress = new RunProgress();
        progress.runId = runId;
        progress.totalImages = totalImages;
        progress.seed = seed;
        progress.createdAt = now;
        progress.updatedAt = now;
        return progress;
    }

    /**
     * Moves the run forward. Allowed: pending to in_progress, in_progress to completed or failed.
     */
    public void transitionTo(RunStatus next, Instant now) {
        boolean allowed = switch (status) {
            case PENDING -> next == RunStatus.IN_PROGRESS;
            case IN_PROGRESS -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
        if (!allowed) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + status + " to " + next);
        }
        status = next;
        updatedAt = now;
        if (next.isTerminal()) {
            completedAt = now;
        }
    }

    /**
     * Records a successful image. Anchor images are also kept in {@link #getAnchorImage()}.
     */
    public void recordImage(GeneratedImage image, boolean anchor, Instant now) {
        requireOpenSlot();
        images.add(image);
        if (anchor) {
            anchorImage = image;
        }
        completedImages++;
        updatedAt = now;
    }

    public void recordFailure(Instant now) {
        requireOpenSlot();
        failedImages++;
        updatedAt = now;
    }

    /** Appends to the error text, separated by a blank line from anything already there. */
    public void appendError(String message, Instant now) {
        if (message == null || message.isBlank()) {
            return;
        }
        error = error == null || error.isBlank() ? message : error + "\n\n" + message;
        updatedAt = now;
    }

    public void updateThinking(String text, Instant now) {
        requireNotTerminal();
        thinkingText = text;
        updatedAt = now;
    }

    private void requireOpenSlot() {
        requireNotTerminal();
        if (completedImages + failedImages >= totalImages) {
            throw new IllegalStateException("Run " + runId + " already accounted for all "
                    + totalImages + " images");
        }
    }

    private void requireNotTerminal() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is " + status.wireValue() + " and frozen");
        }
    }

    @JsonIgnore
    public boolean allFailed() {
        return totalImages > 0 && failedImages == totalImages;
    }

    @JsonIgnore
    public boolean isPartialSuccess() {
        return completedImages > 0 && failedImages > 0;
    }

    public RunProgress copy() {
        var c = new RunProgress();
        c.runId = runId;
        c.status = status;
        c.totalImages = totalImages;
        c.completedImages = completedImages;
        c.failedImages = failedImages;
        c.images = new ArrayList<>(images);
        c.anchorImage = anchorImage;
        c.seed = seed;
        c.error = error;
        c.thinkingText = thinkingText;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.completedAt = completedAt;
        return c;
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }
    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }
    public int getTotalImages() { return totalImages; }
    public void setTotalImages(int totalImages) { this.totalImages = totalImages; }
    public int getCompletedImages() { return completedImages; }
    public void setCompletedImages(int completedImages) { this.completedImages = completedImages; }
    public int getFailedImages() { return failedImages; }
    public void setFailedImages(int failedImages) { this.failedImages = failedImages; }
    public List<GeneratedImage> getImages() { return images; }
    public void setImages(List<GeneratedImage> images) { this.images = images != null ? new ArrayList<>(images) : new ArrayList<>(); }
    public GeneratedImage getAnchorImage() { return anchorImage; }
    public void setAnchorImage(GeneratedImage anchorImage) { this.anchorImage = anchorImage; }
    public Integer getSeed() { return seed; }
    public void setSeed(Integer seed) { this.seed = seed; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public String getThinkingText() { return thinkingText; }
    public void setThinkingText(String thinkingText) { this.thinkingText = thinkingText; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
}
