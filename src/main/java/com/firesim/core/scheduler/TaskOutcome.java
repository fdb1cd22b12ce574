package com.firesim.core.scheduler;

/**
 * Settled result of one batch task: either a value or the error that ended it.
 *
 * @param index position of the task in the submitted list
 * @param task  the originating task, for attribution
 */
public record TaskOutcome<T, R>(int index, T task, R value, Throwable error) {

    public static <T, R> TaskOutcome<T, R> success(int index, T task, R value) {
        return new TaskOutcome<>(index, task, value, null);
    }

    public static <T, R> TaskOutcome<T, R> failure(int index, T task, Throwable error) {
        return new TaskOutcome<>(index, task, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
