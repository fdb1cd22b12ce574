package com.firesim.core.prompt;

public class PromptBuildException extends RuntimeException {

    public PromptBuildException(String message) {
        super(message);
    }
}
