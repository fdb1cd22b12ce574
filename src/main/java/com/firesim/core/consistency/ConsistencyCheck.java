package com.firesim.core.consistency;

/**
 * @param score 0..100
 */
public record ConsistencyCheck(String name, boolean passed, int score, String message) {}
