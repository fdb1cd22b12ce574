package com.firesim.core.cost;

public record CostBreakdown(Images images, Storage storage, double totalCost) {

    public record Images(int count, double costPerImage, double totalCost) {}

    public record Storage(long sizeBytes, double costPerGb, double totalCost) {}
}
