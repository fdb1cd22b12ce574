package com.firesim.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Camera perspective requested for a run.
 * <p>
 * Helicopter views are elevated oblique shots; ground views sit at eye level
 * roughly 500 metres from the fire front.
 */
public enum ViewPoint {
    AERIAL("aerial"),
    HELICOPTER_NORTH("helicopter_north"),
    HELICOPTER_SOUTH("helicopter_south"),
    HELICOPTER_EAST("helicopter_east"),
    HELICOPTER_WEST("helicopter_west"),
    HELICOPTER_ABOVE("helicopter_above"),
    GROUND_NORTH("ground_north"),
    GROUND_SOUTH("ground_south"),
    GROUND_EAST("ground_east"),
    GROUND_WEST("ground_west"),
    GROUND_ABOVE("ground_above"),
    RIDGE("ridge");

    private final String id;

    ViewPoint(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /** Vantage type: the id prefix before the first underscore (aerial, helicopter, ground, ridge). */
    public String category() {
        int idx = id.indexOf('_');
        return idx < 0 ? id : id.substring(0, idx);
    }

    public boolean isGroundLevel() {
        return "ground".equals(category());
    }

    @JsonCreator
    public static ViewPoint fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Viewpoint id is required");
        }
        for (var vp : values()) {
            if (vp.id.equalsIgnoreCase(id) || vp.name().equalsIgnoreCase(id)) {
                return vp;
            }
        }
        throw new IllegalArgumentException("Unknown viewpoint: " + id);
    }

    @Override
    public String toString() {
        return id;
    }
}
