package com.firesim.core.engine;

import com.firesim.core.model.ViewPoint;
import com.firesim.provider.ImageGenOptions;

/**
 * One derived viewpoint waiting to be generated. Never persisted.
 *
 * @param position   index of the viewpoint in the capped request list
 * @param promptText nullable when the prompt builder produced nothing for this position
 */
public record GenerationTask(int position, ViewPoint viewPoint, String promptText, ImageGenOptions options) {}
