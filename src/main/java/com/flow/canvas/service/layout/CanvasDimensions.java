package com.flow.canvas.service.layout;

/**
 * Bounding box of all placed blocks, including the size of one block.
 */
public record CanvasDimensions(int width, int height) {

    public static final CanvasDimensions EMPTY = new CanvasDimensions(0, 0);
}
