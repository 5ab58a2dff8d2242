package com.flow.canvas.service.layout;

/**
 * Integer pixel coordinates of a block's top-left corner.
 */
public record NodePosition(int x, int y) {}
