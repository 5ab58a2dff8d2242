package com.flow.canvas.service.layout;

/**
 * Immutable pixel geometry for the canvas layout.
 *
 * Canvas X grows to the right and Y grows downwards; positions denote the
 * top-left corner of a block. All blocks share one size.
 */
public record LayoutSettings(
        int startX,
        int startY,
        int horizontalSpacing,
        int verticalSpacingMin,
        int blockWidth,
        int blockHeight,
        RowCompaction rowCompaction
) {

    public static final int DEFAULT_START_X = 150;
    public static final int DEFAULT_START_Y = 50;
    public static final int DEFAULT_HORIZONTAL_SPACING = 280;
    public static final int DEFAULT_VERTICAL_SPACING_MIN = 180;
    public static final int DEFAULT_BLOCK_WIDTH = 200;
    public static final int DEFAULT_BLOCK_HEIGHT = 100;

    public LayoutSettings {
        if (horizontalSpacing <= 0 || verticalSpacingMin <= 0) {
            throw new IllegalArgumentException("layout spacing must be positive");
        }
        if (blockWidth <= 0 || blockHeight <= 0) {
            throw new IllegalArgumentException("block size must be positive");
        }
        if (rowCompaction == null) {
            rowCompaction = RowCompaction.PER_LEVEL;
        }
    }

    public static LayoutSettings defaults() {
        return new LayoutSettings(
                DEFAULT_START_X,
                DEFAULT_START_Y,
                DEFAULT_HORIZONTAL_SPACING,
                DEFAULT_VERTICAL_SPACING_MIN,
                DEFAULT_BLOCK_WIDTH,
                DEFAULT_BLOCK_HEIGHT,
                RowCompaction.PER_LEVEL
        );
    }

    public LayoutSettings withRowCompaction(RowCompaction compaction) {
        return new LayoutSettings(startX, startY, horizontalSpacing, verticalSpacingMin,
                blockWidth, blockHeight, compaction);
    }

    /**
     * Distance between consecutive rows.
     */
    public int verticalSpacing() {
        return Math.max(verticalSpacingMin, blockHeight);
    }

    public int xForLevel(int level) {
        return startX + level * horizontalSpacing;
    }

    public int yForRow(int row) {
        return startY + row * verticalSpacing();
    }
}
