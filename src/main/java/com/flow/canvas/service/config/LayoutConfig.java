package com.flow.canvas.service.config;

import com.flow.canvas.service.layout.LayoutSettings;
import com.flow.canvas.service.layout.RowCompaction;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the canvas layout.
 *
 * Pixel geometry of the grid; defaults match the contact-flow canvas.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow.layout")
public class LayoutConfig {

    /**
     * X position of the first column.
     */
    private int startX = LayoutSettings.DEFAULT_START_X;

    /**
     * Y position of the first row.
     */
    private int startY = LayoutSettings.DEFAULT_START_Y;

    /**
     * Pixels between columns (left edge to left edge).
     */
    private int horizontalSpacing = LayoutSettings.DEFAULT_HORIZONTAL_SPACING;

    /**
     * Minimum vertical spacing between rows.
     */
    private int verticalSpacingMin = LayoutSettings.DEFAULT_VERTICAL_SPACING_MIN;

    /**
     * Uniform block width, used for canvas dimensions.
     */
    private int blockWidth = LayoutSettings.DEFAULT_BLOCK_WIDTH;

    /**
     * Uniform block height.
     */
    private int blockHeight = LayoutSettings.DEFAULT_BLOCK_HEIGHT;

    /**
     * Row renumbering strategy.
     */
    private RowCompaction rowCompaction = RowCompaction.PER_LEVEL;

    public LayoutSettings toSettings() {
        return new LayoutSettings(startX, startY, horizontalSpacing, verticalSpacingMin,
                blockWidth, blockHeight, rowCompaction);
    }
}
