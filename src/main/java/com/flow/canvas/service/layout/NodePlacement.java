package com.flow.canvas.service.layout;

/**
 * Final grid cell and pixel position of one node.
 *
 * @param nodeId node identifier
 * @param level  column index (hop distance from entry, or the fallback level for orphans)
 * @param row    row index within the column after compaction and collision resolution
 * @param x      pixel x
 * @param y      pixel y
 */
public record NodePlacement(
        String nodeId,
        int level,
        int row,
        int x,
        int y
) {

    public NodePosition position() {
        return new NodePosition(x, y);
    }
}
