package com.flow.canvas.service.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one layout pass.
 *
 * @param placements         one placement per node, in placement order
 * @param canvas             bounding box of the placed blocks
 * @param collisionsResolved number of one-row push-downs applied to separate overlapping blocks
 */
public record CanvasLayout(
        List<NodePlacement> placements,
        CanvasDimensions canvas,
        int collisionsResolved
) {

    public CanvasLayout {
        placements = List.copyOf(placements);
    }

    /**
     * Node id to position, iterating in placement order.
     */
    public Map<String, NodePosition> positions() {
        var positions = new LinkedHashMap<String, NodePosition>();
        placements.forEach(p -> positions.put(p.nodeId(), p.position()));
        return Collections.unmodifiableMap(positions);
    }

    public Optional<NodePlacement> placement(String nodeId) {
        return placements.stream()
                .filter(p -> p.nodeId().equals(nodeId))
                .findFirst();
    }

    public int columnCount() {
        return (int) placements.stream().mapToInt(NodePlacement::x).distinct().count();
    }

    public int rowCount() {
        return (int) placements.stream().mapToInt(NodePlacement::y).distinct().count();
    }
}
