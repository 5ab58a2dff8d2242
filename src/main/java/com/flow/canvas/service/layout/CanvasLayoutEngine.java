package com.flow.canvas.service.layout;

import com.flow.canvas.service.graph.FlowEdge;
import com.flow.canvas.service.graph.FlowGraph;
import com.flow.canvas.service.graph.FlowNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Positions flow nodes on the canvas using a layered BFS grid.
 *
 * Columns are BFS levels from the entry node; rows fan out within a column.
 * Sequential transitions continue horizontally on the discoverer's row,
 * every branching transition opens a new row below it.
 *
 * Phases:
 * 1. level and row assignment (single BFS in edge declaration order)
 * 2. fallback placement of nodes unreachable from the entry
 * 3. row compaction
 * 4. pixel conversion
 * 5. collision resolution (push later blocks down one row until free)
 *
 * Stateless and immutable; a single instance may serve concurrent passes.
 */
@Slf4j
public class CanvasLayoutEngine {

    private final LayoutSettings settings;

    public CanvasLayoutEngine() {
        this(LayoutSettings.defaults());
    }

    public CanvasLayoutEngine(LayoutSettings settings) {
        this.settings = settings;
    }

    public LayoutSettings getSettings() {
        return settings;
    }

    // ==================== Public API ====================

    /**
     * Calculates a position for every node of the graph.
     *
     * @return node id to position, iterating in placement order
     * @throws com.flow.canvas.service.graph.MissingEntryException if the graph has no entry
     */
    public Map<String, NodePosition> calculatePositions(FlowGraph graph) {
        return layout(graph).positions();
    }

    /**
     * Runs all layout phases and returns placements with grid cells and canvas size.
     */
    public CanvasLayout layout(FlowGraph graph) {
        var entryId = graph.requireEntry();
        log.debug("Laying out graph: entry={}, nodes={}, edges={}",
                entryId, graph.nodeCount(), graph.edgeCount());

        var cells = assignLevelsAndRows(graph, entryId);
        placeUnreachable(graph, cells);
        compactRows(cells.values());
        int collisions = resolveCollisions(cells.values());

        var placements = toPlacements(cells.values());
        var layout = new CanvasLayout(placements, measureCanvas(placements), collisions);

        logLayout(layout);
        return layout;
    }

    // ==================== Level & Row Assignment ====================

    private Map<String, GridCell> assignLevelsAndRows(FlowGraph graph, String entryId) {
        var cells = new LinkedHashMap<String, GridCell>();
        var usedRows = new HashMap<Integer, Set<Integer>>();
        var queue = new ArrayDeque<String>();

        place(cells, usedRows, entryId, 0, 0);
        queue.add(entryId);

        while (!queue.isEmpty()) {
            var current = cells.get(queue.poll());
            for (var edge : graph.outgoingEdges(current.nodeId)) {
                if (discover(cells, usedRows, current, edge)) {
                    queue.add(edge.targetId());
                }
            }
        }

        log.debug("BFS reached {} of {} nodes", cells.size(), graph.nodeCount());
        return cells;
    }

    /**
     * Places the target of an edge on first discovery; later discoveries are no-ops.
     */
    private boolean discover(Map<String, GridCell> cells, Map<Integer, Set<Integer>> usedRows,
                             GridCell discoverer, FlowEdge edge) {
        if (cells.containsKey(edge.targetId())) {
            return false;
        }

        int level = discoverer.level + 1;
        int row = edge.kind().isBranching()
                ? nextFreeRow(usedRows, level, discoverer.row)
                : discoverer.row;

        place(cells, usedRows, edge.targetId(), level, row);
        return true;
    }

    private int nextFreeRow(Map<Integer, Set<Integer>> usedRows, int level, int fromRow) {
        var used = usedRows.getOrDefault(level, Set.of());
        int row = fromRow;
        while (used.contains(row)) {
            row++;
        }
        return row;
    }

    private void place(Map<String, GridCell> cells, Map<Integer, Set<Integer>> usedRows,
                       String nodeId, int level, int row) {
        cells.put(nodeId, new GridCell(nodeId, level, row));
        usedRows.computeIfAbsent(level, k -> new HashSet<>()).add(row);
    }

    // ==================== Unreachable Nodes ====================

    /**
     * Orphans share one column right of the deepest level, one row each.
     */
    private void placeUnreachable(FlowGraph graph, Map<String, GridCell> cells) {
        var orphans = graph.nodes().stream()
                .map(FlowNode::id)
                .filter(id -> !cells.containsKey(id))
                .toList();
        if (orphans.isEmpty()) {
            return;
        }

        int fallbackLevel = maxLevel(cells.values()) + 1;
        int row = 0;
        for (var orphanId : orphans) {
            cells.put(orphanId, new GridCell(orphanId, fallbackLevel, row++));
        }
        log.debug("Placed {} unreachable nodes at fallback level {}", orphans.size(), fallbackLevel);
    }

    private int maxLevel(Collection<GridCell> cells) {
        return cells.stream()
                .mapToInt(cell -> cell.level)
                .max()
                .orElse(-1);
    }

    // ==================== Compaction ====================

    private void compactRows(Collection<GridCell> cells) {
        switch (settings.rowCompaction()) {
            case PER_LEVEL -> cells.stream()
                    .collect(Collectors.groupingBy(cell -> cell.level))
                    .values()
                    .forEach(this::renumberRows);
            case GLOBAL -> renumberRows(cells);
        }
    }

    /**
     * Renumbers the rows of the given cells to 0..n-1, preserving relative order.
     */
    private void renumberRows(Collection<GridCell> cells) {
        var distinctRows = cells.stream()
                .map(cell -> cell.row)
                .collect(Collectors.toCollection(TreeSet::new));

        var compacted = new HashMap<Integer, Integer>();
        for (var row : distinctRows) {
            compacted.put(row, compacted.size());
        }
        cells.forEach(cell -> cell.row = compacted.get(cell.row));
    }

    // ==================== Collision Resolution ====================

    /**
     * Walks cells in placement order; a cell landing on an occupied position
     * is pushed down one row at a time until its position is free.
     *
     * @return number of single-row pushes applied
     */
    private int resolveCollisions(Collection<GridCell> cells) {
        var occupied = new HashSet<NodePosition>();
        int pushes = 0;

        for (var cell : cells) {
            while (occupied.contains(positionOf(cell))) {
                cell.row++;
                pushes++;
            }
            occupied.add(positionOf(cell));
        }

        if (pushes > 0) {
            log.debug("Resolved block collisions with {} row pushes", pushes);
        }
        return pushes;
    }

    // ==================== Pixel Conversion ====================

    private NodePosition positionOf(GridCell cell) {
        return new NodePosition(settings.xForLevel(cell.level), settings.yForRow(cell.row));
    }

    private List<NodePlacement> toPlacements(Collection<GridCell> cells) {
        var placements = new ArrayList<NodePlacement>(cells.size());
        for (var cell : cells) {
            var position = positionOf(cell);
            placements.add(new NodePlacement(cell.nodeId, cell.level, cell.row, position.x(), position.y()));
        }
        return placements;
    }

    private CanvasDimensions measureCanvas(List<NodePlacement> placements) {
        if (placements.isEmpty()) {
            return CanvasDimensions.EMPTY;
        }
        int width = span(placements, NodePlacement::x) + settings.blockWidth();
        int height = span(placements, NodePlacement::y) + settings.blockHeight();
        return new CanvasDimensions(width, height);
    }

    private int span(List<NodePlacement> placements, ToIntFunction<NodePlacement> coordinate) {
        var stats = placements.stream()
                .mapToInt(coordinate)
                .summaryStatistics();
        return stats.getMax() - stats.getMin();
    }

    // ==================== Logging ====================

    private void logLayout(CanvasLayout layout) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Blocks positioned: {}", layout.placements().size());
        log.debug("Canvas size: {}px x {}px", layout.canvas().width(), layout.canvas().height());
        log.debug("Layout: {} columns, {} rows", layout.columnCount(), layout.rowCount());
    }

    // ==================== Inner Types ====================

    /**
     * Mutable grid cell used while the phases run.
     */
    private static final class GridCell {
        private final String nodeId;
        private final int level;
        private int row;

        private GridCell(String nodeId, int level, int row) {
            this.nodeId = nodeId;
            this.level = level;
            this.row = row;
        }
    }
}
