package com.flow.canvas.service.graph;

import java.util.Objects;

/**
 * Sealed interface for the semantic kind of a transition between nodes.
 *
 * A node holds at most one edge per {@link #slotKey()}; declaring another edge
 * with the same slot key replaces the earlier one.
 */
public sealed interface EdgeKind permits
        EdgeKind.Sequential,
        EdgeKind.Conditional,
        EdgeKind.DefaultFallback,
        EdgeKind.ErrorHandler,
        EdgeKind.IntentBranch {

    EdgeKind SEQUENTIAL = new Sequential();
    EdgeKind DEFAULT_FALLBACK = new DefaultFallback();

    /**
     * Wire-level tag of each variant.
     */
    enum Type {
        SEQUENTIAL,
        CONDITIONAL,
        DEFAULT_FALLBACK,
        ERROR_HANDLER,
        INTENT_BRANCH
    }

    Type type();

    /**
     * Key identifying the outgoing slot this edge occupies on its source node.
     */
    String slotKey();

    /**
     * Payload of keyed kinds (comparison value, error type or intent name), null otherwise.
     */
    default String key() {
        return null;
    }

    /**
     * Whether the target of this edge fans out into a new row during layout.
     */
    default boolean isBranching() {
        return type() != Type.SEQUENTIAL;
    }

    // ==================== Factories ====================

    static EdgeKind sequential() {
        return SEQUENTIAL;
    }

    static EdgeKind defaultFallback() {
        return DEFAULT_FALLBACK;
    }

    static EdgeKind conditional(String key) {
        return new Conditional(key);
    }

    static EdgeKind errorHandler(String errorType) {
        return new ErrorHandler(errorType);
    }

    static EdgeKind intentBranch(String intentName) {
        return new IntentBranch(intentName);
    }

    /**
     * Builds a kind from its wire tag. The key is ignored for unkeyed kinds.
     *
     * @throws IllegalArgumentException if a keyed kind is given a blank key
     */
    static EdgeKind of(Type type, String key) {
        Objects.requireNonNull(type, "edge kind type is required");
        return switch (type) {
            case SEQUENTIAL -> sequential();
            case DEFAULT_FALLBACK -> defaultFallback();
            case CONDITIONAL -> conditional(key);
            case ERROR_HANDLER -> errorHandler(key);
            case INTENT_BRANCH -> intentBranch(key);
        };
    }

    private static String requireKey(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
        return value;
    }

    // ==================== Variants ====================

    record Sequential() implements EdgeKind {
        @Override
        public Type type() {
            return Type.SEQUENTIAL;
        }

        @Override
        public String slotKey() {
            return "sequential";
        }
    }

    record Conditional(String key) implements EdgeKind {
        public Conditional {
            EdgeKind.requireKey(key, "Conditional key");
        }

        @Override
        public Type type() {
            return Type.CONDITIONAL;
        }

        @Override
        public String slotKey() {
            return "conditional:" + key;
        }
    }

    record DefaultFallback() implements EdgeKind {
        @Override
        public Type type() {
            return Type.DEFAULT_FALLBACK;
        }

        @Override
        public String slotKey() {
            return "default";
        }
    }

    record ErrorHandler(String errorType) implements EdgeKind {
        public ErrorHandler {
            EdgeKind.requireKey(errorType, "ErrorHandler errorType");
        }

        @Override
        public Type type() {
            return Type.ERROR_HANDLER;
        }

        @Override
        public String slotKey() {
            return "error:" + errorType;
        }

        @Override
        public String key() {
            return errorType;
        }
    }

    record IntentBranch(String intentName) implements EdgeKind {
        public IntentBranch {
            EdgeKind.requireKey(intentName, "IntentBranch intentName");
        }

        @Override
        public Type type() {
            return Type.INTENT_BRANCH;
        }

        @Override
        public String slotKey() {
            return "intent:" + intentName;
        }

        @Override
        public String key() {
            return intentName;
        }
    }
}
