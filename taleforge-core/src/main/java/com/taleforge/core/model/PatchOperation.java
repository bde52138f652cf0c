package com.taleforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One primitive state mutation. Paths use JSON-pointer syntax
 * rooted at the state document, e.g. {@code /party/player/hp/current}.
 * A null value means the value field was absent.
 */
public sealed interface PatchOperation {

    String OP_REPLACE = "replace";
    String OP_ADD = "add";
    String OP_REMOVE = "remove";
    String OP_ADVANCE_TIME = "advance_time";

    /**
     * Wire name of the operation.
     */
    String op();

    /**
     * Target path, or null for operations that have none.
     */
    String path();

    record Replace(String path, JsonNode value) implements PatchOperation {
        @Override
        public String op() {
            return OP_REPLACE;
        }
    }

    /**
     * Insert into a list (index or "-" to append) or set an object key.
     */
    record Add(String path, JsonNode value) implements PatchOperation {
        @Override
        public String op() {
            return OP_ADD;
        }
    }

    record Remove(String path) implements PatchOperation {
        @Override
        public String op() {
            return OP_REMOVE;
        }
    }

    record AdvanceTime(TimeDelta delta) implements PatchOperation {
        @Override
        public String op() {
            return OP_ADVANCE_TIME;
        }

        @Override
        public String path() {
            return null;
        }
    }

    /**
     * An operation with a missing or unknown op name.
     */
    record Unrecognized(String op, String path, JsonNode raw) implements PatchOperation {
    }
}
