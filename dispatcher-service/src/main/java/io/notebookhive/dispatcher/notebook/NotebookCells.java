package io.notebookhive.dispatcher.notebook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/**
 * nbformat helpers.
 */
final class NotebookCells {

    static final String CELLS = "cells";
    static final String CELL_TYPE = "cell_type";
    static final String SOURCE = "source";
    static final String METADATA = "metadata";

    private NotebookCells() {
    }

    static ArrayNode cells(JsonNode notebook) {
        if (notebook == null || !notebook.isObject()) {
            throw new MalformedNotebookException("notebook must be a JSON object");
        }
        JsonNode cells = notebook.get(CELLS);
        if (cells == null || !cells.isArray()) {
            throw new MalformedNotebookException("notebook has no 'cells' array");
        }
        for (int i = 0; i < cells.size(); i++) {
            if (!cells.get(i).isObject()) {
                throw new MalformedNotebookException("cell " + i + " is not a JSON object");
            }
        }
        return (ArrayNode) cells;
    }

    /**
     * Cell source joined into one string; nbformat allows a string or a list of lines.
     */
    static String source(JsonNode cell, int index) {
        JsonNode source = cell.get(SOURCE);
        if (source == null || source.isNull()) {
            return "";
        }
        if (source.isTextual()) {
            return source.asText();
        }
        if (source.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode line : source) {
                if (!line.isTextual()) {
                    throw new MalformedNotebookException("cell " + index + " has a non-text source line");
                }
                joined.append(line.asText());
            }
            return joined.toString();
        }
        throw new MalformedNotebookException("cell " + index + " source must be a string or a list of strings");
    }

    static String cellType(JsonNode cell) {
        return cell.path(CELL_TYPE).asText("");
    }
}
