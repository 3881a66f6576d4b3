package io.notebookhive.dispatcher.notebook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.notebookhive.dispatcher.domain.BlockSnapshot;
import io.notebookhive.dispatcher.domain.DiagramBlock;
import io.notebookhive.dispatcher.domain.TerminalJob;
import java.util.Base64;

/**
 * Builds the output notebook of a finished job. Every diagram cell is replaced, at its original
 * index, by a markdown cell: an nbformat attachment with the rendered image when the block
 * succeeded, an error placeholder otherwise. All other cells are copied unchanged.
 */
public class ArtifactSplicer {

    static final String ATTACHMENTS = "attachments";
    static final String DIAGRAM_KIND_METADATA = "diagram_kind";
    static final String DIAGRAM_ERROR_METADATA = "diagram_error";

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    /**
     * @return a deep copy of the submitted notebook with the job's blocks spliced in, or
     *     {@code null} when the job carries no readable notebook
     */
    public ObjectNode splice(TerminalJob terminal) {
        JsonNode source = terminal.job().notebook();
        if (source == null || !source.isObject() || !source.path(NotebookCells.CELLS).isArray()) {
            return null;
        }
        ObjectNode output = ((ObjectNode) source).deepCopy();
        ArrayNode cells = (ArrayNode) output.get(NotebookCells.CELLS);
        for (BlockSnapshot snapshot : terminal.blocks()) {
            int index = snapshot.block().blockIndex();
            if (index >= cells.size()) {
                throw new IllegalStateException("block " + index + " is outside the notebook");
            }
            JsonNode original = cells.get(index);
            cells.set(index, snapshot.succeeded() ? imageCell(original, snapshot) : placeholderCell(original, snapshot));
        }
        return output;
    }

    private ObjectNode imageCell(JsonNode original, BlockSnapshot snapshot) {
        DiagramBlock block = snapshot.block();
        String name = block.kind().wireName() + "-" + block.blockIndex() + "." + extension(snapshot.mimeType());
        ObjectNode cell = markdownCell(original, block);
        cell.put(NotebookCells.SOURCE, "![" + block.kind().wireName() + " diagram](attachment:" + name + ")");
        ObjectNode bundle = nodes.objectNode();
        bundle.put(snapshot.mimeType(), Base64.getEncoder().encodeToString(snapshot.artifact()));
        cell.putObject(ATTACHMENTS).set(name, bundle);
        return cell;
    }

    private ObjectNode placeholderCell(JsonNode original, BlockSnapshot snapshot) {
        DiagramBlock block = snapshot.block();
        ObjectNode cell = markdownCell(original, block);
        cell.put(NotebookCells.SOURCE, "> **Diagram conversion failed** (%s, block %d): %s"
            .formatted(block.kind().wireName(), block.blockIndex(), snapshot.failureReason()));
        ((ObjectNode) cell.get(NotebookCells.METADATA)).put(DIAGRAM_ERROR_METADATA, true);
        return cell;
    }

    /**
     * Markdown cell keeping the original id and metadata. The {@code diagram} marker moves to
     * {@code diagram_kind} so the output is not picked up as a diagram again.
     */
    private ObjectNode markdownCell(JsonNode original, DiagramBlock block) {
        ObjectNode cell = nodes.objectNode();
        if (original.hasNonNull("id")) {
            cell.set("id", original.get("id").deepCopy());
        }
        cell.put(NotebookCells.CELL_TYPE, "markdown");
        JsonNode metadata = original.get(NotebookCells.METADATA);
        ObjectNode copy = metadata != null && metadata.isObject() ? ((ObjectNode) metadata).deepCopy() : nodes.objectNode();
        copy.remove(DiagramBlockExtractor.DIAGRAM_METADATA);
        copy.put(DIAGRAM_KIND_METADATA, block.kind().wireName());
        cell.set(NotebookCells.METADATA, copy);
        return cell;
    }

    static String extension(String mimeType) {
        if (mimeType == null) {
            return "bin";
        }
        return switch (mimeType) {
            case "image/png" -> "png";
            case "image/svg+xml" -> "svg";
            case "image/jpeg" -> "jpg";
            case "application/pdf" -> "pdf";
            default -> "bin";
        };
    }
}
