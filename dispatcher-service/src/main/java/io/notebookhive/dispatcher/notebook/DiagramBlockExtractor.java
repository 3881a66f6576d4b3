package io.notebookhive.dispatcher.notebook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.notebookhive.dispatcher.domain.DiagramBlock;
import io.notebookhive.topology.DiagramKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the diagram cells of a notebook, in cell order.
 * <p>
 * A cell is a diagram when its {@code metadata.diagram} names a known kind (the whole source is
 * the diagram), or when it is a markdown or raw cell consisting of exactly one fenced block
 * tagged with a known kind (the fenced content is the diagram). The notebook is never modified.
 */
public class DiagramBlockExtractor {

    static final String DIAGRAM_METADATA = "diagram";

    private static final Pattern FENCED_BLOCK =
        Pattern.compile("\\A```[ \\t]*([A-Za-z0-9_-]+)[ \\t]*\\r?\\n(.*?)\\r?\\n```\\z", Pattern.DOTALL);
    private static final Pattern INNER_FENCE = Pattern.compile("(?m)^```");

    private final Supplier<String> correlationIds;

    public DiagramBlockExtractor() {
        this(() -> UUID.randomUUID().toString());
    }

    public DiagramBlockExtractor(Supplier<String> correlationIds) {
        this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds");
    }

    /**
     * @throws MalformedNotebookException when the document is not an nbformat notebook
     */
    public List<DiagramBlock> extract(String jobId, JsonNode notebook) {
        ArrayNode cells = NotebookCells.cells(notebook);
        List<DiagramBlock> blocks = new ArrayList<>();
        for (int index = 0; index < cells.size(); index++) {
            JsonNode cell = cells.get(index);
            String source = NotebookCells.source(cell, index);
            JsonNode declared = cell.path(NotebookCells.METADATA).get(DIAGRAM_METADATA);
            Optional<DiagramKind> kind;
            if (declared != null && declared.isTextual()) {
                // an explicit declaration wins, even when it names a kind nobody renders
                kind = DiagramKind.fromWireName(declared.asText());
            } else {
                Optional<Fence> fence = fence(cell, source);
                if (fence.isEmpty()) {
                    continue;
                }
                kind = DiagramKind.fromWireName(fence.get().tag());
                source = fence.get().content();
            }
            if (kind.isPresent()) {
                blocks.add(new DiagramBlock(jobId, index, kind.get(), source, correlationIds.get()));
            }
        }
        return blocks;
    }

    private static Optional<Fence> fence(JsonNode cell, String source) {
        String type = NotebookCells.cellType(cell);
        if (!"markdown".equals(type) && !"raw".equals(type)) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_BLOCK.matcher(source.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String content = matcher.group(2);
        if (INNER_FENCE.matcher(content).find()) {
            return Optional.empty();
        }
        return Optional.of(new Fence(matcher.group(1), content));
    }

    private record Fence(String tag, String content) {
    }
}
