package io.notebookhive.dispatcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * nbformat fixtures.
 */
public final class Notebooks {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Notebooks() {
    }

    public static ObjectNode notebook(ObjectNode... cells) {
        ObjectNode notebook = MAPPER.createObjectNode();
        notebook.put("nbformat", 4);
        notebook.put("nbformat_minor", 5);
        notebook.putObject("metadata");
        notebook.putArray("cells").addAll(List.of(cells));
        return notebook;
    }

    public static ObjectNode diagramCell(String kind, String source) {
        ObjectNode cell = cell("raw", source);
        ((ObjectNode) cell.get("metadata")).put("diagram", kind);
        return cell;
    }

    public static ObjectNode fencedCell(String tag, String content) {
        return cell("markdown", "```" + tag + "\n" + content + "\n```");
    }

    public static ObjectNode markdownCell(String source) {
        return cell("markdown", source);
    }

    public static ObjectNode codeCell(String source) {
        ObjectNode cell = cell("code", source);
        cell.putNull("execution_count");
        cell.putArray("outputs");
        return cell;
    }

    private static ObjectNode cell(String type, String source) {
        ObjectNode cell = MAPPER.createObjectNode();
        cell.put("cell_type", type);
        cell.putObject("metadata");
        cell.put("source", source);
        return cell;
    }
}
