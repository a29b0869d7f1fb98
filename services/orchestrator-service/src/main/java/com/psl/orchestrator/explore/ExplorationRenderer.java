package com.psl.orchestrator.explore;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.ItemMapper;
import com.psl.orchestrator.backend.graph.GraphStrategy;
import com.psl.orchestrator.query.QueryParams;
import com.psl.orchestrator.summarize.MetadataFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Markdown views of graph exploration records.
 */
public final class ExplorationRenderer {
    static final int SAMPLE_SIZE = 3;
    static final int ABSTRACT_PREVIEW = 200;

    private ExplorationRenderer() {
    }

    public static String render(GraphStrategy strategy, QueryParams params, List<JsonNode> records, int maxHops) {
        switch (strategy) {
            case CITATION_CHAIN:
                return citationChain(params.getPaperId(), records, maxHops);
            case INFLUENCE:
                return influence(params.getField(), records);
            case RELATED:
                return related(params.getPaperId(), records);
            case COLLABORATION:
                return collaboration(params.getAuthor(), records, maxHops);
            case CONCEPT_NETWORK:
                return conceptNetwork(params.getConcept(), records, maxHops);
            case TEMPORAL:
                return temporal(params, records);
            case VENUE:
                return venues(params.getField(), records);
            default:
                return generic(strategy, records);
        }
    }

    public static String similar(Item reference, List<Item> items) {
        List<String> out = new ArrayList<>();
        out.add("# Papers Similar to: " + (reference.getTitle() == null ? reference.getId() : reference.getTitle()));
        out.add("");
        out.add("**Reference ID**: " + reference.getId());
        out.add("");
        out.add("Found " + items.size() + " semantically similar papers:");
        out.add("");
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            out.add("## " + (i + 1) + ". " + orDefault(item.getTitle(), "Untitled"));
            out.add("- **Authors**: " + (item.getAuthors().isEmpty() ? "Unknown authors" : String.join(", ", item.getAuthors())));
            out.add("- **Year**: " + (item.getYear() == null ? "N/A" : item.getYear()));
            out.add("- **Item ID**: `" + item.getId() + "`");
            if (item.getRawScore() != null) {
                out.add(String.format(Locale.ROOT, "- **Similarity Score**: %.3f", item.getRawScore()));
            }
            String abstractText = MetadataFormatter.abstractOf(item);
            if (abstractText != null) {
                out.add("- **Abstract**: " + preview(abstractText));
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String citationChain(String paperId, List<JsonNode> records, int maxHops) {
        List<String> out = header("Citation Chain for " + paperId,
            "Found " + records.size() + " papers in citation network (max " + maxHops + " hops):");
        for (JsonNode record : records) {
            int hops = record.path("citation_hops").asInt(0);
            out.add("## " + titleYear(record));
            out.add("- **ID**: " + idOf(record));
            out.add("- **Citation Distance**: " + hops + " hop" + (hops == 1 ? "" : "s"));
            List<String> path = texts(record.path("citation_path"));
            if (!path.isEmpty()) {
                String shown = String.join(" -> ", path.subList(0, Math.min(SAMPLE_SIZE, path.size())));
                out.add("- **Citation Path**: " + shown + (path.size() > SAMPLE_SIZE ? "..." : ""));
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String influence(String field, List<JsonNode> records) {
        List<String> out = header("Seminal Papers " + fieldLabel(field),
            "Top " + records.size() + " most influential papers by citation analysis:");
        int i = 1;
        for (JsonNode record : records) {
            out.add("## " + i++ + ". " + titleYear(record));
            out.add("- **ID**: " + idOf(record));
            out.add(String.format(Locale.ROOT, "- **Influence Score**: %.2f", record.path("influence_score").asDouble(0.0)));
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String related(String paperId, List<JsonNode> records) {
        List<String> out = header("Papers Related to " + paperId,
            "Found " + records.size() + " papers connected through shared entities:");
        for (JsonNode record : records) {
            out.add("## " + titleYear(record));
            out.add("- **ID**: " + idOf(record));
            List<String> shared = texts(record.path("shared_entities"));
            if (!shared.isEmpty()) {
                out.add("- **Shared Entities**: " + String.join(", ", sample(shared)));
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String collaboration(String author, List<JsonNode> records, int maxHops) {
        List<String> out = header("Collaborator Network for '" + author + "'",
            "Found " + records.size() + " collaborators (max " + maxHops + " hops):");
        for (JsonNode record : records) {
            int hops = record.path("collaboration_hops").asInt(0);
            out.add("## " + orDefault(ItemMapper.readText(record, "author"), "Unknown"));
            out.add("- **Collaboration Distance**: " + hops + " hop" + (hops == 1 ? "" : "s"));
            out.add("- **Shared Papers**: " + record.path("collaboration_count").asInt(0));
            List<String> papers = texts(record.path("sample_papers"));
            if (!papers.isEmpty()) {
                out.add("- **Sample Collaborations**:");
                for (String paper : sample(papers)) {
                    out.add("  - " + paper);
                }
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String conceptNetwork(String concept, List<JsonNode> records, int maxHops) {
        List<String> out = header("Related Concepts for '" + concept + "'",
            "Found " + records.size() + " related concepts (max " + maxHops + " hops):");
        for (JsonNode record : records) {
            int hops = record.path("concept_hops").asInt(0);
            out.add("## " + orDefault(ItemMapper.readText(record, "concept"), "Unknown"));
            out.add("- **Relationship Distance**: " + hops + " hop" + (hops == 1 ? "" : "s"));
            out.add("- **Shared Papers**: " + record.path("shared_papers").asInt(0));
            List<String> papers = texts(record.path("sample_papers"));
            if (!papers.isEmpty()) {
                out.add("- **Sample Papers**: " + String.join(", ", sample(papers)));
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String temporal(QueryParams params, List<JsonNode> records) {
        List<String> out = header(
            "Evolution of '" + params.getConcept() + "' (" + params.getStartYear() + "-" + params.getEndYear() + ")",
            "Yearly breakdown across " + records.size() + " years:");
        for (JsonNode record : records) {
            out.add("## " + record.path("year").asText("N/A"));
            out.add("- **Papers**: " + record.path("paper_count").asInt(0));
            List<String> papers = texts(record.path("sample_papers"));
            if (!papers.isEmpty()) {
                out.add("- **Sample Titles**: " + String.join("; ", sample(papers)));
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String venues(String field, List<JsonNode> records) {
        List<String> out = header("Top Publication Venues " + fieldLabel(field),
            "Found " + records.size() + " top venues by publication count:");
        int i = 1;
        for (JsonNode record : records) {
            out.add("## " + i++ + ". " + orDefault(ItemMapper.readText(record, "venue"), "Unknown"));
            out.add("- **Papers**: " + record.path("paper_count").asInt(0));
            List<String> papers = texts(record.path("sample_papers"));
            if (!papers.isEmpty()) {
                out.add("- **Sample Titles**:");
                for (String paper : sample(papers)) {
                    out.add("  - " + paper);
                }
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    private static String generic(GraphStrategy strategy, List<JsonNode> records) {
        List<String> out = header("Graph Exploration (" + strategy.wireName() + ")",
            "Found " + records.size() + " records:");
        for (JsonNode record : records) {
            out.add("- " + titleYear(record) + " `" + idOf(record) + "`");
        }
        return String.join("\n", out);
    }

    private static List<String> header(String title, String summary) {
        List<String> out = new ArrayList<>();
        out.add("# " + title);
        out.add("");
        out.add(summary);
        out.add("");
        return out;
    }

    private static String titleYear(JsonNode record) {
        String title = orDefault(ItemMapper.readText(record, "title"), "Unknown");
        String year = orDefault(ItemMapper.readText(record, "year"), "N/A");
        return title + " (" + year + ")";
    }

    private static String idOf(JsonNode record) {
        String id = ItemMapper.readText(record, "id");
        if (id == null) {
            id = ItemMapper.readText(record, "item_key");
        }
        return orDefault(id, "");
    }

    private static String fieldLabel(String field) {
        return field == null ? "Across All Fields" : "in Field: " + field;
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode node : array) {
                if (node.isTextual() && !node.asText().isBlank()) {
                    values.add(node.asText());
                } else if (node.isObject()) {
                    String title = ItemMapper.readText(node, "title");
                    if (title == null) {
                        title = ItemMapper.readText(node, "name");
                    }
                    if (title != null) {
                        values.add(title);
                    }
                }
            }
        }
        return values;
    }

    private static List<String> sample(List<String> values) {
        return values.subList(0, Math.min(SAMPLE_SIZE, values.size()));
    }

    private static String preview(String text) {
        return text.length() > ABSTRACT_PREVIEW ? text.substring(0, ABSTRACT_PREVIEW) + "..." : text;
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
