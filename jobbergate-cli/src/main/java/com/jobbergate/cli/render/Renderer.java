package com.jobbergate.cli.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints API responses to the terminal.
 *
 * With {@code raw} every result is printed as indented JSON. Otherwise lists
 * become tables and single results a key/value listing, with the caller's
 * hidden fields dropped unless {@code full} is set.
 */
public class Renderer {

    private static final int PANEL_WIDTH = 72;

    private final PrintWriter  out;
    private final Ansi         ansi;
    private final ObjectMapper json;
    private final boolean      raw;
    private final boolean      full;

    public Renderer(PrintWriter out, Ansi ansi, ObjectMapper json, boolean raw, boolean full) {
        this.out  = out;
        this.ansi = ansi;
        this.json = json;
        this.raw  = raw;
        this.full = full;
    }

    public boolean isRaw() { return raw; }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    public void renderJson(JsonNode node) {
        try {
            out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not format JSON output", e);
        }
        out.flush();
    }

    /**
     * Render a list envelope ({@code results} + {@code metadata}) as a table.
     */
    public void renderListResults(JsonNode envelope, String title, StyleMapper styles,
                                  Collection<String> hiddenFields) {
        if (raw) {
            renderJson(envelope);
            return;
        }
        JsonNode results = envelope.path("results");
        if (!results.isArray() || results.isEmpty()) {
            terminalMessage("There are no results to display", "NO RESULTS", "yellow");
            return;
        }

        List<String> columns = columnsOf(results, hiddenFields);
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode result : results) {
            List<String> row = new ArrayList<>();
            for (String column : columns) {
                row.add(cell(result.get(column)));
            }
            rows.add(row);
        }

        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            for (List<String> row : rows) {
                widths[c] = Math.max(widths[c], row.get(c).length());
            }
        }

        out.println(ansi.string("@|bold " + title + "|@"));
        List<String> header = new ArrayList<>();
        List<String> rule   = new ArrayList<>();
        for (int c = 0; c < columns.size(); c++) {
            header.add(ansi.string("@|bold " + pad(columns.get(c), widths[c]) + "|@"));
            rule.add("-".repeat(widths[c]));
        }
        out.println(String.join(" | ", header).stripTrailing());
        out.println(String.join("-+-", rule));
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>();
            for (int c = 0; c < columns.size(); c++) {
                cells.add(styled(pad(row.get(c), widths[c]), styles.styleFor(columns.get(c))));
            }
            out.println(String.join(" | ", cells).stripTrailing());
        }
        out.println(footer(envelope.path("metadata"), rows.size()));
        out.flush();
    }

    public void renderSingleResult(JsonNode result, String title, Collection<String> hiddenFields) {
        if (raw) {
            renderJson(result);
            return;
        }
        List<String> keys = new ArrayList<>();
        result.fieldNames().forEachRemaining(key -> {
            if (full || !hiddenFields.contains(key)) {
                keys.add(key);
            }
        });
        int width = keys.stream().mapToInt(String::length).max().orElse(0);

        out.println(ansi.string("@|bold " + title + "|@"));
        for (String key : keys) {
            out.println(ansi.string("@|bold " + pad(key, width) + "|@") + "  " + cell(result.get(key)));
        }
        out.flush();
    }

    // ------------------------------------------------------------------
    // Messages
    // ------------------------------------------------------------------

    public void terminalMessage(String message, String subject, String color) {
        panel(out, ansi, message, subject, color);
    }

    /** A framed message headed by {@code subject} in {@code color}. */
    public static void panel(PrintWriter writer, Ansi ansi, String message, String subject, String color) {
        String head = "── " + subject + " ";
        writer.println(ansi.string("@|" + color + ",bold " + head + "|@")
                + ansi.string("@|" + color + " " + "─".repeat(Math.max(3, PANEL_WIDTH - head.length())) + "|@"));
        writer.println();
        for (String line : message.strip().split("\n", -1)) {
            writer.println("  " + line.strip());
        }
        writer.println();
        writer.println(ansi.string("@|" + color + " " + "─".repeat(PANEL_WIDTH) + "|@"));
        writer.flush();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private List<String> columnsOf(JsonNode results, Collection<String> hiddenFields) {
        Set<String> columns = new LinkedHashSet<>();
        for (JsonNode result : results) {
            Iterator<String> names = result.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (full || !hiddenFields.contains(name)) {
                    columns.add(name);
                }
            }
        }
        return new ArrayList<>(columns);
    }

    private String cell(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private String styled(String text, String style) {
        return style == null ? text : ansi.string("@|" + style + " " + text + "|@");
    }

    private static String footer(JsonNode metadata, int shown) {
        long total = metadata.path("total").asLong(shown);
        if (metadata.hasNonNull("page")) {
            return "Total: " + total + " (page " + metadata.get("page").asInt()
                    + ", " + metadata.path("per_page").asInt() + " per page)";
        }
        return "Total: " + total;
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
