package com.jobbergate.cli.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RendererTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final List<String> HIDDEN = List.of("application_config", "created_at");

    private final StringWriter out = new StringWriter();

    @Test
    void listResults_tableHidesVerboseFields() throws Exception {
        renderer(false, false).renderListResults(envelope(), "Applications List",
                StyleMapper.of("id", "green"), HIDDEN);

        String text = out.toString();
        assertThat(text).contains("Applications List");
        assertThat(text).contains("id | application_name");
        assertThat(text).contains("rats");
        assertThat(text).contains("Total: 2 (page 0, 2 per page)");
        assertThat(text).doesNotContain("application_config").doesNotContain("created_at");
        assertThat(text).doesNotContain("@|");
    }

    @Test
    void listResults_fullShowsEverything() throws Exception {
        renderer(false, true).renderListResults(envelope(), "Applications List", StyleMapper.NONE, HIDDEN);

        assertThat(out.toString()).contains("application_config").contains("created_at");
    }

    @Test
    void listResults_rawPrintsJson() throws Exception {
        renderer(true, false).renderListResults(envelope(), "Applications List", StyleMapper.NONE, HIDDEN);

        JsonNode printed = JSON.readTree(out.toString());
        assertThat(printed).isEqualTo(envelope());
    }

    @Test
    void listResults_empty_printsNoResultsMessage() throws Exception {
        renderer(false, false).renderListResults(
                JSON.readTree("{\"results\": [], \"metadata\": {\"total\": 0}}"), "Applications List",
                StyleMapper.NONE, HIDDEN);

        assertThat(out.toString()).contains("NO RESULTS").contains("There are no results to display");
    }

    @Test
    void singleResult_keyValueListing() throws Exception {
        JsonNode result = JSON.readTree("""
                {"id": 3, "application_name": "rats", "application_config": "x: 1", "application_uploaded": true}
                """);

        renderer(false, false).renderSingleResult(result, "Application", HIDDEN);

        String text = out.toString();
        assertThat(text).startsWith("Application");
        assertThat(text).containsPattern("application_name\\s+rats");
        assertThat(text).containsPattern("application_uploaded\\s+true");
        assertThat(text).doesNotContain("x: 1");
    }

    @Test
    void panel_framesSubjectAndMessage() {
        Renderer.panel(new PrintWriter(out), Ansi.OFF, "first line\nsecond line", "File upload failed", "yellow");

        String text = out.toString();
        assertThat(text).contains("── File upload failed ");
        assertThat(text).contains("  first line").contains("  second line");
    }

    private Renderer renderer(boolean raw, boolean full) {
        return new Renderer(new PrintWriter(out), Ansi.OFF, JSON, raw, full);
    }

    private static JsonNode envelope() throws Exception {
        return JSON.readTree("""
                {
                  "results": [
                    {"id": 1, "application_name": "rats", "application_config": "a: 1", "created_at": "2024-01-01T00:00:00Z"},
                    {"id": 2, "application_name": "mice", "application_config": null, "created_at": "2024-01-02T00:00:00Z"}
                  ],
                  "metadata": {"total": 2, "page": 0, "per_page": 2}
                }
                """);
    }
}
