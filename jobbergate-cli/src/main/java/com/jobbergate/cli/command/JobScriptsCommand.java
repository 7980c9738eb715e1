package com.jobbergate.cli.command;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbergate.cli.JobbergateCli;
import com.jobbergate.cli.JobbergateContext;
import com.jobbergate.cli.SortOrder;
import com.jobbergate.cli.client.Abort;
import com.jobbergate.cli.render.StyleMapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(
        name = "job-scripts",
        description = "Commands to interact with job scripts",
        mixinStandardHelpOptions = true
)
public class JobScriptsCommand {

    static final String PATH = "/jobbergate/job-scripts";

    static final List<String> HIDDEN_FIELDS = List.of(
            "job_script_files",
            "created_at",
            "updated_at"
    );

    static final StyleMapper STYLES = StyleMapper.of(
            "id",              "green",
            "job_script_name", "cyan",
            "application_id",  "magenta"
    );

    @ParentCommand
    JobbergateCli root;

    @Command(name = "list", description = "Show available job scripts")
    public void list(
            @Option(names = "--user", description = "Show only job scripts owned by the current user") boolean userOnly,
            @Option(names = "--search", description = "Apply a search term to results") String search,
            @Option(names = "--sort-order", defaultValue = "UNSORTED",
                    description = "Specify sort order: ${COMPLETION-CANDIDATES}") SortOrder sortOrder,
            @Option(names = "--sort-field", description = "The field by which results should be sorted") String sortField,
            @Option(names = "--from-application-id",
                    description = "Only job scripts created from this application") Long fromApplicationId) {
        JobbergateContext ctx = root.context();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("user", userOnly);
        if (search != null) {
            params.put("search", search);
        }
        if (fromApplicationId != null) {
            params.put("from_application_id", fromApplicationId);
        }
        sortOrder.applyTo(params, sortField);

        JsonNode envelope = ctx.client().get(PATH, params, "Couldn't retrieve job scripts list from API");
        ctx.renderer().renderListResults(envelope, "Job Scripts List", STYLES, HIDDEN_FIELDS);
    }

    @Command(name = "get-one", description = "Get a single job script by id")
    public void getOne(@Option(names = "--id", required = true, description = "The id of the job script") long id) {
        JobbergateContext ctx = root.context();
        ctx.renderer().renderSingleResult(fetch(ctx, id), "Job Script", HIDDEN_FIELDS);
    }

    /**
     * Either renders the templates of {@code --application-id} with the
     * parameters in {@code --param-file}, or stores the {@code --job-script-file}s as given.
     */
    @Command(name = "create", description = "Create a new job script")
    public void create(
            @Option(names = "--name", required = true, description = "The name of the job script") String name,
            @Option(names = "--description", description = "A helpful description of the job script") String description,
            @Option(names = "--application-id", description = "Render the templates of this application") Long applicationId,
            @Option(names = "--param-file",
                    description = "JSON file with the parameters used to render the templates") Path paramFile,
            @Option(names = "--job-script-file",
                    description = "A file to store in the job script (repeatable)") List<Path> files,
            @Option(names = "--main-file", description = "Name of the entry file among --job-script-file") String mainFile) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_script_name", name);
        if (description != null) {
            body.put("job_script_description", description);
        }
        if (applicationId != null) {
            body.put("application_id", applicationId);
        }
        if (paramFile != null) {
            body.put("param_dict", readParams(paramFile));
        }
        if (files != null && !files.isEmpty()) {
            body.put("job_script_files", readFiles(files));
        }
        if (mainFile != null) {
            body.put("job_script_main_file", mainFile);
        }

        JsonNode result = ctx.client().post(PATH, body, "Request to create job script was not accepted by the API");
        ctx.renderer().renderSingleResult(result, "Created Job Script", HIDDEN_FIELDS);
    }

    @Command(name = "update", description = "Update an existing job script")
    public void update(
            @Option(names = "--id", required = true, description = "The id of the job script to update") long id,
            @Option(names = "--name", description = "Optional new name") String name,
            @Option(names = "--description", description = "Optional new description") String description,
            @Option(names = "--job-script-file",
                    description = "Replacement files for the job script (repeatable)") List<Path> files,
            @Option(names = "--main-file", description = "Optional new entry file") String mainFile) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        if (name != null) {
            body.put("job_script_name", name);
        }
        if (description != null) {
            body.put("job_script_description", description);
        }
        if (files != null && !files.isEmpty()) {
            body.put("job_script_files", readFiles(files));
        }
        if (mainFile != null) {
            body.put("job_script_main_file", mainFile);
        }

        JsonNode result = ctx.client().put(PATH + "/" + id, body,
                "Request to update job script was not accepted by the API");
        ctx.renderer().renderSingleResult(result, "Updated Job Script", HIDDEN_FIELDS);
    }

    @Command(name = "delete", description = "Delete an existing job script")
    public void delete(@Option(names = "--id", required = true, description = "The id of the job script to delete") long id) {
        JobbergateContext ctx = root.context();
        ctx.client().delete(PATH + "/" + id, "Request to delete job script was not accepted by the API");
        ctx.renderer().terminalMessage("The job script was successfully deleted.",
                "Job script delete succeeded", "green");
    }

    /** Print every file of a job script, the main file first. */
    @Command(name = "show-files", description = "Show the files of a job script")
    public void showFiles(@Option(names = "--id", required = true, description = "The id of the job script") long id) {
        JobbergateContext ctx = root.context();
        JsonNode jobScript = fetch(ctx, id);
        JsonNode files = jobScript.path("job_script_files");
        if (ctx.renderer().isRaw()) {
            ctx.renderer().renderJson(files);
            return;
        }
        String main = jobScript.path("job_script_main_file").asText(null);
        if (main != null && files.has(main)) {
            ctx.renderer().terminalMessage(files.get(main).asText(), main + " (main file)", "green");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = files.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getKey().equals(main)) {
                ctx.renderer().terminalMessage(entry.getValue().asText(), entry.getKey(), "cyan");
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JsonNode fetch(JobbergateContext ctx, long id) {
        return ctx.client().get(PATH + "/" + id, Map.of(), "Couldn't retrieve job script " + id + " from API");
    }

    static Map<String, Object> readParams(Path paramFile) {
        try {
            return new ObjectMapper().readValue(paramFile.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new Abort("Could not read parameters from " + paramFile + ": " + e.getMessage(),
                    "INVALID PARAM FILE", false, e);
        }
    }

    /** File name to content; the directory part of each path is dropped. */
    static Map<String, String> readFiles(List<Path> files) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                contents.put(file.getFileName().toString(), Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new Abort("Could not read " + file + ": " + e.getMessage(), "INVALID JOB SCRIPT FILE", false, e);
            }
        }
        return contents;
    }
}
