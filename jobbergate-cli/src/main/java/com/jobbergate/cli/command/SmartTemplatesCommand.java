package com.jobbergate.cli.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobbergate.cli.JobbergateCli;
import com.jobbergate.cli.JobbergateContext;
import com.jobbergate.cli.SortOrder;
import com.jobbergate.cli.client.Abort;
import com.jobbergate.cli.render.StyleMapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(
        name = "smart-templates",
        description = "Commands to interact with smart templates",
        mixinStandardHelpOptions = true
)
public class SmartTemplatesCommand {

    static final String PATH = "/jobbergate/smart-templates";

    static final List<String> HIDDEN_FIELDS = List.of("template_vars", "created_at", "updated_at");

    static final StyleMapper STYLES = StyleMapper.of(
            "id",         "green",
            "name",       "cyan",
            "identifier", "magenta"
    );

    @ParentCommand
    JobbergateCli root;

    @Command(name = "list", description = "Show available smart templates")
    public void list(
            @Option(names = "--all", description = "Show all smart templates, even the ones without identifier") boolean showAll,
            @Option(names = "--user", description = "Show only smart templates owned by the current user") boolean userOnly,
            @Option(names = "--search", description = "Apply a search term to results") String search,
            @Option(names = "--sort-order", defaultValue = "UNSORTED",
                    description = "Specify sort order: ${COMPLETION-CANDIDATES}") SortOrder sortOrder,
            @Option(names = "--sort-field", description = "The field by which results should be sorted") String sortField) {
        JobbergateContext ctx = root.context();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("all", showAll);
        params.put("user", userOnly);
        if (search != null) {
            params.put("search", search);
        }
        sortOrder.applyTo(params, sortField);

        JsonNode envelope = ctx.client().get(PATH, params, "Couldn't retrieve smart templates list from API");
        ctx.renderer().renderListResults(envelope, "Smart Templates List", STYLES, HIDDEN_FIELDS);
    }

    @Command(name = "get-one", description = "Get a single smart template by id or identifier")
    public void getOne(
            @Option(names = "--id", description = "The id of the smart template") Long id,
            @Option(names = "--identifier", description = "The identifier of the smart template") String identifier) {
        JobbergateContext ctx = root.context();
        if ((id == null) == (identifier == null)) {
            throw new Abort("Supply exactly one of --id or --identifier", "INVALID PARAMS", false);
        }
        String key = id != null ? id.toString() : identifier;
        JsonNode result = ctx.client().get(PATH + "/" + key, Map.of(),
                "Couldn't retrieve smart template " + key + " from API");
        ctx.renderer().renderSingleResult(result, "Smart Template", HIDDEN_FIELDS);
    }

    @Command(name = "create", description = "Create a new smart template")
    public void create(
            @Option(names = "--name", required = true, description = "The name of the smart template") String name,
            @Option(names = "--identifier", description = "A human-friendly identifier") String identifier,
            @Option(names = "--description", description = "A helpful description") String description,
            @Option(names = "--vars-file", description = "JSON file with the template variables") Path varsFile) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        if (identifier != null) {
            body.put("identifier", identifier);
        }
        if (description != null) {
            body.put("description", description);
        }
        if (varsFile != null) {
            body.put("template_vars", JobScriptsCommand.readParams(varsFile));
        }

        JsonNode result = ctx.client().post(PATH, body, "Request to create smart template was not accepted by the API");
        ctx.renderer().renderSingleResult(result, "Created Smart Template", HIDDEN_FIELDS);
    }

    @Command(name = "update", description = "Update an existing smart template")
    public void update(
            @Option(names = "--id", required = true, description = "The id of the smart template to update") long id,
            @Option(names = "--name", description = "Optional new name") String name,
            @Option(names = "--identifier", description = "Optional new identifier") String identifier,
            @Option(names = "--description", description = "Optional new description") String description,
            @Option(names = "--vars-file", description = "JSON file replacing the template variables") Path varsFile) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        if (name != null) {
            body.put("name", name);
        }
        if (identifier != null) {
            body.put("identifier", identifier);
        }
        if (description != null) {
            body.put("description", description);
        }
        if (varsFile != null) {
            body.put("template_vars", JobScriptsCommand.readParams(varsFile));
        }

        JsonNode result = ctx.client().put(PATH + "/" + id, body,
                "Request to update smart template was not accepted by the API");
        ctx.renderer().renderSingleResult(result, "Updated Smart Template", HIDDEN_FIELDS);
    }

    @Command(name = "delete", description = "Delete an existing smart template")
    public void delete(@Option(names = "--id", required = true, description = "The id of the smart template to delete") long id) {
        JobbergateContext ctx = root.context();
        ctx.client().delete(PATH + "/" + id, "Request to delete smart template was not accepted by the API");
        ctx.renderer().terminalMessage("The smart template was successfully deleted.",
                "Smart template delete succeeded", "green");
    }
}
