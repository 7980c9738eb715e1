package com.jobbergate.cli.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobbergate.cli.JobbergateCli;
import com.jobbergate.cli.JobbergateContext;
import com.jobbergate.cli.SortOrder;
import com.jobbergate.cli.client.Abort;
import com.jobbergate.cli.render.StyleMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Command(
        name = "applications",
        description = "Commands to interact with applications",
        mixinStandardHelpOptions = true
)
public class ApplicationsCommand {

    private static final Logger log = LoggerFactory.getLogger(ApplicationsCommand.class);

    static final String PATH = "/jobbergate/applications";

    static final List<String> HIDDEN_FIELDS = List.of(
            "application_config",
            "application_file",
            "application_templates",
            "created_at",
            "updated_at"
    );

    static final StyleMapper STYLES = StyleMapper.of(
            "id",                     "green",
            "application_name",       "cyan",
            "application_identifier", "magenta"
    );

    private static final String ID_NOTE =
            "The database id of the application, generated by the server when the application is created.";

    private static final String IDENTIFIER_NOTE =
            "A human-friendly name for frequently used applications. It may be added, changed or removed later.";

    @ParentCommand
    JobbergateCli root;

    // ------------------------------------------------------------------
    // list / get-one
    // ------------------------------------------------------------------

    @Command(name = "list", description = "Show available applications")
    public void list(
            @Option(names = "--all", description = "Show all applications, even the ones without identifier") boolean showAll,
            @Option(names = "--user", description = "Show only applications owned by the current user") boolean userOnly,
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

        JsonNode envelope = ctx.client().get(PATH, params, "Couldn't retrieve applications list from API");
        ctx.renderer().renderListResults(envelope, "Applications List", STYLES, HIDDEN_FIELDS);
    }

    @Command(name = "get-one", description = "Get a single application by id or identifier")
    public void getOne(
            @Option(names = "--id", description = ID_NOTE) Long id,
            @Option(names = "--identifier", description = IDENTIFIER_NOTE) String identifier) {
        JobbergateContext ctx = root.context();
        ctx.renderer().renderSingleResult(fetch(ctx, id, identifier), "Application", HIDDEN_FIELDS);
    }

    // ------------------------------------------------------------------
    // create / update / delete
    // ------------------------------------------------------------------

    @Command(name = "create", description = "Create a new application and upload its files")
    public void create(
            @Option(names = "--name", required = true, description = "The name of the application to create") String name,
            @Option(names = "--identifier", description = IDENTIFIER_NOTE) String identifier,
            @Option(names = "--application-path", required = true,
                    description = "The directory where the application files are located") Path applicationPath,
            @Option(names = "--application-desc", description = "A helpful description of the application") String description) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("application_name", name);
        if (identifier != null && !identifier.isBlank()) {
            body.put("application_identifier", identifier);
        }
        if (description != null && !description.isBlank()) {
            body.put("application_description", description);
        }

        ObjectNode result = (ObjectNode) ctx.client().post(
                PATH, body, "Request to create application was not accepted by the API");
        long applicationId = result.path("id").asLong();

        if (upload(ctx, applicationPath, applicationId)) {
            result.put("application_uploaded", true);
        } else {
            warnUploadFailed(ctx, "Try running the `update` command including the application path to re-upload.");
        }
        ctx.renderer().renderSingleResult(result, "Created Application", HIDDEN_FIELDS);
    }

    @Command(name = "update", description = "Update an existing application")
    public void update(
            @Option(names = "--id", required = true, description = ID_NOTE) long id,
            @Option(names = "--application-path",
                    description = "The directory where the application files are located") Path applicationPath,
            @Option(names = "--identifier", description = "Optional new application identifier to be set") String identifier,
            @Option(names = "--application-desc", description = "Optional new application description to be set") String description) {
        JobbergateContext ctx = root.context();

        Map<String, Object> body = new LinkedHashMap<>();
        if (identifier != null && !identifier.isBlank()) {
            body.put("application_identifier", identifier);
        }
        if (description != null && !description.isBlank()) {
            body.put("application_description", description);
        }

        ObjectNode result = (ObjectNode) ctx.client().put(
                PATH + "/" + id, body, "Request to update application was not accepted by the API");

        if (applicationPath != null) {
            if (upload(ctx, applicationPath, id)) {
                result.put("application_uploaded", true);
            } else {
                warnUploadFailed(ctx, "");
            }
        }
        ctx.renderer().renderSingleResult(result, "Updated Application", HIDDEN_FIELDS);
    }

    @Command(name = "delete", description = "Delete an existing application")
    public void delete(@Option(names = "--id", required = true, description = ID_NOTE) long id) {
        JobbergateContext ctx = root.context();
        ctx.client().delete(PATH + "/" + id, "Request to delete application was not accepted by the API");
        ctx.renderer().terminalMessage("The application was successfully deleted.",
                "Application delete succeeded", "green");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static JsonNode fetch(JobbergateContext ctx, Long id, String identifier) {
        if (id == null && identifier == null) {
            throw new Abort("You must supply either --id or --identifier", "INVALID PARAMS", false);
        }
        if (id != null && identifier != null) {
            throw new Abort("You may not supply both --id and --identifier", "INVALID PARAMS", false);
        }
        String key = id != null ? id.toString() : identifier;
        return ctx.client().get(PATH + "/" + key, Map.of(),
                "Couldn't retrieve application " + key + " from API");
    }

    /** Tar the application directory in a scratch directory and upload it; true on HTTP 201. */
    static boolean upload(JobbergateContext ctx, Path applicationPath, long applicationId) {
        Path buildDir = null;
        try {
            buildDir = Files.createTempDirectory("jobbergate-build");
            log.debug("Building application tar file at {}", buildDir);
            Path tarball = ApplicationTarball.build(applicationPath, buildDir);
            int status = ctx.client().upload(PATH + "/" + applicationId + "/upload", "upload_file", tarball);
            return status == 201;
        } catch (IOException e) {
            throw new Abort("Could not create a build directory: " + e.getMessage(), "TARBALL FAILED", false, e);
        } finally {
            if (buildDir != null) {
                deleteRecursively(buildDir);
            }
        }
    }

    private void warnUploadFailed(JobbergateContext ctx, String hint) {
        String message = "The zipped application files could not be uploaded.\n"
                + (hint.isEmpty() ? "" : "\n" + hint + "\n")
                + "\nIf the problem persists, please contact " + ctx.settings().supportContact()
                + " for support and trouble-shooting";
        ctx.renderer().terminalMessage(message, "File upload failed", "yellow");
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove build directory {}: {}", dir, e.getMessage());
        }
    }
}
