package com.jobbergate.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobbergate.cli.client.JobbergateClient;
import com.jobbergate.cli.command.AbortHandler;
import com.jobbergate.cli.command.ApplicationsCommand;
import com.jobbergate.cli.command.JobScriptsCommand;
import com.jobbergate.cli.command.SmartTemplatesCommand;
import com.jobbergate.cli.render.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "jobbergate",
        description = "Command-line client for the Jobbergate API",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ApplicationsCommand.class,
                JobScriptsCommand.class,
                SmartTemplatesCommand.class
        }
)
public class JobbergateCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobbergateCli.class);

    @Option(names = "--raw", description = "Print the API's JSON instead of tables")
    boolean raw;

    @Option(names = "--full", description = "Show every field, including the verbose ones")
    boolean full;

    @Option(names = "--verbose", description = "Enable debug logging")
    boolean verbose;

    @Option(names = "--base-url", description = "Override JOBBERGATE_API_URL")
    String baseUrl;

    @Spec
    CommandSpec spec;

    private final CliSettings settings;
    private final Ansi        ansi;

    private JobbergateContext context;

    public JobbergateCli(CliSettings settings, Ansi ansi) {
        this.settings = settings;
        this.ansi     = ansi;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut(), ansi);
    }

    /** Built on first use, after the global options are parsed. */
    public JobbergateContext context() {
        if (context == null) {
            if (verbose) {
                ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME))
                        .setLevel(Level.DEBUG);
            }
            CliSettings effective = baseUrl == null ? settings : settings.withApiUrl(baseUrl);
            ObjectMapper json = new ObjectMapper();
            context = new JobbergateContext(
                    effective,
                    new JobbergateClient(effective, json),
                    new Renderer(spec.commandLine().getOut(), ansi, json, raw, full));
            log.debug("Using Jobbergate API at {} (owner={})", effective.apiUrl(), effective.userEmail());
        }
        return context;
    }

    public static CommandLine commandLine(CliSettings settings, Ansi ansi) {
        return new CommandLine(new JobbergateCli(settings, ansi))
                .setExecutionExceptionHandler(new AbortHandler(settings, ansi));
    }

    public static void main(String[] args) {
        int exitCode = commandLine(CliSettings.fromEnvironment(System.getenv()), Ansi.AUTO).execute(args);
        System.exit(exitCode);
    }
}
