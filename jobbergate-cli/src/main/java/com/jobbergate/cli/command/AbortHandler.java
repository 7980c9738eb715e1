package com.jobbergate.cli.command;

import com.jobbergate.cli.CliSettings;
import com.jobbergate.cli.client.Abort;
import com.jobbergate.cli.render.Renderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Turns an exception escaping a command into an error panel on stderr and
 * exit code 1.
 */
public class AbortHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AbortHandler.class);

    public static final int EXIT_ABORTED = 1;

    private final CliSettings settings;
    private final Ansi        ansi;

    public AbortHandler(CliSettings settings, Ansi ansi) {
        this.settings = settings;
        this.ansi     = ansi;
    }

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof Abort abort) {
            log.debug("Command aborted: {}", abort.getMessage(), abort);
            String message = abort.getMessage();
            if (abort.isSupport()) {
                message += "\n\nIf the problem persists, please contact "
                        + settings.supportContact() + " for support and trouble-shooting";
            }
            Renderer.panel(commandLine.getErr(), ansi, message, abort.getSubject(), "red");
            return EXIT_ABORTED;
        }
        log.error("Unexpected error in '{}'", commandLine.getCommandName(), ex);
        Renderer.panel(commandLine.getErr(), ansi,
                "An unexpected error occurred: " + ex.getMessage(), "UNEXPECTED ERROR", "red");
        return EXIT_ABORTED;
    }
}
