package com.jobbergate.cli.command;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.jobbergate.cli.CliSettings;
import com.jobbergate.cli.JobbergateCli;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;

/**
 * Runs the CLI against a WireMock server and captures stdout and stderr.
 */
abstract class CommandTestSupport {

    static final String SUPPORT = "support@example.com";

    WireMockServer server;
    StringWriter   out;
    StringWriter   err;

    @BeforeEach
    void startServer() {
        server = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        server.start();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    int run(String... args) {
        CliSettings settings = new CliSettings(
                "http://localhost:" + server.port(), "me@example.com", Duration.ofSeconds(5), SUPPORT);
        CommandLine cmd = JobbergateCli.commandLine(settings, Ansi.OFF);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }
}
