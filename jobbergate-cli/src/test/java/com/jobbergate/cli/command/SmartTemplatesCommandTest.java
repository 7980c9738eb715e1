package com.jobbergate.cli.command;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

class SmartTemplatesCommandTest extends CommandTestSupport {

    private static final String TEMPLATE = """
            {"id": 2, "name": "rats", "identifier": "rats-template", "description": null,
             "owner_email": "me@example.com", "template_vars": {"cpus": 4},
             "created_at": "2024-01-01T00:00:00Z", "updated_at": "2024-01-01T00:00:00Z"}
            """;

    @TempDir Path dir;

    @Test
    void create_sendsTemplateVars() throws IOException {
        Path vars = Files.writeString(dir.resolve("vars.json"), "{\"cpus\": 4}");
        server.stubFor(post(urlEqualTo("/jobbergate/smart-templates")).willReturn(aResponse()
                .withStatus(201).withHeader("Content-Type", "application/json").withBody(TEMPLATE)));

        int exit = run("smart-templates", "create", "--name", "rats", "--identifier", "rats-template",
                "--vars-file", vars.toString());

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Created Smart Template").containsPattern("identifier\\s+rats-template");
        server.verify(postRequestedFor(urlEqualTo("/jobbergate/smart-templates")).withRequestBody(equalToJson("""
                {"name": "rats", "identifier": "rats-template", "template_vars": {"cpus": 4}}
                """)));
    }

    @Test
    void list_userOnly() {
        server.stubFor(get(urlPathEqualTo("/jobbergate/smart-templates")).willReturn(okJson(
                "{\"results\": [" + TEMPLATE + "], \"metadata\": {\"total\": 1}}")));

        int exit = run("smart-templates", "list", "--user", "--search", "rat");

        assertThat(exit).isZero();
        assertThat(out.toString()).contains("Smart Templates List").contains("rats-template");
        server.verify(getRequestedFor(urlEqualTo("/jobbergate/smart-templates?all=false&user=true&search=rat")));
    }

    @Test
    void getOne_bothKeys_aborts() {
        int exit = run("smart-templates", "get-one", "--id", "2", "--identifier", "rats-template");

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).contains("exactly one of --id or --identifier");
    }

    @Test
    void update_and_delete() {
        server.stubFor(put(urlEqualTo("/jobbergate/smart-templates/2")).willReturn(okJson(TEMPLATE)));
        server.stubFor(delete(urlEqualTo("/jobbergate/smart-templates/2")).willReturn(aResponse().withStatus(204)));

        assertThat(run("smart-templates", "update", "--id", "2", "--description", "new")).isZero();
        assertThat(run("smart-templates", "delete", "--id", "2")).isZero();

        server.verify(putRequestedFor(urlEqualTo("/jobbergate/smart-templates/2"))
                .withRequestBody(equalToJson("{\"description\": \"new\"}")));
        assertThat(out.toString()).contains("Smart template delete succeeded");
    }
}
