package com.jobbergate.cli;

import com.jobbergate.cli.client.JobbergateClient;
import com.jobbergate.cli.render.Renderer;

/**
 * What every subcommand needs: settings, an API client and a renderer bound to
 * the global output flags.
 */
public record JobbergateContext(CliSettings settings, JobbergateClient client, Renderer renderer) {}
