package com.jobbergate.api.service;

import com.jobbergate.api.model.Application;
import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders an application's templates into job script files.
 *
 * Template context: the parameters at top level plus the same map under
 * {@code data}, so both {@code {{ job_name }}} and {@code {{ data.job_name }}}
 * resolve. Undefined names render as empty text, as in Jinja2.
 */
@Component
public class JobScriptRenderer {

    private static final Logger log = LoggerFactory.getLogger(JobScriptRenderer.class);

    /**
     * Output of a render.
     *
     * @param mainFile name of the entry file within {@code files}
     * @param files    output file name to rendered content, sorted by name
     */
    public record Rendered(String mainFile, Map<String, Object> files) {}

    private final Jinjava jinjava = new Jinjava();

    /**
     * @throws JobScriptRenderException if the application has no templates or one fails to render
     */
    public Rendered render(Application application, Map<String, Object> params) {
        Map<String, Object> templates = new TreeMap<>(application.getApplicationTemplates());
        if (!application.isApplicationUploaded() || templates.isEmpty()) {
            throw new JobScriptRenderException(
                    "Application " + application.getId() + " has no uploaded templates to render");
        }

        Map<String, Object> context = new HashMap<>(params == null ? Map.of() : params);
        context.put("data", params == null ? Map.of() : params);

        Map<String, Object> files = new LinkedHashMap<>();
        templates.forEach((name, source) ->
                files.put(outputName(name), evaluate(name, String.valueOf(source), context)));

        String defaultTemplate = defaultTemplate(application.getApplicationConfig());
        String mainFile = defaultTemplate != null && files.containsKey(outputName(defaultTemplate))
                ? outputName(defaultTemplate)
                : files.keySet().iterator().next();

        log.debug("Rendered {} files from application {} (main={})",
                files.size(), application.getId(), mainFile);
        return new Rendered(mainFile, files);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String evaluate(String name, String source, Map<String, Object> context) {
        RenderResult result = jinjava.renderForResult(source, context);
        List<TemplateError> fatal = result.getErrors().stream()
                .filter(error -> error.getSeverity() == TemplateError.ErrorType.FATAL
                        || error.getReason() == TemplateError.ErrorReason.SYNTAX_ERROR)
                .toList();
        if (!fatal.isEmpty()) {
            TemplateError first = fatal.get(0);
            throw new JobScriptRenderException("Template '" + name + "' could not be rendered: "
                    + first.getMessage() + " (line " + first.getLineno() + ")");
        }
        result.getErrors().forEach(warning ->
                log.debug("Template '{}': {}", name, warning.getMessage()));
        return result.getOutput();
    }

    /** {@code jobbergate_config.default_template} from the YAML config, or null. */
    static String defaultTemplate(String config) {
        if (config == null || config.isBlank()) {
            return null;
        }
        try {
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(config);
            if (root instanceof Map<?, ?> map && map.get("jobbergate_config") instanceof Map<?, ?> jg) {
                Object value = jg.get("default_template");
                return value == null ? null : stripTemplatePrefix(value.toString());
            }
            return null;
        } catch (YAMLException e) {
            throw new JobScriptRenderException("Application config is not valid YAML", e);
        }
    }

    static String outputName(String templateName) {
        String name = stripTemplatePrefix(templateName);
        if (name.endsWith(".jinja2")) {
            return name.substring(0, name.length() - ".jinja2".length());
        }
        if (name.endsWith(".j2")) {
            return name.substring(0, name.length() - ".j2".length());
        }
        return name;
    }

    private static String stripTemplatePrefix(String name) {
        return name.startsWith("templates/") ? name.substring("templates/".length()) : name;
    }
}
