package com.jobbergate.api.files;

import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.interpret.JinjavaInterpreter;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;
import com.hubspot.jinjava.interpret.TemplateError.ErrorReason;
import com.hubspot.jinjava.interpret.TemplateError.ErrorType;
import com.hubspot.jinjava.tree.ExpressionNode;
import com.hubspot.jinjava.tree.Node;
import com.hubspot.jinjava.tree.TagNode;
import com.hubspot.jinjava.tree.TextNode;
import com.jobbergate.api.files.python.Python3Lexer;
import com.jobbergate.api.files.python.Python3Parser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Syntax checks for the text files that make up an application.
 *
 * Every check delegates to an existing parser and only reports whether
 * parsing succeeded:
 * <ul>
 *   <li>Python source: the Python 3 grammar in {@code src/main/antlr4}</li>
 *   <li>YAML: SnakeYAML, safe constructor, every document in the stream</li>
 *   <li>Jinja2 templates: Jinjava; a template is rejected when it leaves a
 *       delimiter unclosed or reports a syntax error</li>
 * </ul>
 *
 * {@link #VALIDATION_DISPATCH} maps a file extension to its check.
 */
public final class FileValidation {

    private static final Logger log = LoggerFactory.getLogger(FileValidation.class);

    public static final Map<String, SyntaxValidator> VALIDATION_DISPATCH = Map.of(
            ".py",     FileValidation::isValidPythonFile,
            ".yaml",   FileValidation::isValidYamlFile,
            ".j2",     FileValidation::isValidJinja2Template,
            ".jinja2", FileValidation::isValidJinja2Template
    );

    private static final Jinjava JINJA = new Jinjava();

    private FileValidation() {}

    // ------------------------------------------------------------------
    // Individual checks
    // ------------------------------------------------------------------

    public static boolean isValidPythonFile(String source) {
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        Python3Parser parser = new Python3Parser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        try {
            parser.file_input();
            return true;
        } catch (ParseCancellationException e) {
            log.debug("Python source rejected: {}", e.getCause() == null ? e.getMessage() : e.getCause().toString());
            return false;
        }
    }

    public static boolean isValidYamlFile(String yamlText) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        int documents = 0;
        try {
            // loadAll is lazy; iterating forces every document to parse
            for (Object document : yaml.loadAll(yamlText)) {
                documents++;
            }
            log.trace("YAML accepted ({} documents)", documents);
            return true;
        } catch (YAMLException e) {
            log.debug("YAML rejected: {}", e.getMessage());
            return false;
        }
    }

    public static boolean isValidJinja2Template(String template) {
        JinjavaInterpreter interpreter = JINJA.newInterpreter();
        JinjavaInterpreter.pushCurrent(interpreter);
        try {
            if (hasUnclosedDelimiter(interpreter.parse(template))) {
                log.debug("Template rejected: unclosed delimiter");
                return false;
            }
        } finally {
            JinjavaInterpreter.popCurrent();
        }

        // expressions are only compiled when rendered
        RenderResult result = JINJA.renderForResult(template, Map.of());
        for (TemplateError error : result.getErrors()) {
            if (isSyntaxError(error)) {
                log.debug("Template rejected at line {}: {}", error.getLineno(), error.getMessage());
                return false;
            }
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Check {@code content} with the validator registered for the extension of
     * {@code filename}. Files with no registered validator pass.
     */
    public static boolean isValid(String filename, String content) {
        SyntaxValidator validator = VALIDATION_DISPATCH.get(extensionOf(filename));
        return validator == null || validator.isValid(content);
    }

    /** Names of the files in {@code files} that fail their syntax check, in input order. */
    public static List<String> findInvalidFiles(Map<String, String> files) {
        List<String> invalid = new ArrayList<>();
        files.forEach((name, content) -> {
            if (!isValid(name, content)) {
                invalid.add(name);
            }
        });
        return invalid;
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        int slash = filename.lastIndexOf('/');
        if (dot <= slash || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static boolean isSyntaxError(TemplateError error) {
        return error.getReason() == ErrorReason.SYNTAX_ERROR
                || (error.getSeverity() == ErrorType.FATAL && error.getReason() == ErrorReason.UNKNOWN);
    }

    /**
     * An unterminated {@code {{ }}} or {@code {% %}} ends up either as a node
     * whose image lacks its closing delimiter or as plain text that still
     * holds the opening one. Text inside {@code raw} blocks is literal.
     */
    private static boolean hasUnclosedDelimiter(Node node) {
        if (node instanceof ExpressionNode && !node.getMaster().getImage().endsWith("}}")) {
            return true;
        }
        if (node instanceof TagNode tag) {
            if (!tag.getMaster().getImage().endsWith("%}")) {
                return true;
            }
            if ("raw".equals(tag.getName())) {
                return false;
            }
        }
        if (node instanceof TextNode) {
            String text = node.getMaster().getImage();
            if (text.contains("{{") || text.contains("{%")) {
                return true;
            }
        }
        for (Node child : node.getChildren()) {
            if (hasUnclosedDelimiter(child)) {
                return true;
            }
        }
        return false;
    }
}
