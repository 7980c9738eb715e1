package com.jobbergate.api.files;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the gzip tarball the CLI uploads for an application.
 *
 * Expected layout (leading {@code ./} tolerated):
 * <pre>
 *   jobbergate.py
 *   jobbergate.yaml
 *   templates/&lt;any file&gt;
 * </pre>
 * Anything else in the archive is ignored.
 */
public final class ApplicationArchive {

    private static final Logger log = LoggerFactory.getLogger(ApplicationArchive.class);

    public static final String SOURCE_FILE     = "jobbergate.py";
    public static final String CONFIG_FILE     = "jobbergate.yaml";
    public static final String TEMPLATE_PREFIX = "templates/";

    /**
     * Files extracted from an archive.
     *
     * @param templates template name (without the {@code templates/} prefix) to source, sorted by name
     */
    public record Contents(String source, String config, Map<String, String> templates) {}

    private ApplicationArchive() {}

    /**
     * Extract the application files.
     *
     * @throws FileValidationException when the stream is not a gzip tarball or
     *                                 lacks the source or config file
     */
    public static Contents extract(InputStream archive) {
        String source = null;
        String config = null;
        Map<String, String> templates = new TreeMap<>();

        try (TarArchiveInputStream tar = new TarArchiveInputStream(
                new GzipCompressorInputStream(new BufferedInputStream(archive)))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (!entry.isFile()) {
                    continue;
                }
                String name = normalize(entry.getName());
                if (name.equals(SOURCE_FILE)) {
                    source = readText(tar);
                } else if (name.equals(CONFIG_FILE)) {
                    config = readText(tar);
                } else if (name.startsWith(TEMPLATE_PREFIX) && name.length() > TEMPLATE_PREFIX.length()) {
                    templates.put(name.substring(TEMPLATE_PREFIX.length()), readText(tar));
                } else {
                    log.debug("Ignoring unexpected archive entry '{}'", name);
                }
            }
        } catch (IOException e) {
            throw new FileValidationException("Uploaded file is not a readable gzip tarball", e);
        }

        if (source == null || config == null) {
            throw new FileValidationException(
                    "Archive must contain both " + SOURCE_FILE + " and " + CONFIG_FILE);
        }
        return new Contents(source, config, templates);
    }

    private static String normalize(String entryName) {
        String name = entryName;
        while (name.startsWith("./")) {
            name = name.substring(2);
        }
        return name;
    }

    private static String readText(TarArchiveInputStream tar) throws IOException {
        return new String(tar.readAllBytes(), StandardCharsets.UTF_8);
    }
}
