package com.jobbergate.cli.command;

import com.jobbergate.cli.client.Abort;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Packs an application directory into the gzip tarball the upload endpoint reads:
 * {@code jobbergate.py}, {@code jobbergate.yaml} and everything under
 * {@code templates/}. Other files in the directory are left out.
 */
public final class ApplicationTarball {

    private static final Logger log = LoggerFactory.getLogger(ApplicationTarball.class);

    public static final String TARBALL_NAME  = "jobbergate.tar.gz";
    public static final String SOURCE_FILE   = "jobbergate.py";
    public static final String CONFIG_FILE   = "jobbergate.yaml";
    public static final String TEMPLATES_DIR = "templates";

    private ApplicationTarball() {}

    /**
     * @return the path of the tarball written into {@code buildDir}
     * @throws Abort if {@code applicationDir} is not a directory or cannot be read
     */
    public static Path build(Path applicationDir, Path buildDir) {
        if (!Files.isDirectory(applicationDir)) {
            throw new Abort("Application directory " + applicationDir + " does not exist",
                    "INVALID APPLICATION PATH", false);
        }
        Path tarball = buildDir.resolve(TARBALL_NAME);
        List<String> added = new ArrayList<>();
        try (OutputStream file = Files.newOutputStream(tarball);
             TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(file))) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Path entry : entriesOf(applicationDir)) {
                String name = applicationDir.relativize(entry).toString().replace('\\', '/');
                TarArchiveEntry tarEntry = new TarArchiveEntry(entry.toFile(), name);
                tar.putArchiveEntry(tarEntry);
                Files.copy(entry, tar);
                tar.closeArchiveEntry();
                added.add(name);
            }
        } catch (IOException e) {
            throw new Abort("Could not build the application tarball: " + e.getMessage(),
                    "TARBALL FAILED", false, e);
        }
        log.debug("Built {} with {}", tarball, added);
        return tarball;
    }

    private static List<Path> entriesOf(Path applicationDir) throws IOException {
        List<Path> entries = new ArrayList<>();
        for (String name : List.of(SOURCE_FILE, CONFIG_FILE)) {
            Path file = applicationDir.resolve(name);
            if (Files.isRegularFile(file)) {
                entries.add(file);
            } else {
                log.debug("{} has no {}", applicationDir, name);
            }
        }
        Path templates = applicationDir.resolve(TEMPLATES_DIR);
        if (Files.isDirectory(templates)) {
            try (Stream<Path> walk = Files.walk(templates)) {
                walk.filter(Files::isRegularFile).sorted().forEach(entries::add);
            }
        }
        return entries;
    }
}
