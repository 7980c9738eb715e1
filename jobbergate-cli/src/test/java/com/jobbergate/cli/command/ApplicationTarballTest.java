package com.jobbergate.cli.command;

import com.jobbergate.cli.client.Abort;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationTarballTest {

    @TempDir Path appDir;
    @TempDir Path buildDir;

    @Test
    void build_includesSourceConfigAndTemplatesOnly() throws IOException {
        Files.writeString(appDir.resolve("jobbergate.py"), "print('hi')\n");
        Files.writeString(appDir.resolve("jobbergate.yaml"), "application_config: {}\n");
        Files.createDirectories(appDir.resolve("templates/nested"));
        Files.writeString(appDir.resolve("templates/run.sh.j2"), "#!/bin/bash\n");
        Files.writeString(appDir.resolve("templates/nested/extra.j2"), "{{ x }}\n");
        Files.writeString(appDir.resolve("README.md"), "ignored\n");

        Path tarball = ApplicationTarball.build(appDir, buildDir);

        assertThat(tarball.getFileName().toString()).isEqualTo("jobbergate.tar.gz");
        Map<String, String> entries = read(tarball);
        assertThat(entries).containsOnlyKeys(
                "jobbergate.py", "jobbergate.yaml", "templates/nested/extra.j2", "templates/run.sh.j2");
        assertThat(entries.get("templates/run.sh.j2")).isEqualTo("#!/bin/bash\n");
    }

    @Test
    void build_missingFilesAreSkipped() throws IOException {
        Files.writeString(appDir.resolve("jobbergate.py"), "x = 1\n");

        Map<String, String> entries = read(ApplicationTarball.build(appDir, buildDir));

        assertThat(entries).containsOnlyKeys("jobbergate.py");
    }

    @Test
    void build_missingDirectory_aborts() {
        assertThatThrownBy(() -> ApplicationTarball.build(appDir.resolve("nope"), buildDir))
                .isInstanceOf(Abort.class)
                .hasMessageContaining("does not exist");
    }

    private static Map<String, String> read(Path tarball) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (InputStream file = Files.newInputStream(tarball);
             TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(file))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(tar.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
        return entries;
    }
}
