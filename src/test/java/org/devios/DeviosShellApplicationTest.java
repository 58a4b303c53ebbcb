package org.devios;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DeviosShellApplicationTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty("LOG_PATH");
    }

    @Test
    void ensureLogDirectory_createsConfiguredPath() {
        Path target = tempDir.resolve("nested").resolve("logs");
        System.setProperty("LOG_PATH", target.toString());

        Path created = DeviosShellApplication.ensureLogDirectory();

        assertThat(created).isEqualTo(target);
        assertThat(Files.isDirectory(target)).isTrue();
    }

    @Test
    void ensureLogDirectory_toleratesExistingDirectory() {
        System.setProperty("LOG_PATH", tempDir.toString());

        assertThat(DeviosShellApplication.ensureLogDirectory()).isEqualTo(tempDir);
    }
}
