package io.tabletalk.core.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDatasetStorageTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreUnderSanitizedKeyAndReadBack() throws Exception {
        LocalDatasetStorage storage = new LocalDatasetStorage(tempDir);

        String key = storage.store("../q1 sales.json", new byte[] {1, 2, 3});

        assertThat(key).isEqualTo(".._q1_sales.json");
        assertThat(storage.read(key)).containsExactly(1, 2, 3);
        assertThat(Files.list(tempDir)).noneMatch(p -> p.getFileName().toString().endsWith(".tmp"));
    }

    @Test
    void shouldRejectKeysOutsideRootAndMissingFiles() {
        LocalDatasetStorage storage = new LocalDatasetStorage(tempDir.resolve("files"));

        assertThatThrownBy(() -> storage.read("../outside.json"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("escapes");
        assertThatThrownBy(() -> storage.read("missing.json")).isInstanceOf(NoSuchFileException.class);
    }
}
