package com.assessrec.recommendation;

import com.assessrec.recommendation.corpus.EmbeddingIndexStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingIndexStoreTest {

    private final EmbeddingIndexStore store = new EmbeddingIndexStore();

    @Test
    void savedIndexLoadsBack(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("nested/index.bin");
        store.save(path, "all-minilm", "c0ffee", List.of(new float[]{0.6f, 0.8f}, new float[]{1.0f, 0.0f}));

        Optional<EmbeddingIndexStore.StoredIndex> loaded = store.load(path);

        assertThat(loaded).isPresent();
        assertThat(loaded.get().model()).isEqualTo("all-minilm");
        assertThat(loaded.get().fingerprint()).isEqualTo("c0ffee");
        assertThat(loaded.get().dimension()).isEqualTo(2);
        assertThat(loaded.get().rows()).isEqualTo(2);
        assertThat(loaded.get().vectors().get(0)).containsExactly(0.6f, 0.8f);
        assertThat(Files.exists(dir.resolve("nested/index.bin.tmp"))).isFalse();
    }

    @Test
    void missingFileIsEmpty(@TempDir Path dir) {
        assertThat(store.load(dir.resolve("absent.bin"))).isEmpty();
        assertThat(store.load(null)).isEmpty();
    }

    @Test
    void foreignFileIsIgnored(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("index.bin");
        Files.writeString(path, "not an embedding index", StandardCharsets.UTF_8);

        assertThat(store.load(path)).isEmpty();
    }

    @Test
    void truncatedFileIsIgnored(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("index.bin");
        store.save(path, "all-minilm", "c0ffee", List.of(new float[]{0.6f, 0.8f}, new float[]{1.0f, 0.0f}));
        byte[] bytes = Files.readAllBytes(path);
        Files.write(path, Arrays.copyOf(bytes, bytes.length - 3));

        assertThat(store.load(path)).isEmpty();
    }

    @Test
    void headerClaimingMoreRowsThanTheFileHoldsIsIgnored(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("index.bin");
        try (DataOutputStream out = new DataOutputStream(Files.newOutputStream(path))) {
            out.writeInt(0x41534958);
            out.writeInt(2);
            out.writeUTF("all-minilm");
            out.writeUTF("c0ffee");
            out.writeInt(Integer.MAX_VALUE);
            out.writeInt(384);
            out.writeFloat(1.0f);
        }

        assertThat(store.load(path)).isEmpty();
    }

    @Test
    void negativeDimensionIsIgnored(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("index.bin");
        try (DataOutputStream out = new DataOutputStream(Files.newOutputStream(path))) {
            out.writeInt(0x41534958);
            out.writeInt(2);
            out.writeUTF("all-minilm");
            out.writeUTF("");
            out.writeInt(1);
            out.writeInt(-4);
        }

        assertThat(store.load(path)).isEmpty();
    }
}
