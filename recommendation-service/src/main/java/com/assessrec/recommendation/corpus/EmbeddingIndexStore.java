package com.assessrec.recommendation.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persists the corpus embedding matrix so restarts skip re-embedding every record.
 *
 * <p>Layout: magic, format version, model name, corpus fingerprint, row count, dimension, then
 * rows of floats.
 */
public class EmbeddingIndexStore {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingIndexStore.class);
    private static final int MAGIC = 0x41534958;
    private static final int FORMAT_VERSION = 2;

    public Optional<StoredIndex> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            if (in.readInt() != MAGIC) {
                log.warn("embedding index {} has an unknown header, ignoring it", path);
                return Optional.empty();
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                log.warn("embedding index {} has format version {}, expected {}", path, version, FORMAT_VERSION);
                return Optional.empty();
            }
            String model = in.readUTF();
            String fingerprint = in.readUTF();
            int rows = in.readInt();
            int dimension = in.readInt();
            if (rows < 0 || dimension <= 0) {
                log.warn("embedding index {} declares rows={} dimension={}, ignoring it", path, rows, dimension);
                return Optional.empty();
            }
            long fileBytes = Files.size(path);
            long payloadBytes = fileBytes - (4L * Integer.BYTES + utfLength(model) + utfLength(fingerprint));
            if (payloadBytes % Float.BYTES != 0 || (long) rows * dimension != payloadBytes / Float.BYTES) {
                log.warn("embedding index {} declares rows={} dimension={} but holds {} bytes, ignoring it",
                        path, rows, dimension, fileBytes);
                return Optional.empty();
            }
            List<float[]> vectors = new ArrayList<>(rows);
            for (int r = 0; r < rows; r++) {
                float[] row = new float[dimension];
                for (int c = 0; c < dimension; c++) {
                    row[c] = in.readFloat();
                }
                vectors.add(row);
            }
            log.info("embedding index loaded path={} rows={} dimension={} model={}", path, rows, dimension, model);
            return Optional.of(new StoredIndex(model, fingerprint, dimension, vectors));
        } catch (IOException ex) {
            log.warn("embedding index {} is unreadable, it will be rebuilt: {}", path, ex.toString());
            return Optional.empty();
        }
    }

    public void save(Path path, String model, String fingerprint, List<float[]> vectors) throws IOException {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("refusing to save an empty embedding index");
        }
        int dimension = vectors.get(0).length;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp)))) {
            out.writeInt(MAGIC);
            out.writeInt(FORMAT_VERSION);
            out.writeUTF(model == null ? "" : model);
            out.writeUTF(fingerprint == null ? "" : fingerprint);
            out.writeInt(vectors.size());
            out.writeInt(dimension);
            for (float[] row : vectors) {
                if (row.length != dimension) {
                    throw new IllegalArgumentException("ragged embedding matrix");
                }
                for (float v : row) {
                    out.writeFloat(v);
                }
            }
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("embedding index saved path={} rows={} dimension={}", path, vectors.size(), dimension);
    }

    // writeUTF stores a two-byte length followed by modified UTF-8.
    private static long utfLength(String value) {
        long bytes = 2;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 0x0001 && c <= 0x007F) {
                bytes += 1;
            } else if (c <= 0x07FF) {
                bytes += 2;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }

    public record StoredIndex(String model, String fingerprint, int dimension, List<float[]> vectors) {

        public int rows() {
            return vectors.size();
        }
    }
}
