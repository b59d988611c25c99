package org.kiln.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kiln.error.KilnException;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.model.SchemaSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local migration history on disk. Each migration lives in its own directory
 * {@code <yyyyMMddHHmmss>_<label>} holding {@code migration.json}, {@code schema.json}
 * and {@code migration.sql}. Directory names sort chronologically.
 */
@Slf4j
public class MigrationRepository {
    public static final String MIGRATION_FILE = "migration.json";
    public static final String SCHEMA_FILE = "schema.json";
    public static final String SQL_FILE = "migration.sql";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final Pattern DIRECTORY = Pattern.compile("\\d{14}_[a-z0-9_]+");

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MigrationRepository(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    public MigrationRepository(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.objectMapper = SnapshotHasher.canonicalMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * All local migrations in chronological order. Artifacts whose operations no longer
     * match their recorded checksum are rejected.
     */
    public List<Migration> loadHistory() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> dirs;
        try (Stream<Path> s = Files.list(directory)) {
            dirs = s.filter(Files::isDirectory)
                    .filter(p -> DIRECTORY.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        }
        List<Migration> out = new ArrayList<>();
        for (Path dir : dirs) {
            out.add(load(dir));
        }
        return out;
    }

    /**
     * Snapshot produced by the newest migration, or the empty schema when there is none.
     */
    public SchemaSnapshot latestSnapshot() throws IOException {
        List<Migration> history = loadHistory();
        return history.isEmpty() ? SchemaSnapshot.empty() : history.get(history.size() - 1).getSnapshot();
    }

    /**
     * Timestamped migration name for {@code label}. The label is lower-cased and anything
     * other than letters, digits and underscores becomes {@code _}.
     */
    public String newMigrationName(String label) {
        String cleaned = label == null ? "" : label.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
        cleaned = cleaned.replaceAll("^_+|_+$", "");
        if (cleaned.isEmpty()) {
            cleaned = "migration";
        }
        return LocalDateTime.now(clock).format(STAMP) + "_" + cleaned;
    }

    public Path write(Migration migration, String renderedSql, String dialectName) throws IOException {
        if (!DIRECTORY.matcher(migration.getName()).matches()) {
            throw new IllegalArgumentException("Not a migration directory name: " + migration.getName());
        }
        Path dir = directory.resolve(migration.getName());
        if (Files.exists(dir)) {
            throw new KilnException("Migration directory already exists: " + dir);
        }
        Files.createDirectories(dir);

        MigrationFile file = new MigrationFile();
        file.setName(migration.getName());
        file.setChecksum(migration.getChecksum());
        file.setOperations(migration.getOperations());
        objectMapper.writeValue(dir.resolve(MIGRATION_FILE).toFile(), file);
        objectMapper.writeValue(dir.resolve(SCHEMA_FILE).toFile(), migration.getSnapshot());

        String header = "-- migration: " + migration.getName() + "\n"
                + "-- checksum: " + migration.getChecksum() + "\n"
                + "-- dialect: " + dialectName + "\n\n";
        Files.writeString(dir.resolve(SQL_FILE), header + renderedSql, StandardCharsets.UTF_8);
        log.info("Wrote migration {} ({} operations) to {}", migration.getName(), migration.getOperations().size(), dir);
        return dir;
    }

    private Migration load(Path dir) throws IOException {
        MigrationFile file = objectMapper.readValue(dir.resolve(MIGRATION_FILE).toFile(), MigrationFile.class);
        SchemaSnapshot snapshot = objectMapper.readValue(dir.resolve(SCHEMA_FILE).toFile(), SchemaSnapshot.class);
        String name = dir.getFileName().toString();
        if (!name.equals(file.getName())) {
            throw new KilnException("Migration " + dir + " declares name '" + file.getName() + "'");
        }
        Migration migration = Migration.of(name, file.getOperations() == null ? List.of() : file.getOperations(), snapshot);
        if (!migration.getChecksum().equals(file.getChecksum())) {
            throw new KilnException("Migration " + name + " was modified after it was created (checksum "
                    + file.getChecksum() + ", content hashes to " + migration.getChecksum() + ")");
        }
        return migration;
    }

    @Data
    @NoArgsConstructor
    static class MigrationFile {
        private String name;
        private String checksum;
        private List<ChangeOperation> operations;
    }
}
