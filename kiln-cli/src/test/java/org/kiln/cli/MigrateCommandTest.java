package org.kiln.cli;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the migrate subcommands against a private in-memory H2 database.
 */
class MigrateCommandTest {

    static final String SCHEMA = """
            version: "1"
            entities:
              User:
                table: users
                fields:
                  id: { type: integer, identity: true, onCreate: autoincrement }
                  email: { type: text, length: 120, unique: true }
                  name: { type: text, nullable: true }
                relations:
                  posts: { target: Post, mappedBy: author }
              Post:
                table: posts
                fields:
                  id: { type: integer, identity: true, onCreate: autoincrement }
                  title: { type: text, length: 200 }
                  authorId: { type: integer, column: author_id }
                relations:
                  author: { target: User, foreignKey: authorId }
            """;

    @TempDir
    Path tempDir;

    private Path schemaFile;
    private Path migrationsDir;
    private String dbUrl;
    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        schemaFile = tempDir.resolve("schema.yaml");
        migrationsDir = tempDir.resolve("migrations");
        dbUrl = "jdbc:h2:mem:cli_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        Files.writeString(schemaFile, SCHEMA);

        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int migrate(String... args) {
        outContent.reset();
        errContent.reset();
        List<String> all = new ArrayList<>(List.of(args));
        all.addAll(List.of("-C", tempDir.toString(),
                "-s", schemaFile.toString(),
                "-m", migrationsDir.toString(),
                "--db-url", dbUrl,
                "--db-user", "sa"));
        return new CommandLine(new MigrateCommand()).execute(all.toArray(new String[0]));
    }

    private List<String> migrationNames() throws IOException {
        try (Stream<Path> s = Files.list(migrationsDir)) {
            return s.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    private void executeSql(String sql) throws SQLException {
        try (Connection c = DriverManager.getConnection(dbUrl, "sa", "");
             Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    @Test
    @DisplayName("diff → create → deploy → status → verify")
    void fullCycle() throws IOException {
        // diff
        assertThat(migrate("diff", "--sql")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8))
                .contains("Pending changes (3):")
                .contains("CREATE TABLE \"users\"")
                .contains("FOREIGN KEY");

        // create
        assertThat(migrate("create", "-n", "init")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("Created migration");
        List<String> names = migrationNames();
        assertThat(names).hasSize(1);
        assertThat(names.get(0)).matches("\\d{14}_init");
        assertThat(migrationsDir.resolve(names.get(0)).resolve("migration.sql")).exists();

        assertThat(migrate("diff")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("No changes detected.");

        // deploy
        assertThat(migrate("status")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("Applied (0):").contains("Pending (1):");

        assertThat(migrate("deploy")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("Applied " + names.get(0) + " (#1");

        assertThat(migrate("deploy")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("Database is up to date (1 migrations).");

        assertThat(migrate("status")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("#1 " + names.get(0)).contains("Pending (0):");

        // verify
        assertThat(migrate("verify")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("Schema is up to date");
    }

    @Test
    @DisplayName("verify reports drift with a non-zero exit code")
    void verifyDetectsDrift() throws SQLException {
        assertThat(migrate("create", "-n", "init")).isZero();
        assertThat(migrate("deploy")).isZero();
        executeSql("ALTER TABLE \"users\" ADD COLUMN \"nickname\" VARCHAR(40)");

        int exitCode = migrate("verify");

        assertThat(exitCode).isEqualTo(1);
        assertThat(outContent.toString(StandardCharsets.UTF_8))
                .contains("Schema drift detected")
                .contains("users: unexpected column nickname");
    }

    @Test
    @DisplayName("deploy refuses destructive migrations unless data loss is accepted")
    void destructiveDeploy() throws IOException {
        assertThat(migrate("create", "-n", "init")).isZero();
        assertThat(migrate("deploy")).isZero();
        String initName = migrationNames().get(0);

        // label sorts after "init" even when both land in the same second
        Files.writeString(schemaFile, SCHEMA.replace("      name: { type: text, nullable: true }\n", ""));
        assertThat(migrate("diff")).isZero();
        assertThat(errContent.toString(StandardCharsets.UTF_8)).contains("Potentially destructive changes");
        assertThat(migrate("create", "-n", "zz_drop_name")).isZero();
        assertThat(migrationNames()).hasSize(2).first().isEqualTo(initName);

        int refused = migrate("deploy");
        assertThat(refused).isEqualTo(1);
        assertThat(errContent.toString(StandardCharsets.UTF_8))
                .contains("may lose data")
                .contains("--accept-data-loss");

        assertThat(migrate("deploy", "--accept-data-loss")).isZero();
        assertThat(outContent.toString(StandardCharsets.UTF_8)).contains("(#2");
        assertThat(migrate("verify")).isZero();
    }

    @Test
    @DisplayName("invalid schema definitions are reported with their location")
    void invalidSchema() throws IOException {
        Files.writeString(schemaFile, """
                entities:
                  User:
                    fields:
                      id: { type: integer, identity: true }
                      avatar: { type: blob }
                """);

        int exitCode = migrate("diff");

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString(StandardCharsets.UTF_8))
                .contains("Diff failed")
                .contains("entities.User.fields.avatar.type");
    }

    @Test
    @DisplayName("Help option displays migration description")
    void testMigrateHelp() {
        ByteArrayOutputStream helpOut = new ByteArrayOutputStream();
        PrintWriter pwOut = new PrintWriter(new OutputStreamWriter(helpOut, StandardCharsets.UTF_8));

        int exitCode = new CommandLine(new MigrateCommand())
                .setOut(pwOut)
                .execute("--help");
        pwOut.flush();

        assertThat(exitCode).isZero();
        assertThat(helpOut.toString(StandardCharsets.UTF_8)).contains("마이그레이션").contains("deploy").contains("verify");
    }
}
