package org.kiln.cli.service;

import org.kiln.cli.KilnSettings;
import org.kiln.error.KilnException;
import org.kiln.migration.DdlGenerator;
import org.kiln.migration.DialectRegistry;
import org.kiln.migration.Migration;
import org.kiln.migration.MigrationRepository;
import org.kiln.migration.differs.DestructiveChange;
import org.kiln.migration.differs.DestructiveChangeAnalyzer;
import org.kiln.migration.differs.DiffResult;
import org.kiln.migration.differs.SchemaDiffer;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.model.SchemaSnapshot;
import org.kiln.naming.DefaultNaming;
import org.kiln.schema.SchemaParser;
import org.kiln.spi.naming.NamingStrategy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the schema definition and the local migration history, and plans the next migration.
 */
public class SchemaIoService {

    private final KilnSettings settings;
    private final MigrationRepository repository;

    public SchemaIoService(KilnSettings settings) {
        this.settings = settings;
        this.repository = new MigrationRepository(settings.getMigrationsDir());
    }

    public MigrationRepository getRepository() {
        return repository;
    }

    /**
     * Parses the schema definition file.
     *
     * @throws org.kiln.error.SchemaException when the definition is invalid
     */
    public SchemaSnapshot loadCurrentSchema() throws IOException {
        Path path = settings.getSchemaPath();
        if (!Files.exists(path)) {
            throw new KilnException("Schema definition not found: " + path);
        }
        SchemaParser parser = new SchemaParser(
                NamingStrategy.fromKeyword(settings.getNamingStrategy()),
                new DefaultNaming(settings.getMaxLength()));
        return parser.parse(path);
    }

    public List<Migration> loadHistory() throws IOException {
        return repository.loadHistory();
    }

    /**
     * Difference between the newest migration's snapshot and the schema definition.
     */
    public Plan plan() throws IOException {
        SchemaSnapshot previous = repository.latestSnapshot();
        SchemaSnapshot current = loadCurrentSchema();
        DiffResult diff = new SchemaDiffer().diff(previous, current);
        List<ChangeOperation> operations = diff.operations();
        return new Plan(current, diff, operations, new DestructiveChangeAnalyzer().analyze(operations));
    }

    public List<String> render(List<ChangeOperation> operations) {
        return new DdlGenerator(DialectRegistry.resolve(settings.requireDialect())).plan(operations);
    }

    public Path write(Plan plan, String label) throws IOException {
        String dialect = settings.requireDialect();
        Migration migration = Migration.of(repository.newMigrationName(label), plan.operations(), plan.current());
        List<String> statements = new DdlGenerator(DialectRegistry.resolve(dialect)).plan(migration.getName(), migration.getOperations());
        return repository.write(migration, DdlGenerator.render(statements), dialect);
    }

    public record Plan(SchemaSnapshot current, DiffResult diff, List<ChangeOperation> operations,
                       List<DestructiveChange> destructiveChanges) {
        public boolean isEmpty() {
            return operations.isEmpty();
        }
    }
}
