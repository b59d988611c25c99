package org.kiln.cli.service;

import org.kiln.cli.KilnSettings;
import org.kiln.error.KilnException;
import org.kiln.migration.ApplyOptions;
import org.kiln.migration.ApplyResult;
import org.kiln.migration.Migration;
import org.kiln.migration.MigrationRecord;
import org.kiln.migration.MigrationRunner;
import org.kiln.migration.MigrationStatus;
import org.kiln.migration.introspect.SchemaIntrospector;
import org.kiln.migration.introspect.StructuralShape;
import org.kiln.model.SchemaSnapshot;
import org.kiln.store.JdbcStore;

import java.sql.SQLException;
import java.util.List;

/**
 * Talks to the configured store: deploys migrations, reports the ledger and checks drift.
 */
public class StoreService {

    private final KilnSettings settings;
    private final MigrationRunner runner;

    public StoreService(KilnSettings settings) {
        this(settings, new MigrationRunner());
    }

    public StoreService(KilnSettings settings, MigrationRunner runner) {
        this.settings = settings;
        this.runner = runner;
    }

    public JdbcStore open() {
        try {
            return JdbcStore.connect(settings.requireUrl(), settings.getUsername(), settings.getPassword(),
                    settings.getDialect(), settings.getQueryTimeoutSeconds());
        } catch (SQLException e) {
            throw new KilnException("Cannot connect to " + settings.getUrl() + ": " + e.getMessage(), e);
        }
    }

    public List<ApplyResult> deploy(List<Migration> history, boolean acceptDataLoss) {
        ApplyOptions options = acceptDataLoss ? ApplyOptions.acceptingDataLoss() : ApplyOptions.defaults();
        return runner.deploy(open(), history, options);
    }

    public MigrationStatus status(List<Migration> history) {
        return runner.status(open(), history);
    }

    /**
     * Differences between the store and the snapshot of the last migration it recorded.
     */
    public List<String> verify(List<Migration> history) {
        JdbcStore store = open();
        MigrationStatus status = runner.status(store, history);
        SchemaSnapshot expected = SchemaSnapshot.empty();
        if (!status.applied().isEmpty()) {
            MigrationRecord last = status.applied().get(status.applied().size() - 1);
            expected = history.stream()
                    .filter(m -> m.getName().equals(last.migrationName()))
                    .findFirst()
                    .map(Migration::getSnapshot)
                    .orElseThrow(() -> new KilnException("Applied migration " + last.migrationName() + " is not in the local history"));
        }
        StructuralShape actual = new SchemaIntrospector().introspect(store);
        return StructuralShape.of(expected).differencesFrom(actual);
    }
}
