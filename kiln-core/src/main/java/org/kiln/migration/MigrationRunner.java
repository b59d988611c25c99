package org.kiln.migration;

import lombok.extern.slf4j.Slf4j;
import org.kiln.error.ApplyException;
import org.kiln.error.DestructiveChangeException;
import org.kiln.error.LedgerCorruptedException;
import org.kiln.migration.differs.DestructiveChange;
import org.kiln.migration.differs.DestructiveChangeAnalyzer;
import org.kiln.migration.ledger.MigrationLedger;
import org.kiln.store.JdbcStore;
import org.kiln.store.SqlErrorTranslator;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies migrations to a store and keeps its ledger.
 *
 * <p>Migrations against the same store are serialized by an in-process lock keyed by
 * {@link JdbcStore#getIdentity()}. Across processes the ledger's primary key on the
 * migration name decides the winner; a loser re-reads the ledger and reports a no-op.
 *
 * <p>H2 and MySQL commit DDL implicitly, so on those stores a failed migration can leave
 * the statements before the failing one in place. No ledger row is written in that case.
 */
@Slf4j
public class MigrationRunner {
    private static final ConcurrentMap<String, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final MigrationLedger ledger;
    private final DestructiveChangeAnalyzer analyzer;
    private final Clock clock;

    public MigrationRunner() {
        this(new MigrationLedger(), new DestructiveChangeAnalyzer(), Clock.systemDefaultZone());
    }

    public MigrationRunner(MigrationLedger ledger, DestructiveChangeAnalyzer analyzer, Clock clock) {
        this.ledger = ledger;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    /**
     * Applies one migration. Re-applying a recorded migration with the same checksum is a
     * no-op.
     *
     * @throws DestructiveChangeException before touching the store, when the migration may
     *                                    lose data and {@code options} does not accept that
     * @throws LedgerCorruptedException   when the ledger holds the name with another checksum
     * @throws ApplyException             when planning or executing fails
     */
    public ApplyResult apply(JdbcStore store, Migration migration, ApplyOptions options) {
        checkDestructive(migration, options);
        ReentrantLock lock = lockFor(store);
        lock.lock();
        try {
            List<MigrationRecord> applied = readLedger(store, migration.getName());
            return applyLocked(store, migration, applied);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies every migration of {@code history} the store has not seen, in order. The
     * ledger must be a prefix of the history.
     */
    public List<ApplyResult> deploy(JdbcStore store, List<Migration> history, ApplyOptions options) {
        ReentrantLock lock = lockFor(store);
        lock.lock();
        try {
            List<MigrationRecord> applied = readLedger(store, null);
            verifyPrefix(applied, history);
            List<Migration> pending = history.subList(applied.size(), history.size());
            // 하나라도 확인되지 않은 파괴적 변경이 있으면 아무것도 적용하지 않는다
            for (Migration m : pending) {
                checkDestructive(m, options);
            }
            List<ApplyResult> results = new ArrayList<>();
            for (Migration m : pending) {
                ApplyResult r = applyLocked(store, m, applied);
                results.add(r);
                applied = append(applied, r.record());
            }
            log.info("Deployed {} migration(s), {} already applied", pending.size(), history.size() - pending.size());
            return results;
        } finally {
            lock.unlock();
        }
    }

    public MigrationStatus status(JdbcStore store, List<Migration> history) {
        List<MigrationRecord> applied = readLedger(store, null);
        verifyPrefix(applied, history);
        return new MigrationStatus(applied, history.subList(applied.size(), history.size()));
    }

    public List<MigrationRecord> history(JdbcStore store) {
        return readLedger(store, null);
    }

    private ApplyResult applyLocked(JdbcStore store, Migration migration, List<MigrationRecord> applied) {
        String name = migration.getName();
        Optional<MigrationRecord> existing = find(applied, name);
        if (existing.isPresent()) {
            return noopOrCorrupted(existing.get(), migration);
        }

        DdlGenerator generator = new DdlGenerator(store.getDialect());
        DdlPlan plan = generator.planWithOwners(name, migration.getOperations());
        List<String> statements = plan.statements();
        MigrationRecord record = new MigrationRecord(name, nextSequence(applied), migration.getChecksum(),
                LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS), migration.getOperations().size());

        List<String> attempted = new ArrayList<>();
        try {
            store.inTransaction(session -> {
                ledger.ensureTable(session, store.getDialect());
                for (String sql : statements) {
                    attempted.add(sql);
                    session.execute(sql);
                }
                ledger.append(session, store.getDialect(), record);
                return null;
            });
        } catch (SQLException e) {
            Optional<MigrationRecord> concurrent = recordedConcurrently(store, migration, e);
            if (concurrent.isPresent()) {
                log.info("Migration {} was applied concurrently; nothing to do", name);
                return ApplyResult.noop(concurrent.get());
            }
            throw new ApplyException(kindOf(e), name, plan.operationsReached(attempted.size()), attempted, e.getMessage(), e);
        }
        log.info("Applied migration {} ({} operations, {} statements)", name, record.operationCount(), statements.size());
        return ApplyResult.applied(record, statements);
    }

    private Optional<MigrationRecord> recordedConcurrently(JdbcStore store, Migration migration, SQLException failure) {
        try {
            List<MigrationRecord> current = store.withSession(s -> ledger.read(s, store.getDialect()));
            Optional<MigrationRecord> record = find(current, migration.getName());
            if (record.isPresent() && record.get().checksum().equals(migration.getChecksum())) {
                return record;
            }
        } catch (SQLException reread) {
            failure.addSuppressed(reread);
        }
        return Optional.empty();
    }

    private ApplyResult noopOrCorrupted(MigrationRecord record, Migration migration) {
        if (!record.checksum().equals(migration.getChecksum())) {
            throw new LedgerCorruptedException(migration.getName(),
                    "Migration '" + migration.getName() + "' was applied with checksum " + record.checksum()
                            + " but the local copy has " + migration.getChecksum());
        }
        log.debug("Migration {} already applied as #{}", record.migrationName(), record.sequence());
        return ApplyResult.noop(record);
    }

    private void checkDestructive(Migration migration, ApplyOptions options) {
        if (options.isAcceptDataLoss()) {
            return;
        }
        List<DestructiveChange> changes = analyzer.analyze(migration.getOperations());
        if (!changes.isEmpty()) {
            throw new DestructiveChangeException(migration.getName(), changes);
        }
    }

    private List<MigrationRecord> readLedger(JdbcStore store, String migrationName) {
        try {
            return store.withSession(s -> ledger.read(s, store.getDialect()));
        } catch (SQLException e) {
            throw new ApplyException(kindOf(e), migrationName, List.of(), "Failed to read migration ledger: " + e.getMessage(), e);
        }
    }

    static void verifyPrefix(List<MigrationRecord> applied, List<Migration> history) {
        for (int i = 0; i < applied.size(); i++) {
            MigrationRecord record = applied.get(i);
            if (i >= history.size()) {
                throw new LedgerCorruptedException(record.migrationName(),
                        "Store has migration '" + record.migrationName() + "' which is not in the local history");
            }
            Migration local = history.get(i);
            if (!local.getName().equals(record.migrationName())) {
                throw new LedgerCorruptedException(record.migrationName(),
                        "Ledger entry #" + record.sequence() + " is '" + record.migrationName()
                                + "' but local history has '" + local.getName() + "' at that position");
            }
            if (!local.getChecksum().equals(record.checksum())) {
                throw new LedgerCorruptedException(record.migrationName(),
                        "Checksum mismatch for '" + record.migrationName() + "': ledger " + record.checksum()
                                + ", local " + local.getChecksum());
            }
        }
    }

    static ApplyException.Kind kindOf(SQLException e) {
        return switch (SqlErrorTranslator.classify(e)) {
            case CONSTRAINT_VIOLATION -> ApplyException.Kind.CONSTRAINT_VIOLATION;
            case CONNECTION_LOST -> ApplyException.Kind.CONNECTION_LOST;
            case CANCELLED, OTHER -> ApplyException.Kind.STATEMENT_FAILED;
        };
    }

    private static Optional<MigrationRecord> find(List<MigrationRecord> records, String name) {
        return records.stream().filter(r -> r.migrationName().equals(name)).findFirst();
    }

    private static int nextSequence(List<MigrationRecord> applied) {
        return applied.stream().mapToInt(MigrationRecord::sequence).max().orElse(0) + 1;
    }

    private static List<MigrationRecord> append(List<MigrationRecord> records, MigrationRecord record) {
        List<MigrationRecord> out = new ArrayList<>(records);
        out.add(record);
        return out;
    }

    private static ReentrantLock lockFor(JdbcStore store) {
        return LOCKS.computeIfAbsent(store.getIdentity(), k -> new ReentrantLock());
    }
}
