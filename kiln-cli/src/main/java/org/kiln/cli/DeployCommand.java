package org.kiln.cli;

import org.kiln.cli.service.SchemaIoService;
import org.kiln.cli.service.StoreService;
import org.kiln.error.ApplyException;
import org.kiln.error.DestructiveChangeException;
import org.kiln.error.LedgerCorruptedException;
import org.kiln.migration.ApplyResult;
import org.kiln.migration.Migration;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Applies pending migrations to the configured store.
 */
@CommandLine.Command(
        name = "deploy",
        mixinStandardHelpOptions = true,
        description = "적용되지 않은 마이그레이션을 데이터베이스에 순서대로 적용합니다."
)
public class DeployCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions options;

    @CommandLine.Option(names = "--accept-data-loss", description = "데이터 손실 위험이 있는 변경 사항(컬럼 삭제, 타입 축소 등)을 적용합니다.")
    private boolean acceptDataLoss;

    @Override
    public Integer call() {
        try {
            KilnSettings settings = options.settings();
            List<Migration> history = new SchemaIoService(settings).loadHistory();
            List<ApplyResult> results = new StoreService(settings).deploy(history, acceptDataLoss);
            if (results.isEmpty()) {
                System.out.println("Database is up to date (" + history.size() + " migrations).");
                return 0;
            }
            for (ApplyResult r : results) {
                System.out.println((r.applied() ? "Applied " : "Already applied ") + r.record().migrationName()
                        + " (#" + r.record().sequence() + ", " + r.statements().size() + " statements)");
            }
            return 0;
        } catch (DestructiveChangeException e) {
            System.err.println("Deploy aborted: migration '" + e.getMigrationName() + "' may lose data.");
            Output.printDestructive(e.getChanges());
            System.err.println("\n   To proceed anyway, use the --accept-data-loss option.");
            return 1;
        } catch (LedgerCorruptedException e) {
            System.err.println("Ledger mismatch: " + e.getMessage());
            return 1;
        } catch (ApplyException e) {
            System.err.println("Deploy failed: " + e.getMessage());
            if (!e.getAttemptedOperations().isEmpty()) {
                System.err.println("   Operations reached:");
                e.getAttemptedOperations().forEach(op -> System.err.println("     " + op.describe()));
            }
            if (!e.getAttemptedStatements().isEmpty()) {
                System.err.println("   Statements attempted:");
                e.getAttemptedStatements().forEach(s -> System.err.println("     " + s));
            }
            return 1;
        } catch (Exception e) {
            return Output.fail("Deploy failed", e);
        }
    }
}
