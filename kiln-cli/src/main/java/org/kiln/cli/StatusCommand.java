package org.kiln.cli;

import org.kiln.cli.service.SchemaIoService;
import org.kiln.cli.service.StoreService;
import org.kiln.migration.Migration;
import org.kiln.migration.MigrationRecord;
import org.kiln.migration.MigrationStatus;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "적용된 마이그레이션과 대기 중인 마이그레이션을 출력합니다."
)
public class StatusCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions options;

    @Override
    public Integer call() {
        try {
            KilnSettings settings = options.settings();
            List<Migration> history = new SchemaIoService(settings).loadHistory();
            MigrationStatus status = new StoreService(settings).status(history);

            System.out.println("Applied (" + status.applied().size() + "):");
            for (MigrationRecord r : status.applied()) {
                System.out.println("  #" + r.sequence() + " " + r.migrationName() + "  " + r.appliedAt());
            }
            System.out.println("Pending (" + status.pending().size() + "):");
            for (Migration m : status.pending()) {
                System.out.println("  " + m.getName());
            }
            return 0;
        } catch (Exception e) {
            return Output.fail("Status failed", e);
        }
    }
}
