package org.kiln.cli;

import org.kiln.cli.service.SchemaIoService;
import org.kiln.migration.DdlGenerator;
import org.kiln.migration.operation.ChangeOperation;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Shows what the next migration would contain, without writing anything.
 */
@CommandLine.Command(
        name = "diff",
        mixinStandardHelpOptions = true,
        description = "마지막 마이그레이션 이후 스키마 정의의 변경 사항을 출력합니다."
)
public class DiffCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions options;

    @CommandLine.Option(names = "--sql", description = "변경 사항을 SQL로도 출력합니다.")
    private boolean showSql;

    @Override
    public Integer call() {
        try {
            KilnSettings settings = options.settings();
            SchemaIoService schemaIo = new SchemaIoService(settings);
            SchemaIoService.Plan plan = schemaIo.plan();
            if (plan.isEmpty()) {
                System.out.println("No changes detected.");
                return 0;
            }
            System.out.println("Pending changes (" + plan.operations().size() + "):");
            for (ChangeOperation op : plan.operations()) {
                System.out.println("  " + op.describe());
            }
            plan.diff().getWarnings().forEach(w -> System.out.println("  note: " + w));
            Output.printDestructive(plan.destructiveChanges());
            if (showSql) {
                System.out.println();
                System.out.print(DdlGenerator.render(schemaIo.render(plan.operations())));
            }
            return 0;
        } catch (Exception e) {
            return Output.fail("Diff failed", e);
        }
    }
}
