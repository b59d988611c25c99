package org.kiln.cli;

import org.kiln.cli.service.SchemaIoService;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes the next migration into the migrations directory.
 */
@CommandLine.Command(
        name = "create",
        mixinStandardHelpOptions = true,
        description = "스키마 정의 변경 사항으로 새 마이그레이션을 생성합니다."
)
public class CreateCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions options;

    @CommandLine.Option(names = {"-n", "--name"}, required = true, description = "마이그레이션 이름 (예: add_posts)")
    private String name;

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
            Path dir = schemaIo.write(plan, name);
            System.out.println("Created migration " + dir.getFileName() + " (" + plan.operations().size() + " operations)");
            System.out.println("   " + dir);
            Output.printDestructive(plan.destructiveChanges());
            return 0;
        } catch (Exception e) {
            return Output.fail("Migration creation failed", e);
        }
    }
}
