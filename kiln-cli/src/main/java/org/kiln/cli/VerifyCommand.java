package org.kiln.cli;

import org.kiln.cli.service.SchemaIoService;
import org.kiln.cli.service.StoreService;
import org.kiln.migration.Migration;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Checks that the store's structure matches the snapshot of the last applied migration.
 */
@CommandLine.Command(
        name = "verify",
        mixinStandardHelpOptions = true,
        description = "데이터베이스에 적용된 스키마와 예상 스키마가 일치하는지 검증합니다."
)
public class VerifyCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions options;

    @Override
    public Integer call() {
        try {
            KilnSettings settings = options.settings();
            List<Migration> history = new SchemaIoService(settings).loadHistory();
            List<String> drift = new StoreService(settings).verify(history);
            if (drift.isEmpty()) {
                System.out.println("Schema is up to date");
                return 0;
            }
            System.out.println("Schema drift detected");
            drift.forEach(d -> System.out.println("   - " + d));
            System.out.println("   Run migration to synchronize.");
            return 1;
        } catch (Exception e) {
            return Output.fail("Verification failed", e);
        }
    }
}
