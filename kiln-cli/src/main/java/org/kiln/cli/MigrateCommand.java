package org.kiln.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        description = "마이그레이션 생성, 배포, 상태 확인 및 검증",
        subcommands = {
                DiffCommand.class,
                CreateCommand.class,
                DeployCommand.class,
                StatusCommand.class,
                VerifyCommand.class
        }
)
public class MigrateCommand {

}
