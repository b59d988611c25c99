package org.kiln.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for Kiln.
 */
@CommandLine.Command(
        name = "kiln",
        mixinStandardHelpOptions = true,
        version = "kiln 0.1.0",
        description = "스키마 정의 기반의 마이그레이션 및 데이터 접근 툴",
        subcommands = {
                MigrateCommand.class
        }
)
public class KilnCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new KilnCli()).execute(args);
        System.exit(exitCode);
    }
}
