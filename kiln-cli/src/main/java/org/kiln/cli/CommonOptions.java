package org.kiln.cli;

import lombok.Getter;
import org.kiln.config.ConfigurationLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options shared by every migrate subcommand. Explicit options win over {@code kiln.yaml}.
 */
@Getter
public class CommonOptions {

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;

    @CommandLine.Option(names = {"-C", "--project-dir"}, description = "kiln.yaml 탐색을 시작할 디렉토리", defaultValue = ".")
    private Path projectDir;

    @CommandLine.Option(names = {"-s", "--schema"}, description = "스키마 정의 파일 (YAML/JSON)")
    private Path schemaPath;

    @CommandLine.Option(names = {"-m", "--migrations"}, description = "마이그레이션 디렉토리")
    private Path migrationsDir;

    @CommandLine.Option(names = {"-d", "--dialect"}, description = "사용할 DB 방언 (h2, mysql)")
    private String dialect;

    @CommandLine.Option(names = "--db-url", description = "데이터베이스 URL")
    private String dbUrl;

    @CommandLine.Option(names = "--db-user", description = "데이터베이스 사용자명")
    private String dbUser;

    @CommandLine.Option(names = "--db-password", description = "데이터베이스 비밀번호")
    private String dbPassword;

    public KilnSettings settings() {
        Path base = projectDir.toAbsolutePath().normalize();
        Map<String, String> config = new ConfigurationLoader(base).loadConfiguration(profile);
        return KilnSettings.from(config, this, base);
    }
}
