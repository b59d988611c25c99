package org.kiln.cli;

import org.kiln.error.KilnException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KilnSettingsTest {

    @TempDir
    Path tempDir;

    private KilnSettings settings(String... args) {
        CommonOptions options = new CommonOptions();
        new CommandLine(options).parseArgs(args);
        return options.settings();
    }

    @Test
    @DisplayName("kiln.yaml 값이 적용되고 CLI 옵션이 우선한다")
    void cliOverridesConfigFile() throws IOException {
        Files.writeString(tempDir.resolve("kiln.yaml"), """
                profiles:
                  dev:
                    naming:
                      maxLength: 40
                      strategy: snake_case
                    database:
                      url: jdbc:mysql://localhost:3306/app
                      username: app
                    schema:
                      path: db/schema.yaml
                    query:
                      timeoutSeconds: 5
                """);

        KilnSettings fromFile = settings("-C", tempDir.toString());
        KilnSettings overridden = settings("-C", tempDir.toString(), "--db-url", "jdbc:h2:mem:x", "--db-user", "sa");

        assertThat(fromFile.getMaxLength()).isEqualTo(40);
        assertThat(fromFile.getNamingStrategy()).isEqualTo("snake_case");
        assertThat(fromFile.getQueryTimeoutSeconds()).isEqualTo(5);
        assertThat(fromFile.getSchemaPath()).isEqualTo(tempDir.resolve("db/schema.yaml"));
        assertThat(fromFile.getMigrationsDir()).isEqualTo(tempDir.resolve("migrations"));
        assertThat(fromFile.requireDialect()).isEqualTo("mysql");

        assertThat(overridden.getUrl()).isEqualTo("jdbc:h2:mem:x");
        assertThat(overridden.getUsername()).isEqualTo("sa");
        assertThat(overridden.requireDialect()).isEqualTo("h2");
    }

    @Test
    @DisplayName("지정한 프로파일을 사용한다")
    void usesSelectedProfile() throws IOException {
        Files.writeString(tempDir.resolve("kiln.yaml"), """
                profiles:
                  dev:
                    database:
                      dialect: h2
                  prod:
                    database:
                      dialect: mysql
                      url: jdbc:mysql://db:3306/app
                """);

        assertThat(settings("-C", tempDir.toString(), "--profile", "prod").getDialect()).isEqualTo("mysql");
        assertThat(settings("-C", tempDir.toString(), "--profile", "dev").getDialect()).isEqualTo("h2");
    }

    @Test
    @DisplayName("URL과 방언이 없으면 명확한 오류")
    void missingDatabaseSettings() {
        KilnSettings empty = KilnSettings.builder().build();

        assertThatThrownBy(empty::requireUrl)
                .isInstanceOf(KilnException.class)
                .hasMessageContaining("--db-url");
        assertThatThrownBy(empty::requireDialect)
                .isInstanceOf(KilnException.class)
                .hasMessageContaining("--dialect");
    }
}
