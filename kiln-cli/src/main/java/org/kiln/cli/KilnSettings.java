package org.kiln.cli;

import lombok.Builder;
import lombok.Value;
import org.kiln.error.KilnException;
import org.kiln.options.KilnOptions;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Resolved settings of one CLI invocation.
 */
@Value
@Builder
public class KilnSettings {
    Path schemaPath;
    Path migrationsDir;
    String dialect;
    String url;
    String username;
    String password;
    int maxLength;
    String namingStrategy;
    int queryTimeoutSeconds;

    static KilnSettings from(Map<String, String> config, CommonOptions cli, Path baseDir) {
        return KilnSettings.builder()
                .schemaPath(cli.getSchemaPath() != null
                        ? cli.getSchemaPath()
                        : baseDir.resolve(config.get(KilnOptions.Schema.PATH_KEY)))
                .migrationsDir(cli.getMigrationsDir() != null
                        ? cli.getMigrationsDir()
                        : baseDir.resolve(config.get(KilnOptions.Migrations.DIRECTORY_KEY)))
                .dialect(firstNonBlank(cli.getDialect(), config.get(KilnOptions.Database.DIALECT_KEY)))
                .url(firstNonBlank(cli.getDbUrl(), config.get(KilnOptions.Database.URL_KEY)))
                .username(firstNonBlank(cli.getDbUser(), config.get(KilnOptions.Database.USERNAME_KEY)))
                .password(firstNonBlank(cli.getDbPassword(), config.get(KilnOptions.Database.PASSWORD_KEY)))
                .maxLength(parseInt(config.get(KilnOptions.Naming.MAX_LENGTH_KEY), KilnOptions.Naming.MAX_LENGTH_DEFAULT, "maxLength"))
                .namingStrategy(config.getOrDefault(KilnOptions.Naming.STRATEGY_KEY, KilnOptions.Naming.STRATEGY_DEFAULT))
                .queryTimeoutSeconds(parseInt(config.get(KilnOptions.Query.TIMEOUT_KEY), KilnOptions.Query.TIMEOUT_DEFAULT, "timeoutSeconds"))
                .build();
    }

    /**
     * Configured dialect, or the one implied by the JDBC URL.
     */
    public String requireDialect() {
        if (dialect != null) {
            return dialect;
        }
        if (url != null) {
            String u = url.toLowerCase(Locale.ROOT);
            if (u.startsWith("jdbc:h2:")) return "h2";
            if (u.startsWith("jdbc:mysql:")) return "mysql";
        }
        throw new KilnException("No dialect configured. Set kiln.database.dialect in kiln.yaml or pass --dialect");
    }

    public String requireUrl() {
        if (url == null) {
            throw new KilnException("No database URL configured. Set database.url in kiln.yaml or pass --db-url");
        }
        return url;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        if (b != null && !b.isBlank()) return b;
        return null;
    }

    private static int parseInt(String raw, int fallback, String name) {
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            System.err.println("Warning: Invalid " + name + " in configuration: " + raw + ". Using default: " + fallback);
            return fallback;
        }
    }
}
