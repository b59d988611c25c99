package org.kiln.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.kiln.options.KilnOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = KilnOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = KilnOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = KilnOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    // 테스트 용
    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵 ({@link KilnOptions} 키)
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<LoadedConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            log.debug("No {} found above {}, using defaults", CONFIG_FILE_NAME, startDirectory);
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 kiln.yaml을 찾습니다.
     */
    private Optional<LoadedConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    KilnConfiguration config = yamlMapper.readValue(configFile.toFile(), KilnConfiguration.class);
                    return Optional.of(new LoadedConfiguration(configFile, config));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(LoadedConfiguration loaded, String profile) {
        var profileConfig = loaded.config().getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in {}. Using defaults.", profile, loaded.file());
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());
        Path baseDir = loaded.file().getParent();

        var naming = profileConfig.getNaming();
        if (naming != null) {
            putIfPresent(configMap, KilnOptions.Naming.MAX_LENGTH_KEY, naming.getMaxLength());
            putIfPresent(configMap, KilnOptions.Naming.STRATEGY_KEY, naming.getStrategy());
        }

        var database = profileConfig.getDatabase();
        if (database != null) {
            putIfPresent(configMap, KilnOptions.Database.DIALECT_KEY, database.getDialect());
            putIfPresent(configMap, KilnOptions.Database.URL_KEY, database.getUrl());
            putIfPresent(configMap, KilnOptions.Database.USERNAME_KEY, database.getUsername());
            putIfPresent(configMap, KilnOptions.Database.PASSWORD_KEY, database.getPassword());
        }

        // 상대 경로는 kiln.yaml 위치 기준
        if (profileConfig.getSchema() != null && profileConfig.getSchema().getPath() != null) {
            configMap.put(KilnOptions.Schema.PATH_KEY, resolve(baseDir, profileConfig.getSchema().getPath()));
        } else {
            configMap.put(KilnOptions.Schema.PATH_KEY, resolve(baseDir, KilnOptions.Schema.PATH_DEFAULT));
        }
        if (profileConfig.getMigrations() != null && profileConfig.getMigrations().getDirectory() != null) {
            configMap.put(KilnOptions.Migrations.DIRECTORY_KEY, resolve(baseDir, profileConfig.getMigrations().getDirectory()));
        } else {
            configMap.put(KilnOptions.Migrations.DIRECTORY_KEY, resolve(baseDir, KilnOptions.Migrations.DIRECTORY_DEFAULT));
        }

        if (profileConfig.getQuery() != null) {
            putIfPresent(configMap, KilnOptions.Query.TIMEOUT_KEY, profileConfig.getQuery().getTimeoutSeconds());
        }

        log.debug("Loaded profile '{}' from {}", profile, loaded.file());
        return configMap;
    }

    private static void putIfPresent(Map<String, String> map, String key, Object value) {
        if (value != null) {
            map.put(key, String.valueOf(value));
        }
    }

    private static String resolve(Path baseDir, String path) {
        Path p = Paths.get(path);
        return (p.isAbsolute() || baseDir == null) ? p.toString() : baseDir.resolve(p).normalize().toString();
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                KilnOptions.Naming.MAX_LENGTH_KEY, String.valueOf(KilnOptions.Naming.MAX_LENGTH_DEFAULT),
                KilnOptions.Naming.STRATEGY_KEY, KilnOptions.Naming.STRATEGY_DEFAULT,
                KilnOptions.Schema.PATH_KEY, KilnOptions.Schema.PATH_DEFAULT,
                KilnOptions.Migrations.DIRECTORY_KEY, KilnOptions.Migrations.DIRECTORY_DEFAULT,
                KilnOptions.Query.TIMEOUT_KEY, String.valueOf(KilnOptions.Query.TIMEOUT_DEFAULT)
        );
    }

    private record LoadedConfiguration(Path file, KilnConfiguration config) {}
}
