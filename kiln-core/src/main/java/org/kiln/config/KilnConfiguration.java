package org.kiln.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

@Data
public class KilnConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("naming")
        private NamingConfiguration naming;

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("schema")
        private SchemaConfiguration schema;

        @JsonProperty("migrations")
        private MigrationsConfiguration migrations;

        @JsonProperty("query")
        private QueryConfiguration query;
    }

    @Data
    public static class NamingConfiguration {

        @JsonProperty("maxLength")
        private Integer maxLength;

        @JsonProperty("strategy")
        private String strategy;
    }

    /**
     * 데이터베이스 관련 설정
     */
    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("dialect")
        private String dialect;

        @JsonProperty("url")
        private String url;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;
    }

    @Data
    public static class SchemaConfiguration {

        @JsonProperty("path")
        private String path;
    }

    @Data
    public static class MigrationsConfiguration {

        @JsonProperty("directory")
        private String directory;
    }

    @Data
    public static class QueryConfiguration {

        @JsonProperty("timeoutSeconds")
        private Integer timeoutSeconds;
    }
}
