package org.kiln.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw, unvalidated shape of a schema definition file. {@link SchemaParser} turns it into a
 * {@link org.kiln.model.SchemaSnapshot}.
 */
@Data
public class SchemaDefinition {

    @JsonProperty("version")
    private String version;

    @JsonProperty("entities")
    private Map<String, EntityDefinition> entities = new LinkedHashMap<>();

    @Data
    public static class EntityDefinition {

        @JsonProperty("table")
        private String table;

        @JsonProperty("fields")
        private Map<String, FieldDefinition> fields = new LinkedHashMap<>();

        @JsonProperty("relations")
        private Map<String, RelationDefinition> relations = new LinkedHashMap<>();

        @JsonProperty("constraints")
        private List<ConstraintDefinition> constraints = new ArrayList<>();
    }

    @Data
    public static class FieldDefinition {

        @JsonProperty("type")
        private String type;

        @JsonProperty("column")
        private String column;

        @JsonProperty("length")
        private Integer length;

        @JsonProperty("nullable")
        private boolean nullable;

        @JsonProperty("unique")
        private boolean unique;

        @JsonProperty("identity")
        private boolean identity;

        /**
         * 정적 기본값 (문자열 리터럴로 보관, 필드 타입으로 검증)
         */
        @JsonProperty("default")
        private String defaultValue;

        @JsonProperty("onCreate")
        private String onCreate;

        @JsonProperty("onUpdate")
        private String onUpdate;
    }

    @Data
    public static class RelationDefinition {

        @JsonProperty("target")
        private String target;

        /**
         * oneToMany | oneToOne. 생략 시 외래키 컬럼의 unique 여부로 결정
         */
        @JsonProperty("cardinality")
        private String cardinality;

        @JsonProperty("foreignKey")
        private String foreignKey;

        @JsonProperty("references")
        private String references;

        @JsonProperty("onDelete")
        private String onDelete;

        @JsonProperty("mappedBy")
        private String mappedBy;
    }

    @Data
    public static class ConstraintDefinition {

        @JsonProperty("name")
        private String name;

        @JsonProperty("unique")
        private List<String> unique = new ArrayList<>();
    }
}
