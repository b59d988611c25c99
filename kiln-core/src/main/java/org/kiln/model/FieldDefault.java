package org.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Optional;

/**
 * Default-value policy of a field: nothing, a static constant, or a generator that runs
 * when the record is created or updated.
 */
@Value
@Builder
@Jacksonized
public class FieldDefault {

    public enum Kind { NONE, STATIC, ON_CREATE, ON_UPDATE }

    public enum Generator {
        NOW, UUID, AUTOINCREMENT;

        public static Optional<Generator> fromKeyword(String raw) {
            if (raw == null) return Optional.empty();
            String k = raw.trim().toLowerCase(Locale.ROOT).replace("()", "");
            return switch (k) {
                case "now" -> Optional.of(NOW);
                case "uuid" -> Optional.of(UUID);
                case "autoincrement", "auto_increment", "identity" -> Optional.of(AUTOINCREMENT);
                default -> Optional.empty();
            };
        }
    }

    @Builder.Default Kind kind = Kind.NONE;
    @Builder.Default String literal = null;
    @Builder.Default Generator generator = null;

    public static FieldDefault none() {
        return FieldDefault.builder().build();
    }

    public static FieldDefault literal(String literal) {
        return FieldDefault.builder().kind(Kind.STATIC).literal(literal).build();
    }

    public static FieldDefault onCreate(Generator generator) {
        return FieldDefault.builder().kind(Kind.ON_CREATE).generator(generator).build();
    }

    public static FieldDefault onUpdate(Generator generator) {
        return FieldDefault.builder().kind(Kind.ON_UPDATE).generator(generator).build();
    }

    @JsonIgnore
    public boolean isNone() {
        return kind == Kind.NONE;
    }

    @JsonIgnore
    public boolean isStatic() {
        return kind == Kind.STATIC;
    }

    @JsonIgnore
    public boolean isAutoIncrement() {
        return kind == Kind.ON_CREATE && generator == Generator.AUTOINCREMENT;
    }

    /**
     * Generators the client evaluates itself (everything except store-side autoincrement).
     */
    @JsonIgnore
    public boolean isClientGenerated() {
        return (kind == Kind.ON_CREATE || kind == Kind.ON_UPDATE) && generator != Generator.AUTOINCREMENT;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case STATIC -> "'" + literal + "'";
            case ON_CREATE -> "onCreate(" + generator + ")";
            case ON_UPDATE -> "onUpdate(" + generator + ")";
        };
    }
}
