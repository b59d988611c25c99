package org.kiln.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.kiln.error.SchemaException;
import org.kiln.error.SchemaException.Kind;
import org.kiln.model.Cardinality;
import org.kiln.model.ConstraintModel;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldDefault;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.OnDeleteAction;
import org.kiln.model.RelationModel;
import org.kiln.model.SchemaSnapshot;
import org.kiln.model.naming.CaseNormalizer;
import org.kiln.naming.DefaultNaming;
import org.kiln.naming.Naming;
import org.kiln.options.KilnOptions;
import org.kiln.schema.SchemaDefinition.ConstraintDefinition;
import org.kiln.schema.SchemaDefinition.EntityDefinition;
import org.kiln.schema.SchemaDefinition.FieldDefinition;
import org.kiln.schema.SchemaDefinition.RelationDefinition;
import org.kiln.spi.naming.NamingStrategy;
import org.kiln.spi.naming.impl.NoOpNamingStrategy;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Parses a YAML (or JSON) schema definition into a validated {@link SchemaSnapshot}.
 * <p>
 * Every structural problem is reported here as a {@link SchemaException}, so nothing
 * downstream needs to re-check the schema. Parsing has no side effects.
 */
@Slf4j
public class SchemaParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final ObjectMapper yamlMapper;
    private final NamingStrategy namingStrategy;
    private final Naming naming;
    private final CaseNormalizer normalizer = CaseNormalizer.lower();

    public SchemaParser() {
        this(new NoOpNamingStrategy(), new DefaultNaming(KilnOptions.Naming.MAX_LENGTH_DEFAULT));
    }

    public SchemaParser(NamingStrategy namingStrategy, Naming naming) {
        this.namingStrategy = Objects.requireNonNull(namingStrategy, "namingStrategy must not be null");
        this.naming = Objects.requireNonNull(naming, "naming must not be null");
        YAMLFactory factory = new YAMLFactory();
        factory.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.yamlMapper = new ObjectMapper(factory)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public SchemaSnapshot parse(String definitionSource) {
        return parse(new StringReader(definitionSource));
    }

    public SchemaSnapshot parse(Path definitionFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(definitionFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public SchemaSnapshot parse(Reader reader) {
        SchemaDefinition definition = read(reader);
        SchemaSnapshot snapshot = new Validation(definition).run();
        log.debug("Parsed schema with {} entities", snapshot.getEntities().size());
        return snapshot;
    }

    private SchemaDefinition read(Reader reader) {
        try {
            SchemaDefinition definition = yamlMapper.readValue(reader, SchemaDefinition.class);
            return definition == null ? new SchemaDefinition() : definition;
        } catch (JsonMappingException e) {
            Kind kind = isDuplicateKey(e) ? Kind.DUPLICATE_NAME : Kind.MALFORMED;
            throw new SchemaException(kind, mappingPath(e), e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            String location = e.getProcessor() instanceof JsonParser p ? contextPath(p.getParsingContext()) : "$";
            Kind kind = isDuplicateKey(e) ? Kind.DUPLICATE_NAME : Kind.MALFORMED;
            throw new SchemaException(kind, location, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SchemaException(Kind.MALFORMED, "$", "Cannot read schema definition: " + e.getMessage(), e);
        }
    }

    // strict duplicate detection fails in the parser, databind may wrap it on the way out
    private static boolean isDuplicateKey(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof JsonProcessingException jpe
                    && jpe.getOriginalMessage() != null
                    && jpe.getOriginalMessage().startsWith("Duplicate field")) {
                return true;
            }
        }
        return false;
    }

    private static String mappingPath(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) sb.append('.');
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.length() == 0 ? "$" : sb.toString();
    }

    private static String contextPath(JsonStreamContext ctx) {
        Deque<String> parts = new ArrayDeque<>();
        for (JsonStreamContext c = ctx; c != null; c = c.getParent()) {
            if (c.getCurrentName() != null) parts.addFirst(c.getCurrentName());
        }
        return parts.isEmpty() ? "$" : String.join(".", parts);
    }

    /**
     * One validation run over a definition. Holds the partially built entities while
     * relations are resolved.
     */
    private final class Validation {
        private final SchemaDefinition definition;
        private final Map<String, EntityModel.EntityModelBuilder> builders = new HashMap<>();
        private final Map<String, List<FieldModel>> fieldsByEntity = new HashMap<>();
        private final Map<String, String> tableByEntity = new HashMap<>();
        // owning relations resolved in pass 2, read back by inverse relations in pass 3
        private final Map<String, Map<String, RelationModel>> owningByEntity = new HashMap<>();
        private final Map<String, String> generatedNames = new HashMap<>();

        Validation(SchemaDefinition definition) {
            this.definition = definition;
        }

        SchemaSnapshot run() {
            Map<String, EntityDefinition> entities = definition.getEntities() == null ? Map.of() : definition.getEntities();

            Map<String, String> seenEntities = new HashMap<>();
            Map<String, String> seenTables = new HashMap<>();
            for (var e : entities.entrySet()) {
                String name = e.getKey();
                String location = "entities." + name;
                requireIdentifier(name, location);
                if (e.getValue() == null) {
                    throw new SchemaException(Kind.MALFORMED, location, "Entity has no body");
                }
                String previous = seenEntities.putIfAbsent(normalizer.normalize(name), name);
                if (previous != null) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location,
                            "Entity name '" + name + "' clashes with '" + previous + "'");
                }
                String table = e.getValue().getTable() != null ? e.getValue().getTable() : namingStrategy.toPhysicalTableName(name);
                requireIdentifier(table, location + ".table");
                if (table.equalsIgnoreCase(KilnOptions.Migrations.LEDGER_TABLE)) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location + ".table", "Table name is reserved: " + table);
                }
                String previousTable = seenTables.putIfAbsent(normalizer.normalize(table), name);
                if (previousTable != null) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location + ".table",
                            "Table '" + table + "' is already used by entity '" + previousTable + "'");
                }
                tableByEntity.put(name, table);
            }

            // pass 1: fields, identity and table-level constraints
            for (var e : entities.entrySet()) {
                buildFields(e.getKey(), e.getValue());
            }
            // pass 2: owning relations (need every entity's fields)
            for (var e : entities.entrySet()) {
                buildOwningRelations(e.getKey(), e.getValue());
            }
            // pass 3: inverse relations (need the owning side they point at)
            for (var e : entities.entrySet()) {
                buildInverseRelations(e.getKey(), e.getValue());
            }

            SchemaSnapshot.SchemaSnapshotBuilder snapshot = SchemaSnapshot.builder();
            if (definition.getVersion() != null) snapshot.version(definition.getVersion());
            new TreeMap<>(builders).forEach((name, b) -> snapshot.entity(name, b.build()));
            return snapshot.build();
        }

        private void buildFields(String entityName, EntityDefinition def) {
            String base = "entities." + entityName;
            String table = tableByEntity.get(entityName);
            Map<String, FieldDefinition> fieldDefs = def.getFields() == null ? Map.of() : def.getFields();

            List<FieldModel> fields = new ArrayList<>();
            Map<String, String> seenFields = new HashMap<>();
            Map<String, String> seenColumns = new HashMap<>();
            FieldModel identity = null;

            for (var f : fieldDefs.entrySet()) {
                String fieldName = f.getKey();
                String location = base + ".fields." + fieldName;
                requireIdentifier(fieldName, location);
                FieldDefinition fd = f.getValue();
                if (fd == null) {
                    throw new SchemaException(Kind.MALFORMED, location, "Field has no body");
                }
                String previous = seenFields.putIfAbsent(normalizer.normalize(fieldName), fieldName);
                if (previous != null) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location,
                            "Field name '" + fieldName + "' clashes with '" + previous + "'");
                }

                FieldType type = FieldType.fromKeyword(fd.getType())
                        .orElseThrow(() -> new SchemaException(Kind.UNKNOWN_TYPE, location + ".type",
                                "Unknown field type '" + fd.getType() + "'"));

                String column = fd.getColumn() != null ? fd.getColumn() : namingStrategy.toPhysicalColumnName(fieldName);
                requireIdentifier(column, location + ".column");
                String previousColumn = seenColumns.putIfAbsent(normalizer.normalize(column), fieldName);
                if (previousColumn != null) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location + ".column",
                            "Column '" + column + "' is already used by field '" + previousColumn + "'");
                }

                int length = 255;
                if (fd.getLength() != null) {
                    if (type != FieldType.TEXT || fd.getLength() <= 0) {
                        throw new SchemaException(Kind.MALFORMED, location + ".length",
                                "length applies to text fields and must be positive");
                    }
                    length = fd.getLength();
                }

                FieldDefault defaultValue = resolveDefault(fd, type, location);

                if (fd.isIdentity()) {
                    if (identity != null) {
                        throw new SchemaException(Kind.DUPLICATE_NAME, location,
                                "Entity already declares identity field '" + identity.getName() + "'");
                    }
                    if (fd.isNullable()) {
                        throw new SchemaException(Kind.INVALID_DEFAULT, location, "Identity field cannot be nullable");
                    }
                } else if (defaultValue.isAutoIncrement()) {
                    throw new SchemaException(Kind.INVALID_DEFAULT, location + ".onCreate",
                            "autoincrement is only allowed on the identity field");
                }

                boolean unique = fd.isUnique() && !fd.isIdentity();
                FieldModel field = FieldModel.builder()
                        .name(fieldName)
                        .columnName(column)
                        .type(type)
                        .length(length)
                        .nullable(fd.isNullable())
                        .defaultValue(defaultValue)
                        .unique(unique)
                        .identity(fd.isIdentity())
                        .uniqueConstraintName(unique ? registerName(naming.uqName(table, List.of(column)), location) : null)
                        .build();
                if (field.isIdentity()) identity = field;
                fields.add(field);
            }

            if (identity == null) {
                throw new SchemaException(Kind.MISSING_IDENTITY, base, "Entity '" + entityName + "' declares no identity field");
            }

            EntityModel.EntityModelBuilder builder = EntityModel.builder()
                    .name(entityName)
                    .tableName(table)
                    .fields(fields);

            List<ConstraintDefinition> constraintDefs = def.getConstraints() == null ? List.of() : def.getConstraints();
            for (int i = 0; i < constraintDefs.size(); i++) {
                builder.constraint(buildConstraint(entityName, table, fields, constraintDefs.get(i), base + ".constraints[" + i + "]"));
            }

            builders.put(entityName, builder);
            fieldsByEntity.put(entityName, fields);
        }

        private ConstraintModel buildConstraint(String entityName, String table, List<FieldModel> fields,
                                                ConstraintDefinition cd, String location) {
            if (cd == null || cd.getUnique() == null || cd.getUnique().isEmpty()) {
                throw new SchemaException(Kind.MALFORMED, location, "Constraint must list at least one field under 'unique'");
            }
            List<String> columns = new ArrayList<>();
            for (String fieldName : cd.getUnique()) {
                FieldModel field = fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst()
                        .orElseThrow(() -> new SchemaException(Kind.MALFORMED, location,
                                "Unknown field '" + fieldName + "' in unique constraint of " + entityName));
                if (columns.contains(field.getColumnName())) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location, "Field '" + fieldName + "' listed twice");
                }
                columns.add(field.getColumnName());
            }
            String name = cd.getName() != null ? cd.getName() : naming.uqName(table, columns);
            requireIdentifier(name, location + ".name");
            return ConstraintModel.builder()
                    .name(registerName(name, location))
                    .fields(cd.getUnique())
                    .build();
        }

        private FieldDefault resolveDefault(FieldDefinition fd, FieldType type, String location) {
            int declared = (fd.getDefaultValue() != null ? 1 : 0)
                    + (fd.getOnCreate() != null ? 1 : 0)
                    + (fd.getOnUpdate() != null ? 1 : 0);
            if (declared > 1) {
                throw new SchemaException(Kind.INVALID_DEFAULT, location,
                        "Only one of default, onCreate and onUpdate may be declared");
            }
            if (fd.getDefaultValue() != null) {
                try {
                    type.parseLiteral(fd.getDefaultValue());
                } catch (IllegalArgumentException e) {
                    throw new SchemaException(Kind.INVALID_DEFAULT, location + ".default", e.getMessage(), e);
                }
                if (type == FieldType.TEXT && fd.getDefaultValue().length() > lengthOf(fd)) {
                    throw new SchemaException(Kind.INVALID_DEFAULT, location + ".default", "Default is longer than the field");
                }
                return FieldDefault.literal(fd.getDefaultValue());
            }
            if (fd.getOnCreate() != null) {
                FieldDefault.Generator g = generator(fd.getOnCreate(), location + ".onCreate");
                checkGenerator(g, type, fd, location + ".onCreate");
                return FieldDefault.onCreate(g);
            }
            if (fd.getOnUpdate() != null) {
                FieldDefault.Generator g = generator(fd.getOnUpdate(), location + ".onUpdate");
                if (g != FieldDefault.Generator.NOW) {
                    throw new SchemaException(Kind.INVALID_DEFAULT, location + ".onUpdate", "onUpdate only supports now");
                }
                checkGenerator(g, type, fd, location + ".onUpdate");
                return FieldDefault.onUpdate(g);
            }
            return FieldDefault.none();
        }

        private int lengthOf(FieldDefinition fd) {
            return fd.getLength() != null ? fd.getLength() : 255;
        }

        private FieldDefault.Generator generator(String raw, String location) {
            return FieldDefault.Generator.fromKeyword(raw)
                    .orElseThrow(() -> new SchemaException(Kind.UNKNOWN_TYPE, location, "Unknown generator '" + raw + "'"));
        }

        private void checkGenerator(FieldDefault.Generator g, FieldType type, FieldDefinition fd, String location) {
            switch (g) {
                case NOW -> {
                    if (!type.isTemporal()) {
                        throw new SchemaException(Kind.INVALID_DEFAULT, location, "now requires a date or timestamp field");
                    }
                }
                case UUID -> {
                    if (type != FieldType.TEXT) {
                        throw new SchemaException(Kind.INVALID_DEFAULT, location, "uuid requires a text field");
                    }
                    if (lengthOf(fd) < 36) {
                        throw new SchemaException(Kind.INVALID_DEFAULT, location, "uuid requires length of at least 36");
                    }
                }
                case AUTOINCREMENT -> {
                    if (!type.isIntegral()) {
                        throw new SchemaException(Kind.INVALID_DEFAULT, location, "autoincrement requires an integer or bigint field");
                    }
                }
            }
        }

        private void buildOwningRelations(String entityName, EntityDefinition def) {
            Map<String, RelationDefinition> relationDefs = def.getRelations() == null ? Map.of() : def.getRelations();
            List<FieldModel> ownFields = fieldsByEntity.get(entityName);
            Map<String, RelationModel> owning = new HashMap<>();
            Map<String, String> seen = new HashMap<>();
            ownFields.forEach(f -> seen.put(normalizer.normalize(f.getName()), f.getName()));

            for (var r : relationDefs.entrySet()) {
                String relName = r.getKey();
                String location = "entities." + entityName + ".relations." + relName;
                requireIdentifier(relName, location);
                RelationDefinition rd = r.getValue();
                if (rd == null) {
                    throw new SchemaException(Kind.MALFORMED, location, "Relation has no body");
                }
                String previous = seen.putIfAbsent(normalizer.normalize(relName), relName);
                if (previous != null) {
                    throw new SchemaException(Kind.DUPLICATE_NAME, location,
                            "Relation name '" + relName + "' clashes with '" + previous + "'");
                }
                if (rd.getTarget() == null || !builders.containsKey(rd.getTarget())) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".target",
                            "Unknown target entity '" + rd.getTarget() + "'");
                }
                boolean hasFk = rd.getForeignKey() != null;
                boolean hasMappedBy = rd.getMappedBy() != null;
                if (hasFk == hasMappedBy) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location,
                            "Relation must declare exactly one of foreignKey or mappedBy");
                }
                if (!hasFk) {
                    if (rd.getOnDelete() != null || rd.getReferences() != null) {
                        throw new SchemaException(Kind.BAD_RELATION_TARGET, location,
                                "onDelete and references belong on the owning side");
                    }
                    continue;
                }
                RelationModel relation = buildOwning(entityName, relName, rd, ownFields, location);
                owning.put(relName, relation);
                builders.get(entityName).relation(relation);
            }
            owningByEntity.put(entityName, owning);
        }

        private RelationModel buildOwning(String entityName, String relName, RelationDefinition rd,
                                          List<FieldModel> ownFields, String location) {
            String table = tableByEntity.get(entityName);
            String targetTable = tableByEntity.get(rd.getTarget());

            FieldModel fkField = ownFields.stream().filter(f -> f.getName().equals(rd.getForeignKey())).findFirst()
                    .orElseThrow(() -> new SchemaException(Kind.BAD_RELATION_TARGET, location + ".foreignKey",
                            "Unknown foreign key field '" + rd.getForeignKey() + "' on " + entityName));

            List<FieldModel> targetFields = fieldsByEntity.get(rd.getTarget());
            FieldModel referenced;
            if (rd.getReferences() == null) {
                referenced = targetFields.stream().filter(FieldModel::isIdentity).findFirst().orElseThrow();
            } else {
                referenced = targetFields.stream().filter(f -> f.getName().equals(rd.getReferences())).findFirst()
                        .orElseThrow(() -> new SchemaException(Kind.BAD_RELATION_TARGET, location + ".references",
                                "Unknown field '" + rd.getReferences() + "' on " + rd.getTarget()));
                if (!referenced.isIdentity() && !referenced.isUnique()) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".references",
                            "Referenced field must be the identity or unique");
                }
            }
            if (!fkField.getType().isReferenceCompatible(referenced.getType())) {
                throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".foreignKey",
                        "Foreign key type " + fkField.getType() + " is incompatible with " + referenced.getType());
            }

            OnDeleteAction onDelete = OnDeleteAction.RESTRICT;
            if (rd.getOnDelete() != null) {
                onDelete = OnDeleteAction.fromKeyword(rd.getOnDelete())
                        .orElseThrow(() -> new SchemaException(Kind.UNKNOWN_TYPE, location + ".onDelete",
                                "Unknown onDelete action '" + rd.getOnDelete() + "'"));
            }
            if (onDelete == OnDeleteAction.SET_NULL && !fkField.isNullable()) {
                throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".onDelete",
                        "SET_NULL requires a nullable foreign key");
            }

            boolean fkUnique = fkField.isUnique() || fkField.isIdentity();
            Cardinality cardinality = fkUnique ? Cardinality.ONE_TO_ONE : Cardinality.ONE_TO_MANY;
            Optional<Cardinality> declared = cardinality(rd.getCardinality(), location);
            if (declared.isPresent()) {
                if (declared.get() == Cardinality.ONE_TO_ONE && !fkUnique) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".cardinality",
                            "One-to-one owning side requires a unique foreign key");
                }
                cardinality = declared.get();
            }

            return RelationModel.builder()
                    .name(relName)
                    .target(rd.getTarget())
                    .cardinality(cardinality)
                    .foreignKey(fkField.getName())
                    .references(referenced.getName())
                    .onDelete(onDelete)
                    .constraintName(registerName(naming.fkName(table, List.of(fkField.getColumnName()),
                            targetTable, List.of(referenced.getColumnName())), location))
                    .indexName(fkUnique ? null : registerName(naming.ixName(table, List.of(fkField.getColumnName())), location))
                    .build();
        }

        private void buildInverseRelations(String entityName, EntityDefinition def) {
            Map<String, RelationDefinition> relationDefs = def.getRelations() == null ? Map.of() : def.getRelations();
            for (var r : relationDefs.entrySet()) {
                RelationDefinition rd = r.getValue();
                if (rd.getMappedBy() == null) continue;
                String location = "entities." + entityName + ".relations." + r.getKey();

                RelationModel owningSide = owningByEntity.getOrDefault(rd.getTarget(), Map.of()).get(rd.getMappedBy());
                if (owningSide == null || !owningSide.getTarget().equals(entityName)) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".mappedBy",
                            "'" + rd.getMappedBy() + "' is not an owning relation of " + rd.getTarget() + " targeting " + entityName);
                }
                Optional<Cardinality> declared = cardinality(rd.getCardinality(), location);
                if (declared.isPresent() && declared.get() != owningSide.getCardinality()) {
                    throw new SchemaException(Kind.BAD_RELATION_TARGET, location + ".cardinality",
                            "Cardinality disagrees with owning relation " + rd.getTarget() + "." + rd.getMappedBy());
                }
                builders.get(entityName).relation(RelationModel.builder()
                        .name(r.getKey())
                        .target(rd.getTarget())
                        .cardinality(owningSide.getCardinality())
                        .mappedBy(rd.getMappedBy())
                        .build());
            }
        }

        private Optional<Cardinality> cardinality(String raw, String location) {
            if (raw == null) return Optional.empty();
            return switch (raw.trim().replace("_", "").replace("-", "").toLowerCase()) {
                case "onetomany", "manytoone" -> Optional.of(Cardinality.ONE_TO_MANY);
                case "onetoone" -> Optional.of(Cardinality.ONE_TO_ONE);
                default -> throw new SchemaException(Kind.UNKNOWN_TYPE, location + ".cardinality",
                        "Unknown cardinality '" + raw + "'");
            };
        }

        private String registerName(String name, String location) {
            String previous = generatedNames.putIfAbsent(normalizer.normalize(name), location);
            if (previous != null) {
                throw new SchemaException(Kind.DUPLICATE_NAME, location,
                        "Constraint name '" + name + "' is also generated for " + previous);
            }
            return name;
        }

        private void requireIdentifier(String name, String location) {
            if (name == null || !IDENTIFIER.matcher(name).matches()) {
                throw new SchemaException(Kind.MALFORMED, location, "Invalid identifier '" + name + "'");
            }
        }
    }
}
