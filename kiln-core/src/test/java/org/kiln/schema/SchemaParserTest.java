package org.kiln.schema;

import org.kiln.error.SchemaException;
import org.kiln.model.Cardinality;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldDefault;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.OnDeleteAction;
import org.kiln.model.RelationModel;
import org.kiln.model.SchemaSnapshot;
import org.kiln.naming.DefaultNaming;
import org.kiln.spi.naming.impl.SnakeCaseNamingStrategy;
import org.kiln.testing.Schemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser();

    private SchemaException parseFailure(String yaml) {
        try {
            parser.parse(yaml);
        } catch (SchemaException e) {
            return e;
        }
        throw new AssertionError("expected SchemaException for:\n" + yaml);
    }

    @Nested
    @DisplayName("User / Post 스키마")
    class UserPost {

        @Test
        @DisplayName("엔티티, 필드, 관계가 모두 해석된다")
        void parsesEntitiesFieldsAndRelations() {
            SchemaSnapshot snapshot = Schemas.userPost();

            assertThat(snapshot.getEntities()).containsOnlyKeys("User", "Post");
            EntityModel user = snapshot.requireEntity("User");
            assertEquals("users", user.getTableName());
            assertEquals(List.of("id", "email", "name", "createdAt"),
                    user.getFields().stream().map(FieldModel::getName).toList());

            FieldModel id = user.getIdentityField();
            assertEquals("id", id.getName());
            assertTrue(id.isStoreGenerated());

            FieldModel email = user.findField("email").orElseThrow();
            assertEquals(FieldType.TEXT, email.getType());
            assertEquals(120, email.getLength());
            assertTrue(email.isUnique());
            assertEquals("uq_users__email", email.getUniqueConstraintName());

            FieldModel createdAt = user.findField("createdAt").orElseThrow();
            assertEquals("created_at", createdAt.getColumnName());
            assertEquals(FieldDefault.onCreate(FieldDefault.Generator.NOW), createdAt.getDefaultValue());
            assertFalse(createdAt.isRequiredOnCreate());
        }

        @Test
        @DisplayName("소유 측 관계는 외래키 이름과 인덱스 이름을 가진다")
        void owningRelationCarriesConstraintNames() {
            EntityModel post = Schemas.userPost().requireEntity("Post");
            RelationModel author = post.findRelation("author").orElseThrow();

            assertTrue(author.isOwning());
            assertEquals("User", author.getTarget());
            assertEquals("authorId", author.getForeignKey());
            assertEquals("id", author.getReferences());
            assertEquals(OnDeleteAction.RESTRICT, author.getOnDelete());
            assertEquals(Cardinality.ONE_TO_MANY, author.getCardinality());
            assertEquals("fk_posts__author_id__users", author.getConstraintName());
            assertEquals("ix_posts__author_id", author.getIndexName());
        }

        @Test
        @DisplayName("역방향 관계는 소유 측의 카디널리티를 따른다")
        void inverseRelationFollowsOwningSide() {
            EntityModel user = Schemas.userPost().requireEntity("User");
            RelationModel posts = user.findRelation("posts").orElseThrow();

            assertFalse(posts.isOwning());
            assertEquals("author", posts.getMappedBy());
            assertTrue(posts.isCollection());
        }

        @Test
        @DisplayName("같은 정의는 같은 스냅샷을 만든다")
        void parsingIsDeterministic() {
            assertEquals(Schemas.userPost(), Schemas.userPost());
        }
    }

    @Test
    @DisplayName("snake_case 전략은 테이블과 컬럼 이름에 적용된다")
    void namingStrategyAppliesToPhysicalNames() {
        SchemaParser snake = new SchemaParser(new SnakeCaseNamingStrategy(), new DefaultNaming(30));
        SchemaSnapshot snapshot = snake.parse("""
                entities:
                  BlogPost:
                    fields:
                      id: { type: bigint, identity: true }
                      publishedAt: { type: timestamp, nullable: true }
                """);

        EntityModel post = snapshot.requireEntity("BlogPost");
        assertEquals("blog_post", post.getTableName());
        assertEquals("published_at", post.findField("publishedAt").orElseThrow().getColumnName());
    }

    @Test
    @DisplayName("one-to-one 소유 측은 unique 외래키가 필요하다")
    void oneToOneNeedsUniqueForeignKey() {
        SchemaSnapshot snapshot = parser.parse("""
                entities:
                  User:
                    fields:
                      id: { type: integer, identity: true }
                    relations:
                      profile: { target: Profile, mappedBy: user, cardinality: one-to-one }
                  Profile:
                    fields:
                      id: { type: integer, identity: true }
                      userId: { type: bigint, unique: true }
                    relations:
                      user: { target: User, foreignKey: userId, onDelete: cascade }
                """);

        RelationModel user = snapshot.requireEntity("Profile").findRelation("user").orElseThrow();
        assertEquals(Cardinality.ONE_TO_ONE, user.getCardinality());
        assertEquals(OnDeleteAction.CASCADE, user.getOnDelete());
        assertNull(user.getIndexName());
        assertFalse(snapshot.requireEntity("User").findRelation("profile").orElseThrow().isCollection());
    }

    @Test
    @DisplayName("빈 정의는 빈 스냅샷이다")
    void emptyDefinition() {
        assertTrue(parser.parse("entities: {}").isEmpty());
    }

    @Nested
    @DisplayName("거부되는 정의")
    class Rejections {

        @Test
        @DisplayName("알 수 없는 타입은 UNKNOWN_TYPE")
        void unknownType() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                          avatar: { type: blob }
                    """);
            assertEquals(SchemaException.Kind.UNKNOWN_TYPE, e.getKind());
            assertEquals("entities.User.fields.avatar.type", e.getLocation());
        }

        @Test
        @DisplayName("식별자 필드가 없으면 MISSING_IDENTITY")
        void missingIdentity() {
            SchemaException e = parseFailure("""
                    entities:
                      Tag:
                        fields:
                          label: { type: text }
                    """);
            assertEquals(SchemaException.Kind.MISSING_IDENTITY, e.getKind());
            assertEquals("entities.Tag", e.getLocation());
        }

        @Test
        @DisplayName("식별자 필드가 둘이면 DUPLICATE_NAME")
        void secondIdentity() {
            SchemaException e = parseFailure("""
                    entities:
                      Tag:
                        fields:
                          id: { type: integer, identity: true }
                          code: { type: text, identity: true }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
        }

        @Test
        @DisplayName("대소문자만 다른 필드 이름은 충돌한다")
        void caseInsensitiveFieldClash() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                          email: { type: text }
                          Email: { type: text, column: email2 }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
            assertEquals("entities.User.fields.Email", e.getLocation());
        }

        @Test
        @DisplayName("두 엔티티가 같은 테이블을 쓸 수 없다")
        void tableClash() {
            SchemaException e = parseFailure("""
                    entities:
                      A:
                        table: things
                        fields:
                          id: { type: integer, identity: true }
                      B:
                        table: THINGS
                        fields:
                          id: { type: integer, identity: true }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
        }

        @Test
        @DisplayName("마이그레이션 기록 테이블 이름은 예약되어 있다")
        void ledgerTableIsReserved() {
            SchemaException e = parseFailure("""
                    entities:
                      Ledger:
                        table: _kiln_migrations
                        fields:
                          id: { type: integer, identity: true }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
        }

        @Test
        @DisplayName("YAML 키 중복은 DUPLICATE_NAME")
        void duplicateYamlKey() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                      User:
                        fields:
                          id: { type: integer, identity: true }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
        }

        @Test
        @DisplayName("필드 키 중복도 DUPLICATE_NAME이며 위치를 유지한다")
        void duplicateYamlFieldKey() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                          email: { type: text }
                          email: { type: text, unique: true }
                    """);
            assertEquals(SchemaException.Kind.DUPLICATE_NAME, e.getKind());
            assertThat(e.getLocation()).startsWith("entities");
        }

        @Test
        @DisplayName("관계 대상이 없으면 BAD_RELATION_TARGET")
        void unknownRelationTarget() {
            SchemaException e = parseFailure("""
                    entities:
                      Post:
                        fields:
                          id: { type: integer, identity: true }
                          authorId: { type: integer }
                        relations:
                          author: { target: Author, foreignKey: authorId }
                    """);
            assertEquals(SchemaException.Kind.BAD_RELATION_TARGET, e.getKind());
            assertEquals("entities.Post.relations.author.target", e.getLocation());
        }

        @Test
        @DisplayName("mappedBy가 소유 측 관계를 가리키지 않으면 거부")
        void mappedByMustNameOwningRelation() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                        relations:
                          posts: { target: Post, mappedBy: writer }
                      Post:
                        fields:
                          id: { type: integer, identity: true }
                          authorId: { type: integer }
                        relations:
                          author: { target: User, foreignKey: authorId }
                    """);
            assertEquals(SchemaException.Kind.BAD_RELATION_TARGET, e.getKind());
            assertEquals("entities.User.relations.posts.mappedBy", e.getLocation());
        }

        @Test
        @DisplayName("외래키 타입이 참조 키와 호환되지 않으면 거부")
        void incompatibleForeignKeyType() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                      Post:
                        fields:
                          id: { type: integer, identity: true }
                          authorId: { type: text }
                        relations:
                          author: { target: User, foreignKey: authorId }
                    """);
            assertEquals(SchemaException.Kind.BAD_RELATION_TARGET, e.getKind());
        }

        @Test
        @DisplayName("SET_NULL은 nullable 외래키에만 허용")
        void setNullNeedsNullableForeignKey() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true }
                      Post:
                        fields:
                          id: { type: integer, identity: true }
                          authorId: { type: integer }
                        relations:
                          author: { target: User, foreignKey: authorId, onDelete: set_null }
                    """);
            assertEquals(SchemaException.Kind.BAD_RELATION_TARGET, e.getKind());
            assertEquals("entities.Post.relations.author.onDelete", e.getLocation());
        }

        @Test
        @DisplayName("타입에 맞지 않는 기본값은 INVALID_DEFAULT")
        void defaultMustMatchType() {
            SchemaException e = parseFailure("""
                    entities:
                      Counter:
                        fields:
                          id: { type: integer, identity: true }
                          hits: { type: integer, default: "many" }
                    """);
            assertEquals(SchemaException.Kind.INVALID_DEFAULT, e.getKind());
            assertEquals("entities.Counter.fields.hits.default", e.getLocation());
        }

        @Test
        @DisplayName("now 생성기는 날짜/시간 필드에만")
        void nowNeedsTemporalField() {
            SchemaException e = parseFailure("""
                    entities:
                      Counter:
                        fields:
                          id: { type: integer, identity: true }
                          label: { type: text, onCreate: now }
                    """);
            assertEquals(SchemaException.Kind.INVALID_DEFAULT, e.getKind());
        }

        @Test
        @DisplayName("autoincrement는 식별자 필드에만")
        void autoincrementOnlyOnIdentity() {
            SchemaException e = parseFailure("""
                    entities:
                      Counter:
                        fields:
                          id: { type: integer, identity: true }
                          seq: { type: bigint, onCreate: autoincrement }
                    """);
            assertEquals(SchemaException.Kind.INVALID_DEFAULT, e.getKind());
        }

        @Test
        @DisplayName("default와 onCreate를 함께 선언할 수 없다")
        void onlyOneDefaultPolicy() {
            SchemaException e = parseFailure("""
                    entities:
                      Event:
                        fields:
                          id: { type: integer, identity: true }
                          at: { type: timestamp, default: "2024-01-01T00:00:00", onCreate: now }
                    """);
            assertEquals(SchemaException.Kind.INVALID_DEFAULT, e.getKind());
        }

        @Test
        @DisplayName("알 수 없는 속성은 MALFORMED")
        void unknownPropertyIsMalformed() {
            SchemaException e = parseFailure("""
                    entities:
                      User:
                        fields:
                          id: { type: integer, identity: true, primary: true }
                    """);
            assertEquals(SchemaException.Kind.MALFORMED, e.getKind());
        }

        @Test
        @DisplayName("identifier 규칙을 어기는 이름은 MALFORMED")
        void invalidIdentifier() {
            SchemaException e = parseFailure("""
                    entities:
                      "User Account":
                        fields:
                          id: { type: integer, identity: true }
                    """);
            assertEquals(SchemaException.Kind.MALFORMED, e.getKind());
        }

        @Test
        @DisplayName("unique 제약의 필드는 존재해야 한다")
        void constraintFieldMustExist() {
            assertThatThrownBy(() -> parser.parse("""
                    entities:
                      Membership:
                        fields:
                          id: { type: integer, identity: true }
                          teamId: { type: integer }
                        constraints:
                          - unique: [teamId, userId]
                    """))
                    .isInstanceOf(SchemaException.class)
                    .hasMessageContaining("userId");
        }
    }
}
