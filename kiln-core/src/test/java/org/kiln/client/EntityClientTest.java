package org.kiln.client;

import org.kiln.error.ConstraintException;
import org.kiln.error.NotFoundException;
import org.kiln.error.ValidationException;
import org.kiln.migration.ApplyOptions;
import org.kiln.migration.Migration;
import org.kiln.migration.MigrationRunner;
import org.kiln.migration.differs.SchemaDiffer;
import org.kiln.model.SchemaSnapshot;
import org.kiln.store.JdbcStore;
import org.kiln.testing.H2Stores;
import org.kiln.testing.Schemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);

    private JdbcStore store;
    private KilnClient client;
    private EntityClient users;
    private EntityClient posts;
    private final List<String> statements = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = H2Stores.newStore();
        client = migrated(Schemas.userPost());
        users = client.entity("User");
        posts = client.entity("Post");
        store.addListener((sql, params) -> statements.add(sql));
    }

    private KilnClient migrated(SchemaSnapshot schema) {
        Migration init = Migration.of("20240301000000_init",
                new SchemaDiffer().diff(SchemaSnapshot.empty(), schema).operations(), schema);
        new MigrationRunner().apply(store, init, ApplyOptions.defaults());
        return new KilnClient(schema, store, CLOCK);
    }

    private EntityRecord user(String email, String name) {
        return users.create(name == null ? Map.of("email", email) : Map.of("email", email, "name", name));
    }

    private EntityRecord post(EntityRecord author, String title) {
        return posts.create(Map.of("title", title, "authorId", author.get("id")));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("저장된 레코드를 생성된 값과 기본값까지 포함해 반환한다")
        void returnsStoredRecord() {
            EntityRecord ada = user("ada@example.com", "Ada");

            assertEquals("User", ada.getEntity());
            assertEquals(1, ada.get("id"));
            assertEquals("ada@example.com", ada.get("email"));
            assertEquals(LocalDateTime.of(2024, 3, 1, 9, 0), ada.get("createdAt"));

            EntityRecord first = post(ada, "Hello");
            assertEquals(Boolean.FALSE, first.get("published"));
            assertEquals(1, first.get("authorId"));
        }

        @Test
        @DisplayName("값이 없는 레코드는 스토어 기본값으로 생성")
        void emptyPayload() {
            store = H2Stores.newStore();
            EntityClient tags = migrated(Schemas.parse("""
                    version: "1"
                    entities:
                      Tag:
                        table: tags
                        fields:
                          id: { type: integer, identity: true, onCreate: autoincrement }
                          label: { type: text, nullable: true }
                    """)).entity("Tag");

            EntityRecord first = tags.create(Map.of());
            EntityRecord second = tags.create(null);

            assertEquals(1, first.get("id"));
            assertEquals(2, second.get("id"));
            assertEquals(null, first.get("label"));
        }

        @Test
        @DisplayName("unique 위반은 엔티티와 필드를 담은 ConstraintException")
        void uniqueViolation() {
            user("ada@example.com", null);

            ConstraintException e = assertThrows(ConstraintException.class, () -> user("ada@example.com", "Other"));

            assertEquals("User", e.getEntity());
            assertEquals("email", e.getField());
            assertEquals("ada@example.com", e.getValue());
            assertEquals("uq_users__email", e.getConstraint());
            assertEquals(1, users.count(Filter.all()));
        }

        @Test
        @DisplayName("검증 실패 시 스토어에 아무 문장도 보내지 않는다")
        void validationBeforeStore() {
            assertThrows(ValidationException.class, () -> users.create(Map.of("name", "No email")));
            assertThrows(ValidationException.class, () -> users.read(Filter.eq("nickname", "x")));
            assertThrows(ValidationException.class, () -> posts.delete(Filter.where("id", Operator.IN, List.of())));

            assertThat(statements).isEmpty();
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("필터와 정렬, paging")
        void filterOrderAndPaging() {
            EntityRecord ada = user("ada@example.com", "Ada");
            user("bob@example.com", null);
            user("cy@example.com", "Cy");

            assertThat(users.read(Filter.isNull("name"))).extracting(r -> r.get("email"))
                    .containsExactly("bob@example.com");
            assertThat(users.read(Filter.where("email", Operator.LIKE, "%y@%"))).hasSize(1);
            assertThat(users.read(ReadQuery.builder()
                    .orderBy(List.of(Order.desc("email")))
                    .limit(2)
                    .build())).extracting(r -> r.get("email"))
                    .containsExactly("cy@example.com", "bob@example.com");
            assertThat(users.read(ReadQuery.builder().offset(1).build())).hasSize(2);
            assertEquals(ada, users.findUnique(ada.get("id")).orElseThrow());
            assertTrue(users.findUnique(99).isEmpty());
        }

        @Test
        @DisplayName("include는 관계마다 쿼리 하나")
        void includeIssuesOneQueryPerRelation() {
            EntityRecord ada = user("ada@example.com", null);
            EntityRecord bob = user("bob@example.com", null);
            user("cy@example.com", null);
            post(ada, "a1");
            post(bob, "b1");
            post(ada, "a2");
            statements.clear();

            List<EntityRecord> all = users.read(Filter.all(), "posts");

            assertEquals(2, statements.size());
            assertThat(statements.get(1)).contains(" IN (?, ?, ?)");
            assertThat(all.get(0).getMany("posts")).extracting(r -> r.get("title")).containsExactly("a1", "a2");
            assertThat(all.get(1).getMany("posts")).extracting(r -> r.get("title")).containsExactly("b1");
            assertThat(all.get(2).getMany("posts")).isEmpty();
        }

        @Test
        @DisplayName("소유 측 관계 include")
        void includeOwningSide() {
            EntityRecord ada = user("ada@example.com", "Ada");
            post(ada, "a1");
            post(ada, "a2");
            statements.clear();

            List<EntityRecord> all = posts.read(Filter.all(), "author");

            assertEquals(2, statements.size());
            assertEquals(ada, all.get(0).getOne("author").orElseThrow());
            assertEquals(ada, all.get(1).getOne("author").orElseThrow());
            assertThrows(IllegalArgumentException.class, () -> all.get(0).getMany("author"));
        }

        @Test
        @DisplayName("include하지 않은 관계는 접근할 수 없다")
        void notIncluded() {
            EntityRecord ada = user("ada@example.com", null);

            EntityRecord read = users.findUnique(ada.get("id")).orElseThrow();

            assertFalse(read.hasRelation("posts"));
            assertThrows(IllegalArgumentException.class, () -> read.getMany("posts"));
        }
    }

    @Nested
    @DisplayName("update / delete")
    class Write {

        @Test
        @DisplayName("단일 레코드 업데이트")
        void updateSingleRecord() {
            EntityRecord ada = user("ada@example.com", null);

            EntityRecord updated = users.update(Filter.eq("email", "ada@example.com"), Map.of("name", "Ada"));

            assertEquals(ada.get("id"), updated.get("id"));
            assertEquals("Ada", updated.get("name"));
            assertEquals(ada.get("createdAt"), updated.get("createdAt"));
        }

        @Test
        @DisplayName("여러 레코드에 매칭되면 ValidationException, 없으면 NotFoundException")
        void updateNeedsExactlyOneMatch() {
            user("ada@example.com", "Same");
            user("bob@example.com", "Same");

            assertThrows(ValidationException.class, () -> users.update(Filter.eq("name", "Same"), Map.of("name", "X")));
            NotFoundException e = assertThrows(NotFoundException.class,
                    () -> users.update(Filter.eq("email", "nobody@example.com"), Map.of("name", "X")));
            assertEquals("User", e.getEntity());
            assertEquals(2, users.count(Filter.eq("name", "Same")));
        }

        @Test
        @DisplayName("RESTRICT 관계가 남아 있으면 삭제 거부")
        void deleteRestricted() {
            EntityRecord ada = user("ada@example.com", null);
            EntityRecord first = post(ada, "a1");

            ConstraintException e = assertThrows(ConstraintException.class,
                    () -> users.delete(Filter.eq("id", ada.get("id"))));

            assertEquals("User", e.getEntity());
            assertEquals("fk_posts__author_id__users", e.getConstraint());
            assertThat(e.getMessage()).contains("1 Post record(s)");
            assertEquals(1, users.count(Filter.all()));

            assertEquals(first, posts.delete(Filter.eq("id", first.get("id"))));
            assertEquals(ada, users.delete(Filter.eq("id", ada.get("id"))));
            assertEquals(0, users.count(Filter.all()));
        }

        @Test
        @DisplayName("존재하지 않는 외래 키")
        void danglingForeignKey() {
            ConstraintException e = assertThrows(ConstraintException.class,
                    () -> posts.create(Map.of("title", "orphan", "authorId", 42)));

            assertEquals("Post", e.getEntity());
            assertEquals("authorId", e.getField());
        }
    }

    @Test
    @DisplayName("알 수 없는 엔티티")
    void unknownEntity() {
        assertThrows(ValidationException.class, () -> client.entity("Comment"));
    }
}
