package org.kiln.client;

import org.kiln.error.ValidationException;
import org.kiln.testing.Schemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryValidatorTest {

    private final QueryValidator validator = new QueryValidator(Schemas.userPost());

    private static QueryDescription.QueryDescriptionBuilder query(String entity, QueryDescription.Kind kind) {
        return QueryDescription.builder().entity(entity).kind(kind);
    }

    private ValidationException rejected(QueryDescription query) {
        return assertThrows(ValidationException.class, () -> validator.validate(query));
    }

    @Test
    @DisplayName("알 수 없는 엔티티")
    void unknownEntity() {
        ValidationException e = rejected(query("Comment", QueryDescription.Kind.READ).build());

        assertEquals("Comment", e.getEntity());
        assertThat(e.getMessage()).contains("Unknown entity 'Comment'");
    }

    @Nested
    @DisplayName("CREATE payload")
    class Create {

        @Test
        @DisplayName("필수 필드 누락")
        void missingRequiredField() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("name", "Ada")).build());

            assertEquals("email", e.getField());
            assertEquals("Missing required field 'email'", e.getMessage());
        }

        @Test
        @DisplayName("기본값이 있는 필드와 nullable 필드는 생략 가능")
        void optionalFieldsMayBeOmitted() {
            QueryDescription validated = validator.validate(query("Post", QueryDescription.Kind.CREATE)
                    .payload(Map.of("title", "Hello", "authorId", 1L)).build());

            // Long 값은 integer 필드 타입으로 변환
            assertEquals(Map.of("title", "Hello", "authorId", 1), validated.getPayload());
        }

        @Test
        @DisplayName("스토어가 생성하는 identity 값은 지정할 수 없다")
        void storeGeneratedIdentity() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("id", 7, "email", "a@example.com")).build());

            assertEquals("id", e.getField());
            assertEquals("Field is generated by the store", e.getMessage());
        }

        @Test
        @DisplayName("onCreate now 필드는 명시적으로 지정할 수 있다")
        void explicitValueOverridesGenerator() {
            LocalDateTime at = LocalDateTime.of(2020, 1, 1, 0, 0);

            QueryDescription validated = validator.validate(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("email", "a@example.com", "createdAt", at)).build());

            assertEquals(at, validated.getPayload().get("createdAt"));
        }

        @Test
        @DisplayName("non-null 필드에 null")
        void nullForRequiredField() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("email", null);

            ValidationException e = rejected(query("User", QueryDescription.Kind.CREATE).payload(payload).build());

            assertEquals("Field 'email' is required", e.getMessage());
        }

        @Test
        @DisplayName("nullable 필드에는 null 허용")
        void nullForNullableField() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("email", "a@example.com");
            payload.put("name", null);

            QueryDescription validated = validator.validate(query("User", QueryDescription.Kind.CREATE).payload(payload).build());

            assertThat(validated.getPayload()).containsEntry("name", null);
        }

        @Test
        @DisplayName("타입이 맞지 않는 값")
        void wrongType() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("email", 42)).build());

            assertEquals("email", e.getField());
            assertThat(e.getMessage()).contains("not assignable to text");
        }

        @Test
        @DisplayName("텍스트 길이 초과")
        void textTooLong() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("email", "x".repeat(121))).build());

            assertEquals("Value longer than 120 characters", e.getMessage());
        }

        @Test
        @DisplayName("알 수 없는 필드와 관계 필드")
        void unknownFieldAndRelation() {
            ValidationException unknown = rejected(query("User", QueryDescription.Kind.CREATE)
                    .payload(Map.of("email", "a@example.com", "nickname", "ada")).build());
            ValidationException relation = rejected(query("Post", QueryDescription.Kind.CREATE)
                    .payload(Map.of("title", "Hello", "author", 1)).build());

            assertEquals("Unknown field 'nickname' on User", unknown.getMessage());
            assertEquals("author", relation.getField());
            assertThat(relation.getMessage()).contains("through its foreign key field");
        }
    }

    @Nested
    @DisplayName("UPDATE payload")
    class Update {

        @Test
        @DisplayName("identity는 변경할 수 없다")
        void identityNotUpdatable() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.UPDATE)
                    .filter(Filter.eq("id", 1))
                    .payload(Map.of("id", 2)).build());

            assertEquals("Identity field is not updatable", e.getMessage());
        }

        @Test
        @DisplayName("필수 필드가 없어도 부분 업데이트는 허용")
        void partialUpdate() {
            QueryDescription validated = validator.validate(query("User", QueryDescription.Kind.UPDATE)
                    .filter(Filter.eq("email", "a@example.com"))
                    .payload(Map.of("name", "Ada")).build());

            assertEquals(Map.of("name", "Ada"), validated.getPayload());
        }
    }

    @Nested
    @DisplayName("Filter")
    class Filters {

        @Test
        @DisplayName("필터 값은 필드 타입으로 변환된다")
        void coercesFilterValues() {
            QueryDescription validated = validator.validate(query("Post", QueryDescription.Kind.READ)
                    .filter(Filter.eq("id", 5L).and("authorId", Operator.IN, List.of(1L, 2)))
                    .build());

            assertEquals(List.of(
                    new Condition("id", Operator.EQ, 5),
                    new Condition("authorId", Operator.IN, List.of(1, 2))), validated.getFilter().conditions());
        }

        @Test
        @DisplayName("IN은 비어있지 않은 컬렉션이 필요하다")
        void inNeedsValues() {
            ValidationException empty = rejected(query("Post", QueryDescription.Kind.READ)
                    .filter(Filter.where("id", Operator.IN, List.of())).build());
            ValidationException scalar = rejected(query("Post", QueryDescription.Kind.READ)
                    .filter(Filter.where("id", Operator.IN, 1)).build());

            assertEquals("IN needs a non-empty collection", empty.getMessage());
            assertEquals("IN needs a non-empty collection", scalar.getMessage());
        }

        @Test
        @DisplayName("null 비교는 IS_NULL / NOT_NULL로만")
        void nullComparison() {
            ValidationException eqNull = rejected(query("User", QueryDescription.Kind.READ)
                    .filter(Filter.eq("name", null)).build());
            ValidationException unaryWithValue = rejected(query("User", QueryDescription.Kind.READ)
                    .filter(Filter.where("name", Operator.IS_NULL, "x")).build());

            assertThat(eqNull.getMessage()).contains("use IS_NULL or NOT_NULL");
            assertEquals("IS_NULL takes no value", unaryWithValue.getMessage());
            validator.validate(query("User", QueryDescription.Kind.READ).filter(Filter.isNull("name")).build());
        }

        @Test
        @DisplayName("LIKE는 텍스트 필드에만")
        void likeOnlyOnText() {
            ValidationException e = rejected(query("Post", QueryDescription.Kind.READ)
                    .filter(Filter.where("authorId", Operator.LIKE, "1%")).build());

            assertEquals("authorId", e.getField());
        }

        @Test
        @DisplayName("알 수 없는 필터 필드")
        void unknownFilterField() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.COUNT)
                    .filter(Filter.eq("nickname", "ada")).build());

            assertEquals("nickname", e.getField());
        }
    }

    @Nested
    @DisplayName("읽기 옵션")
    class ReadOptions {

        @Test
        @DisplayName("include, orderBy, paging은 READ에서만")
        void readOnlyOptions() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.COUNT)
                    .include(Set.of("posts")).build());

            assertEquals("include, orderBy, limit and offset only apply to reads", e.getMessage());
        }

        @Test
        @DisplayName("알 수 없는 관계 include")
        void unknownInclude() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.READ)
                    .include(Set.of("comments")).build());

            assertEquals("Unknown relation 'comments' on User", e.getMessage());
        }

        @Test
        @DisplayName("정렬 필드와 음수 paging")
        void orderAndPaging() {
            ValidationException order = rejected(query("User", QueryDescription.Kind.READ)
                    .orderBy(List.of(Order.asc("nickname"))).build());
            ValidationException limit = rejected(query("User", QueryDescription.Kind.READ).limit(-1).build());
            ValidationException offset = rejected(query("User", QueryDescription.Kind.READ).offset(-5).build());

            assertEquals("nickname", order.getField());
            assertEquals("limit must be >= 0", limit.getMessage());
            assertEquals("offset must be >= 0", offset.getMessage());
        }

        @Test
        @DisplayName("읽기 쿼리에 payload 금지")
        void payloadOnRead() {
            ValidationException e = rejected(query("User", QueryDescription.Kind.DELETE)
                    .filter(Filter.eq("id", 1))
                    .payload(Map.of("name", "x")).build());

            assertEquals("DELETE takes no payload", e.getMessage());
        }
    }
}
