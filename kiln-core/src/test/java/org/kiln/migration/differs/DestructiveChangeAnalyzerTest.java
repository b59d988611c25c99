package org.kiln.migration.differs;

import org.kiln.migration.operation.AddField;
import org.kiln.migration.operation.AlterField;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.migration.operation.CreateEntity;
import org.kiln.migration.operation.DropEntity;
import org.kiln.migration.operation.DropField;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldDefault;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.testing.Schemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestructiveChangeAnalyzerTest {

    private final DestructiveChangeAnalyzer analyzer = new DestructiveChangeAnalyzer();

    private static FieldModel field(String name, FieldType type, boolean nullable) {
        return FieldModel.builder().name(name).columnName(name).type(type).nullable(nullable).build();
    }

    private List<DestructiveChange.Kind> kinds(ChangeOperation... ops) {
        return analyzer.analyze(List.of(ops)).stream().map(DestructiveChange::kind).toList();
    }

    @Test
    @DisplayName("테이블 생성과 nullable 필드 추가는 안전하다")
    void additiveChangesAreSafe() {
        EntityModel user = Schemas.userPost().requireEntity("User");

        assertTrue(kinds(new CreateEntity(user),
                new AddField("User", "users", field("bio", FieldType.TEXT, true))).isEmpty());
    }

    @Test
    @DisplayName("엔티티/필드 삭제는 데이터 손실")
    void dropsAreDestructive() {
        EntityModel user = Schemas.userPost().requireEntity("User");

        assertThat(kinds(new DropEntity(user), new DropField("User", "users", field("name", FieldType.TEXT, true))))
                .containsExactly(DestructiveChange.Kind.DROP_ENTITY, DestructiveChange.Kind.DROP_FIELD);
    }

    @Test
    @DisplayName("기본값 없는 필수 필드 추가는 기존 행을 깨뜨린다")
    void requiredFieldWithoutDefault() {
        List<DestructiveChange> changes = analyzer.analyze(List.of(
                new AddField("User", "users", field("nickname", FieldType.TEXT, false))));

        assertEquals(1, changes.size());
        assertEquals(DestructiveChange.Kind.REQUIRED_WITHOUT_DEFAULT, changes.get(0).kind());
        assertEquals("nickname", changes.get(0).field());
    }

    @Test
    @DisplayName("정적 기본값이 있는 필수 필드 추가는 안전하다")
    void requiredFieldWithStaticDefault() {
        FieldModel active = field("active", FieldType.BOOLEAN, false).toBuilder()
                .defaultValue(FieldDefault.literal("true"))
                .build();

        assertTrue(kinds(new AddField("User", "users", active)).isEmpty());
    }

    @Test
    @DisplayName("타입 확장은 안전하고 축소는 데이터 손실")
    void wideningVersusNarrowing() {
        FieldModel asInt = field("views", FieldType.INTEGER, false);
        FieldModel asBigint = field("views", FieldType.BIGINT, false);

        assertTrue(kinds(new AlterField("Post", "posts", asInt, asBigint)).isEmpty());
        assertThat(kinds(new AlterField("Post", "posts", asBigint, asInt)))
                .containsExactly(DestructiveChange.Kind.TYPE_NARROWING);
    }

    @Test
    @DisplayName("텍스트 길이 축소와 nullable 해제를 감지한다")
    void shorterTextAndNotNull() {
        FieldModel from = field("name", FieldType.TEXT, true).toBuilder().length(120).build();
        FieldModel to = field("name", FieldType.TEXT, false).toBuilder().length(60).build();

        assertThat(kinds(new AlterField("User", "users", from, to)))
                .containsExactly(DestructiveChange.Kind.TYPE_NARROWING, DestructiveChange.Kind.NULLABLE_TO_REQUIRED);
    }
}
