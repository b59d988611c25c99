package org.kiln.migration.dialect.mysql;

import org.kiln.model.EntityModel;
import org.kiln.model.FieldDefault;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.ForeignKeyModel;
import org.kiln.model.OnDeleteAction;
import org.kiln.testing.Schemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MySqlDialectTest {

    private final MySqlDialect dialect = new MySqlDialect();

    @Test
    @DisplayName("quoteIdentifier는 backtick으로 감싼다")
    void quoteIdentifier_backtick() {
        assertEquals("`users`", dialect.quoteIdentifier("users"));
        assertEquals("`we``ird`", dialect.quoteIdentifier("we`ird"));
    }

    @Test
    @DisplayName("CREATE TABLE은 InnoDB/utf8mb4로 끝난다")
    void createTable() {
        EntityModel post = Schemas.userPost().requireEntity("Post");

        assertEquals("""
                CREATE TABLE `posts` (
                  `id` INT NOT NULL AUTO_INCREMENT,
                  `title` VARCHAR(200) NOT NULL,
                  `published` TINYINT(1) NOT NULL DEFAULT 0,
                  `author_id` INT NOT NULL,
                  PRIMARY KEY (`id`)
                ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_unicode_ci""", dialect.getCreateTableSql(post));
    }

    @Test
    @DisplayName("컬럼 변경은 MODIFY COLUMN 하나로 전체 정의를 다시 쓴다")
    void alterColumnRestatesDefinition() {
        FieldModel from = FieldModel.builder().name("views").columnName("views").type(FieldType.INTEGER).nullable(true).build();
        FieldModel to = from.toBuilder().type(FieldType.BIGINT).nullable(false).defaultValue(FieldDefault.literal("0")).build();

        assertEquals(List.of("ALTER TABLE `posts` MODIFY COLUMN `views` BIGINT NOT NULL DEFAULT 0"),
                dialect.getAlterColumnSql("posts", from, to));
    }

    @Test
    @DisplayName("unique와 외래키 삭제는 MySQL 전용 구문을 쓴다")
    void dropSyntax() {
        ForeignKeyModel fk = new ForeignKeyModel("fk_posts__author_id__users", "ix_posts__author_id", "Post", "author",
                "posts", "author_id", "User", "users", "id", OnDeleteAction.CASCADE, false);

        assertEquals("ALTER TABLE `users` DROP INDEX `uq_users__email`", dialect.getDropUniqueSql("users", "uq_users__email"));
        assertEquals("ALTER TABLE `posts` DROP FOREIGN KEY `fk_posts__author_id__users`", dialect.getDropForeignKeySql(fk));
        assertEquals("DROP INDEX `ix_posts__author_id` ON `posts`", dialect.getDropIndexSql("posts", "ix_posts__author_id"));
    }

    @Test
    @DisplayName("OFFSET만 있으면 최대 LIMIT을 붙인다")
    void offsetWithoutLimit() {
        assertEquals(" LIMIT 18446744073709551615 OFFSET 5", dialect.getLimitOffsetSql(null, 5));
        assertEquals(" LIMIT 10 OFFSET 5", dialect.getLimitOffsetSql(10, 5));
        assertEquals(" LIMIT 10", dialect.getLimitOffsetSql(10, 0));
    }

    @Test
    @DisplayName("타임스탬프와 문자열 기본값 리터럴")
    void literalDefaults() {
        FieldModel at = FieldModel.builder().name("at").columnName("at").type(FieldType.TIMESTAMP)
                .defaultValue(FieldDefault.literal("2024-01-02T03:04:05")).build();
        FieldModel path = FieldModel.builder().name("path").columnName("path").type(FieldType.TEXT).length(50)
                .nullable(true).defaultValue(FieldDefault.literal("C:\\tmp")).build();

        assertEquals("`at` DATETIME(6) NOT NULL DEFAULT '2024-01-02 03:04:05.000000'", dialect.getColumnDefinitionSql(at));
        assertEquals("`path` VARCHAR(50) DEFAULT 'C:\\\\tmp'", dialect.getColumnDefinitionSql(path));
    }
}
