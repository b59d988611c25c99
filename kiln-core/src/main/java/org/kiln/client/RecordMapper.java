package org.kiln.client;

import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads rows selected with {@link QueryCompiler}'s select list (all fields, declaration order).
 */
public class RecordMapper {

    public EntityRecord map(ResultSet rs, EntityModel entity) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        int i = 1;
        for (FieldModel f : entity.getFields()) {
            values.put(f.getName(), read(rs, i++, f));
        }
        return new EntityRecord(entity.getName(), values);
    }

    private static Object read(ResultSet rs, int index, FieldModel field) throws SQLException {
        Object value = switch (field.getType()) {
            case INTEGER -> rs.getInt(index);
            case BIGINT -> rs.getLong(index);
            case DECIMAL -> rs.getBigDecimal(index);
            case DOUBLE -> rs.getDouble(index);
            case TEXT -> rs.getString(index);
            case BOOLEAN -> rs.getBoolean(index);
            case DATE -> rs.getObject(index, LocalDate.class);
            case TIMESTAMP -> rs.getObject(index, LocalDateTime.class);
        };
        return rs.wasNull() ? null : value;
    }
}
