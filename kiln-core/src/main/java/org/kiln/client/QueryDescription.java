package org.kiln.client;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a client call asks of the store, before validation and compilation.
 */
@Value
@Builder(toBuilder = true)
public class QueryDescription {

    public enum Kind { CREATE, READ, UPDATE, DELETE, COUNT }

    String entity;
    Kind kind;
    @Builder.Default Filter filter = Filter.all();
    /** field name to value; may hold {@code null} values */
    @Builder.Default Map<String, Object> payload = Map.of();
    @Builder.Default Set<String> include = Set.of();
    @Builder.Default List<Order> orderBy = List.of();
    Integer limit;
    Integer offset;
}
