package org.kiln.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Read with includes and paging. Without an explicit order, records come back in identity order.
 */
@Value
@Builder(toBuilder = true)
public class ReadQuery {
    @Builder.Default Filter filter = Filter.all();
    @Singular("include") Set<String> includes;
    @Builder.Default List<Order> orderBy = List.of();
    Integer limit;
    Integer offset;
}
