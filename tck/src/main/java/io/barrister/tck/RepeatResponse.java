package io.barrister.tck;

import java.util.List;

/**
 * Extends the IDL struct {@code Response}, so {@code status} is inherited there.
 */
public record RepeatResponse(Status status, long count, List<String> items) {

    public RepeatResponse {
        items = List.copyOf(items);
    }
}
