package io.barrister.tck;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RepeatRequest(@JsonProperty("to_repeat") String toRepeat,
                            long count,
                            @JsonProperty("force_uppercase") boolean forceUppercase) {
}
