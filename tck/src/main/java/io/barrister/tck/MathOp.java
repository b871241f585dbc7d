package io.barrister.tck;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MathOp {
    @JsonProperty("add")
    ADD,
    /** mult comment */
    @JsonProperty("multiply")
    MULTIPLY
}
