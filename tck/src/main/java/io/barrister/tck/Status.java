package io.barrister.tck;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Status {
    @JsonProperty("ok")
    OK,
    @JsonProperty("err")
    ERR
}
