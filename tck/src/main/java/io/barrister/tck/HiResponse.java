package io.barrister.tck;

public record HiResponse(String hi) {
}
