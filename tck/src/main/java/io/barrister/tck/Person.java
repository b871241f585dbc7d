package io.barrister.tck;

import org.jspecify.annotations.Nullable;

public record Person(String personId, String firstName, String lastName, @Nullable String email) {
}
