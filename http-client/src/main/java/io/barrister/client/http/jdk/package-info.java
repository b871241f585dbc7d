@NullMarked
package io.barrister.client.http.jdk;

import org.jspecify.annotations.NullMarked;
