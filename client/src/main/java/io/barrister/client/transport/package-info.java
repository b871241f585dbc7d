@NullMarked
package io.barrister.client.transport;

import org.jspecify.annotations.NullMarked;
