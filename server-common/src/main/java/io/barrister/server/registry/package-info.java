@NullMarked
package io.barrister.server.registry;

import org.jspecify.annotations.NullMarked;
