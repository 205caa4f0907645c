/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from (direction, discriminator) to binding.
 */
public final class HandlerTable {

    private final Map<Direction, Map<String, HandlerBinding>> bindings;

    HandlerTable(Map<Direction, Map<String, HandlerBinding>> bindings) {
        Map<Direction, Map<String, HandlerBinding>> copy = new EnumMap<>(Direction.class);
        for (Direction direction : Direction.values()) {
            copy.put(direction, Collections.unmodifiableMap(
                    new LinkedHashMap<>(bindings.getOrDefault(direction, Map.of()))));
        }
        this.bindings = Collections.unmodifiableMap(copy);
    }

    public Optional<HandlerBinding> lookup(Direction direction, String discriminator) {
        return Optional.ofNullable(bindings.get(direction).get(discriminator));
    }

    public Collection<HandlerBinding> bindings(Direction direction) {
        return bindings.get(direction).values();
    }
}
