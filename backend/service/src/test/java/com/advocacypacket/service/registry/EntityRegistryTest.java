package com.advocacypacket.service.registry;

import com.advocacypacket.core.model.Entity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityRegistryTest {
    @Test
    void keepsRegistryOrderAndFindsById() {
        Entity first = new Entity("epa_2", "Second Listed First", List.of("NM"), null);
        Entity second = new Entity("epa_1", "First", List.of("WA"), null);
        EntityRegistry registry = new EntityRegistry(List.of(first, second));

        assertEquals(List.of(first, second), registry.getAll());
        assertEquals(second, registry.find("epa_1").orElseThrow());
        assertTrue(registry.find("epa_3").isEmpty());
        assertEquals(2, registry.size());
    }
}
