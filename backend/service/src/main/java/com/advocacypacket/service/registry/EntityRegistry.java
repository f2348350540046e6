package com.advocacypacket.service.registry;

import com.advocacypacket.core.model.Entity;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the entity registry, in registry order.
 */
public class EntityRegistry {
    private final Map<String, Entity> byId = new LinkedHashMap<>();

    public EntityRegistry(Collection<Entity> entities) {
        for (Entity entity : entities) {
            byId.put(entity.id(), entity);
        }
    }

    public List<Entity> getAll() {
        return List.copyOf(byId.values());
    }

    public Optional<Entity> find(String entityId) {
        return Optional.ofNullable(byId.get(entityId));
    }

    public int size() {
        return byId.size();
    }
}
