package com.radioss.translator.deck;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.exception.IdentifierCollisionException;

/**
 * Hands out identifiers for one translation run.
 *
 * Identifiers are unique per entity kind. New identifiers are taken above the
 * highest identifier used anywhere in the kind's {@link NumberingSpace}, so a
 * subset, a part and a material never receive the same generated number.
 * Not thread-safe; each run creates its own allocator.
 */
public class IdentifierAllocator {
    private static final Logger log = LoggerFactory.getLogger(IdentifierAllocator.class);

    private final Map<EntityKind, Set<Integer>> used = new EnumMap<>(EntityKind.class);
    private final Map<NumberingSpace, Integer> maxima = new EnumMap<>(NumberingSpace.class);

    /**
     * Claims an identifier fixed by the source data or the deck definition.
     *
     * @throws IdentifierCollisionException if the identifier is already taken for this kind
     */
    public int reserve(EntityKind kind, int id) {
        if (id <= 0) {
            throw new IllegalArgumentException(kind + " identifier must be positive: " + id);
        }
        if (!used.computeIfAbsent(kind, k -> new TreeSet<>()).add(id)) {
            throw new IdentifierCollisionException(kind + " identifier " + id + " is already in use");
        }
        maxima.merge(kind.getSpace(), id, Math::max);
        return id;
    }

    public int allocate(EntityKind kind) {
        return allocate(kind, null);
    }

    /**
     * Returns {@code preferred} when it is free for this kind, else one above the current maximum of the space.
     */
    public int allocate(EntityKind kind, Integer preferred) {
        if (preferred != null && preferred > 0 && !isUsed(kind, preferred)) {
            return reserve(kind, preferred);
        }
        int next = currentMax(kind.getSpace()) + 1;
        if (preferred != null) {
            log.debug("{} identifier {} taken, using {}", kind, preferred, next);
        }
        return reserve(kind, next);
    }

    public boolean isUsed(EntityKind kind, int id) {
        Set<Integer> ids = used.get(kind);
        return ids != null && ids.contains(id);
    }

    public int currentMax(NumberingSpace space) {
        return maxima.getOrDefault(space, 0);
    }
}
