package org.Aayush.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.List;

/**
 * Dense code index backed by a fastutil open hash map.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // code -> index, without boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    // index -> code
    private final String[] reverse;

    /**
     * Builds the index from an ordered collection of distinct codes.
     */
    public FastUtilIDMapper(Collection<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("Ids cannot be null");
        }
        int size = orderedIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        int next = 0;
        for (String id : orderedIds) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Ids must be non-blank, found at position " + next);
            }
            if (forward.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate id detected in input: " + id);
            }
            forward.put(id, next);
            reverse[next] = id;
            next++;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        if (externalId == null) {
            throw new IllegalArgumentException("External id cannot be null");
        }
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External id not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal id out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public int size() {
        return reverse.length;
    }

    @Override
    public List<String> externalIds() {
        return List.of(reverse);
    }
}
