package org.Aayush.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;
import java.util.List;

/**
 * Bidirectional mapping between external venue codes and dense internal indices.
 *
 * <p>Internal indices are assigned in the order codes are registered, so two mappers
 * built from the same ordered input are interchangeable.</p>
 */
public interface IDMapper {

    /**
     * Converts an external code to its internal index.
     * @param externalId client-facing code.
     * @return internal index in {@code [0, size)}.
     * @throws UnknownIDException if the code is not registered.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external code.
     * @param internalId internal index.
     * @return client-facing code.
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * Checks whether an external code is registered.
     *
     * @param externalId code to test.
     * @return true when the code is present.
     */
    boolean containsExternal(String externalId);

    /**
     * Returns number of registered codes.
     */
    int size();

    /**
     * Returns registered codes in internal-index order.
     */
    List<String> externalIds();

    /**
     * Exception thrown when an external code cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation.
     *
     * @param orderedIds distinct, non-blank codes; position becomes the internal index.
     * @return an immutable IDMapper instance.
     */
    static IDMapper createImmutable(Collection<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
