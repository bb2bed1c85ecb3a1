package in.tickforge.infrastructure.persistence;

import java.util.List;

/**
 * Durable key/value storage for serialized signal state.
 *
 * A {@code write} is atomic: a reader observes the complete previous payload or the complete
 * new one, never a mix. Failures surface as {@link in.tickforge.exception.PersistenceException}.
 */
public interface SignalStore {

    /**
     * Prepare the backend (create directories or tables, clear leftovers of interrupted writes).
     */
    void init();

    void write(String entityName, String storageKey, String payload);

    /**
     * @return the last committed payload, or null when nothing was written
     */
    String read(String entityName, String storageKey);

    void delete(String entityName, String storageKey);

    List<String> keys(String entityName);
}
