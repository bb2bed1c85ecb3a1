package in.tickforge.exception;

/**
 * Thrown when signal state cannot be read, parsed or written.
 */
public class PersistenceException extends RecoverableEngineException {

    private final String entityName;
    private final String storageKey;

    public PersistenceException(String entityName, String storageKey, String message) {
        super(entityName + ":" + storageKey, message);
        this.entityName = entityName;
        this.storageKey = storageKey;
    }

    public PersistenceException(String entityName, String storageKey, String message, Throwable cause) {
        super(entityName + ":" + storageKey, message, cause);
        this.entityName = entityName;
        this.storageKey = storageKey;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getStorageKey() {
        return storageKey;
    }
}
