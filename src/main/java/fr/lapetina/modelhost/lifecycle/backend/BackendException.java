package fr.lapetina.modelhost.lifecycle.backend;

/**
 * Thrown when the model backend fails to fetch, materialize or release a resource.
 */
public class BackendException extends RuntimeException {

    private final String resourceId;

    public BackendException(String resourceId, String message) {
        super(message);
        this.resourceId = resourceId;
    }

    public BackendException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
