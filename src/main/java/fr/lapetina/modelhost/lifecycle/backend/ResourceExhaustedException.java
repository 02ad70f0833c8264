package fr.lapetina.modelhost.lifecycle.backend;

/**
 * Thrown when the backend reports insufficient memory or device capacity.
 */
public final class ResourceExhaustedException extends BackendException {

    public ResourceExhaustedException(String resourceId, String message) {
        super(resourceId, message);
    }

    public ResourceExhaustedException(String resourceId, String message, Throwable cause) {
        super(resourceId, message, cause);
    }
}
