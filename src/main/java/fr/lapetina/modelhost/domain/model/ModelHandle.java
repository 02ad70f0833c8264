package fr.lapetina.modelhost.domain.model;

/**
 * Opaque reference to a materialized resource, owned by the backend that
 * produced it. Only the lifecycle manager holds handles.
 */
public interface ModelHandle {

    /**
     * Id of the resource this handle was materialized for.
     */
    String resourceId();

    /**
     * Device the resource resides on.
     */
    Device device();
}
