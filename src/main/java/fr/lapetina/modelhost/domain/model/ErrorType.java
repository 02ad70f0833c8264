package fr.lapetina.modelhost.domain.model;

/**
 * Error taxonomy for lifecycle operations.
 * Provides clear categorization for error handling, HTTP mapping and metrics.
 */
public enum ErrorType {
    /** Unknown resource id */
    NOT_FOUND,

    /** Operation invalid for the current phase (e.g. load while a download is in flight) */
    CONFLICT,

    /** Download, materialize or release failed in the backend */
    BACKEND_FAILURE,

    /** Backend reported insufficient memory or device capacity */
    RESOURCE_EXHAUSTED,

    /** Operation exceeded its caller-supplied timeout */
    TIMEOUT,

    /** A collaborator is not wired up or not reachable */
    UNAVAILABLE
}
