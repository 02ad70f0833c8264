package fr.lapetina.modelhost.domain.model;

/**
 * Lifecycle phase of a catalog resource.
 *
 * NOT_DOWNLOADED -> DOWNLOADED -> LOADED, and LOADED -> DOWNLOADED on eviction.
 * The -ING phases are only visible while an operation holds the resource lock;
 * every operation resolves them to a stable phase before returning.
 */
public enum ResourcePhase {
    NOT_DOWNLOADED,
    DOWNLOADING,
    DOWNLOADED,
    LOADING,
    LOADED,
    UNLOADING;

    public boolean isTransitional() {
        return this == DOWNLOADING || this == LOADING || this == UNLOADING;
    }

    public boolean isDownloaded() {
        return this == DOWNLOADED || this == LOADING || this == LOADED || this == UNLOADING;
    }
}
