package fr.lapetina.modelhost.lifecycle.backend;

import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ModelHandle;
import fr.lapetina.modelhost.domain.model.QuantizationPolicy;

import java.nio.file.Path;

/**
 * External collaborator that performs the heavyweight work behind the
 * lifecycle manager: fetching artifacts, materializing them into memory and
 * releasing them again.
 *
 * Implementations may block for minutes in {@link #fetch} and
 * {@link #materialize}; callers bound them with their own timeouts and may
 * interrupt the calling thread.
 */
public interface ModelBackend extends AutoCloseable {

    /**
     * Fetches the artifacts for {@code repository} into {@code destination}.
     * Idempotent and resumable. On failure the destination must be absent or
     * complete, never partially populated.
     *
     * @throws BackendException if the artifacts could not be fetched
     */
    void fetch(String resourceId, String repository, Path destination);

    /**
     * Materializes previously fetched artifacts on the given device.
     *
     * @param device never {@link Device#AUTO}; the caller resolves it first
     * @return the handle and its measured memory footprint
     * @throws ResourceExhaustedException if the device lacks capacity
     * @throws BackendException           on any other failure
     */
    Materialized materialize(String resourceId, Path artifacts, Device device, QuantizationPolicy quantization);

    /**
     * Reference passed to {@link #fetch} for a catalog repository and its
     * quantization policy. The default uses the repository unchanged.
     */
    default String reference(String repository, QuantizationPolicy quantization) {
        return repository;
    }

    /**
     * Releases a handle. Called exactly once per successful materialize.
     *
     * @throws BackendException if the release failed; the handle is then still live
     */
    void release(ModelHandle handle);

    /**
     * Asks the backend to reclaim memory freed by earlier releases.
     * Best-effort; the default does nothing.
     */
    default void reclaimMemory() {
    }

    /**
     * Runs one generation against a materialized resource.
     */
    String serve(ModelHandle handle, String prompt, GenerationParameters parameters);

    /**
     * Short backend name for logs and listings.
     */
    String getName();

    @Override
    default void close() {
    }
}
