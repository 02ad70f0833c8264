package fr.lapetina.modelhost.lifecycle;

import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ErrorType;
import fr.lapetina.modelhost.domain.model.LifecycleResult;
import fr.lapetina.modelhost.domain.model.LifecycleResult.Operation;
import fr.lapetina.modelhost.domain.model.ModelHandle;
import fr.lapetina.modelhost.domain.model.ResourceDescriptor;
import fr.lapetina.modelhost.domain.model.ResourcePhase;
import fr.lapetina.modelhost.domain.model.ResourceSnapshot;
import fr.lapetina.modelhost.domain.model.ResourceState;
import fr.lapetina.modelhost.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.modelhost.lifecycle.backend.Materialized;
import fr.lapetina.modelhost.lifecycle.backend.ModelBackend;
import fr.lapetina.modelhost.lifecycle.backend.ResourceExhaustedException;
import fr.lapetina.modelhost.telemetry.AcceleratorProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Owns the state machine of every catalog resource:
 * NOT_DOWNLOADED -> DOWNLOADING -> DOWNLOADED -> LOADING -> LOADED -> UNLOADING -> DOWNLOADED.
 *
 * Thread-safety:
 * - Each resource has its own fair lock; operations on different ids run in parallel.
 * - State is an immutable {@link ResourceState} published through a volatile field,
 *   so {@link #list()}, {@link #status(String)} and {@link #get(String)} never block.
 * - Backend calls run on a worker pool and are bounded by a timeout. When the caller
 *   gives up, a result that still arrives (a handle, a staging directory) is released
 *   or deleted exactly once.
 *
 * Concurrent loads of the same id are serialized in arrival order; each one releases
 * the previous handle before materializing, so the last load wins.
 *
 * Expected failures never throw: every operation returns a {@link LifecycleResult}.
 */
public final class LifecycleManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final String STAGING_MARKER = ResourceDescriptor.STAGING_MARKER;

    private final ResourceCatalog catalog;
    private final ModelBackend backend;
    private final AcceleratorProbe acceleratorProbe;
    private final MetricsRegistry metrics;
    private final Settings settings;
    private final Clock clock;
    private final ExecutorService workers;
    private final Map<String, ResourceSlot> slots;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Storage location, timeouts and worker pool size.
     */
    public record Settings(
            Path storageDir,
            Duration downloadTimeout,
            Duration loadTimeout,
            Duration unloadTimeout,
            int workerThreads
    ) {
        public Settings {
            Objects.requireNonNull(storageDir, "Storage directory is required");
            Objects.requireNonNull(downloadTimeout, "Download timeout is required");
            Objects.requireNonNull(loadTimeout, "Load timeout is required");
            Objects.requireNonNull(unloadTimeout, "Unload timeout is required");
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("Worker threads must be positive: " + workerThreads);
            }
        }

        public static Settings defaults(Path storageDir) {
            return new Settings(storageDir, Duration.ofHours(1), Duration.ofMinutes(10), Duration.ofMinutes(1), 4);
        }
    }

    public LifecycleManager(
            ResourceCatalog catalog,
            ModelBackend backend,
            AcceleratorProbe acceleratorProbe,
            Settings settings,
            MetricsRegistry metrics
    ) {
        this(catalog, backend, acceleratorProbe, settings, metrics, Clock.systemUTC());
    }

    LifecycleManager(
            ResourceCatalog catalog,
            ModelBackend backend,
            AcceleratorProbe acceleratorProbe,
            Settings settings,
            MetricsRegistry metrics,
            Clock clock
    ) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog is required");
        this.backend = Objects.requireNonNull(backend, "Backend is required");
        this.acceleratorProbe = Objects.requireNonNull(acceleratorProbe, "Accelerator probe is required");
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "lifecycle-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        prepareStorage();

        Map<String, ResourceSlot> bySlot = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : catalog.all()) {
            boolean downloaded = Files.isDirectory(artifactPath(descriptor.id()));
            bySlot.put(descriptor.id(), new ResourceSlot(descriptor, ResourceState.initial(downloaded, clock.instant())));
        }
        this.slots = Collections.unmodifiableMap(bySlot);

        metrics.registerLoadedResources(this::loadedCount);

        log.info("LifecycleManager initialized: resources={}, downloaded={}, storageDir={}, backend={}",
                slots.size(),
                slots.values().stream().filter(s -> s.state.phase().isDownloaded()).count(),
                settings.storageDir(),
                backend.getName());
    }

    // ---------------------------------------------------------------- download

    public LifecycleResult download(String id, boolean force) {
        return download(id, force, settings.downloadTimeout());
    }

    /**
     * Fetches artifacts into a private staging directory and moves them into place.
     * A no-op success when already downloaded and {@code force} is false.
     */
    public LifecycleResult download(String id, boolean force, Duration timeout) {
        long start = System.nanoTime();
        ResourceSlot slot = slots.get(id);
        if (slot == null) {
            return finish(notFound(id, Operation.DOWNLOAD, start));
        }
        return withLock(slot, Operation.DOWNLOAD, timeout, start,
                () -> doDownload(slot, force, remaining(start, timeout), start));
    }

    private LifecycleResult doDownload(ResourceSlot slot, boolean force, Duration budget, long start) {
        String id = slot.id();
        ResourceState state = slot.state;

        if (state.isLoaded() && force) {
            return error(slot, Operation.DOWNLOAD, ErrorType.CONFLICT,
                    "Resource is loaded; unload it before forcing a download", start);
        }
        if (state.phase().isDownloaded() && !force) {
            return success(slot, Operation.DOWNLOAD, "Already downloaded", start);
        }

        Path target = artifactPath(id);
        Path staging = settings.storageDir().resolve(id + STAGING_MARKER + UUID.randomUUID());
        String repository = backend.reference(slot.descriptor.repository(), slot.descriptor.quantization());

        slot.transition(state.transitionTo(ResourcePhase.DOWNLOADING, clock.instant()));
        log.info("Download started: resourceId={}, repository={}, force={}", id, repository, force);

        try {
            callBounded(() -> {
                try {
                    backend.fetch(id, repository, staging);
                } catch (RuntimeException e) {
                    deleteQuietly(staging);
                    throw e;
                }
                return staging;
            }, budget, this::deleteQuietly);

            install(staging, target);
            slot.transition(slot.state.transitionTo(ResourcePhase.DOWNLOADED, clock.instant()).clearError());
            log.info("Download completed: resourceId={}, path={}, durationMs={}", id, target, since(start).toMillis());
            return success(slot, Operation.DOWNLOAD, "Downloaded " + repository, start);

        } catch (TimeoutException e) {
            return failDownload(slot, staging, ErrorType.TIMEOUT,
                    "Download timed out after " + budget.toMillis() + " ms", start);
        } catch (ExecutionException e) {
            return failDownload(slot, staging, classify(e.getCause()),
                    "Download failed: " + describe(e.getCause()), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failDownload(slot, staging, ErrorType.UNAVAILABLE, "Download interrupted", start);
        } catch (IOException | UncheckedIOException e) {
            return failDownload(slot, staging, ErrorType.BACKEND_FAILURE,
                    "Failed to install artifacts: " + e.getMessage(), start);
        } catch (RuntimeException e) {
            return failDownload(slot, staging, ErrorType.BACKEND_FAILURE,
                    "Download failed: " + describe(e), start);
        }
    }

    private LifecycleResult failDownload(ResourceSlot slot, Path staging, ErrorType type, String message, long start) {
        deleteQuietly(staging);
        // A forced refresh that failed keeps the previous artifacts
        ResourcePhase phase = Files.isDirectory(artifactPath(slot.id()))
                ? ResourcePhase.DOWNLOADED
                : ResourcePhase.NOT_DOWNLOADED;
        slot.transition(slot.state.transitionTo(phase, clock.instant()).withError(message));
        return error(slot, Operation.DOWNLOAD, type, message, start);
    }

    private void install(Path staging, Path target) throws IOException {
        if (!Files.isDirectory(staging)) {
            throw new IOException("Backend produced no artifacts at " + staging);
        }
        if (Files.exists(target)) {
            deleteRecursively(target);
        }
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, target);
        }
    }

    // -------------------------------------------------------------------- load

    public LifecycleResult load(String id, Device device) {
        return load(id, device, settings.loadTimeout());
    }

    /**
     * Materializes a downloaded resource. A loaded resource is unloaded first.
     * Fails fast with CONFLICT while a download of the same id is in flight.
     */
    public LifecycleResult load(String id, Device device, Duration timeout) {
        long start = System.nanoTime();
        ResourceSlot slot = slots.get(id);
        if (slot == null) {
            return finish(notFound(id, Operation.LOAD, start));
        }
        if (slot.state.phase() == ResourcePhase.DOWNLOADING) {
            return finish(error(slot, Operation.LOAD, ErrorType.CONFLICT,
                    "Download in progress for " + id, start));
        }
        return withLock(slot, Operation.LOAD, timeout, start,
                () -> doLoad(slot, device, timeout, start));
    }

    private LifecycleResult doLoad(ResourceSlot slot, Device requested, Duration timeout, long start) {
        String id = slot.id();

        if (!slot.state.phase().isDownloaded()) {
            return error(slot, Operation.LOAD, ErrorType.CONFLICT, "Resource is not downloaded", start);
        }

        if (slot.state.isLoaded()) {
            log.info("Reload requested, releasing current instance: resourceId={}", id);
            LifecycleResult released = finish(doUnload(slot, settings.unloadTimeout(), System.nanoTime()));
            if (!released.success()) {
                return error(slot, Operation.LOAD, released.errorType(),
                        "Could not release previous instance: " + released.message(), start);
            }
        }

        Device device = resolveDevice(requested, slot.descriptor);
        Duration budget = remaining(start, timeout);

        slot.transition(slot.state.transitionTo(ResourcePhase.LOADING, clock.instant()));
        log.info("Load started: resourceId={}, device={}, quantization={}",
                id, device, slot.descriptor.quantization());

        long loadStart = System.nanoTime();
        try {
            Materialized materialized = callBounded(
                    () -> backend.materialize(id, artifactPath(id), device, slot.descriptor.quantization()),
                    budget,
                    late -> releaseLate(id, late.handle()));

            Duration loadDuration = since(loadStart);
            slot.transition(slot.state.loaded(
                    materialized.handle(), materialized.footprintBytes(), loadDuration, clock.instant()));
            log.info("Load completed: resourceId={}, device={}, memoryBytes={}, durationMs={}",
                    id, device, materialized.footprintBytes(), loadDuration.toMillis());
            return success(slot, Operation.LOAD, "Loaded on " + device.value(), start);

        } catch (TimeoutException e) {
            return failLoad(slot, ErrorType.TIMEOUT, "Load timed out after " + budget.toMillis() + " ms", start);
        } catch (ExecutionException e) {
            return failLoad(slot, classify(e.getCause()), "Load failed: " + describe(e.getCause()), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failLoad(slot, ErrorType.UNAVAILABLE, "Load interrupted", start);
        } catch (RuntimeException e) {
            return failLoad(slot, ErrorType.BACKEND_FAILURE, "Load failed: " + describe(e), start);
        }
    }

    private LifecycleResult failLoad(ResourceSlot slot, ErrorType type, String message, long start) {
        slot.transition(slot.state.transitionTo(ResourcePhase.DOWNLOADED, clock.instant()).withError(message));
        return error(slot, Operation.LOAD, type, message, start);
    }

    private Device resolveDevice(Device requested, ResourceDescriptor descriptor) {
        Device preferred = requested == null || requested == Device.AUTO
                ? descriptor.devicePreference()
                : requested;
        if (preferred != Device.AUTO) {
            return preferred;
        }
        return acceleratorProbe.isAvailable() ? Device.ACCELERATOR : Device.CPU;
    }

    private void releaseLate(String id, ModelHandle handle) {
        try {
            backend.release(handle);
            log.info("Released late handle of abandoned load: resourceId={}", id);
        } catch (RuntimeException e) {
            log.error("Failed to release late handle: resourceId={}, error={}", id, e.getMessage());
        }
    }

    // ------------------------------------------------------------------ unload

    public LifecycleResult unload(String id) {
        return unload(id, settings.unloadTimeout());
    }

    /**
     * Releases a loaded resource. A no-op success when not loaded.
     * A failed release keeps the resource LOADED so it can be retried.
     */
    public LifecycleResult unload(String id, Duration timeout) {
        long start = System.nanoTime();
        ResourceSlot slot = slots.get(id);
        if (slot == null) {
            return finish(notFound(id, Operation.UNLOAD, start));
        }
        return withLock(slot, Operation.UNLOAD, timeout, start,
                () -> doUnload(slot, remaining(start, timeout), start));
    }

    private LifecycleResult doUnload(ResourceSlot slot, Duration budget, long start) {
        String id = slot.id();
        ResourceState loaded = slot.state;
        if (!loaded.isLoaded()) {
            return success(slot, Operation.UNLOAD, "Not loaded", start);
        }

        ModelHandle handle = loaded.handle();
        if (slot.releasedHandle == handle) {
            // Released by an earlier unload that timed out
            return completeUnload(slot, start);
        }
        if (slot.releasingHandle == handle) {
            return error(slot, Operation.UNLOAD, ErrorType.CONFLICT,
                    "Release of " + id + " still in progress", start);
        }

        slot.transition(loaded.transitionTo(ResourcePhase.UNLOADING, clock.instant()));
        slot.releasingHandle = handle;
        log.info("Unload started: resourceId={}, device={}", id, loaded.device());

        try {
            callBounded(() -> {
                try {
                    backend.release(handle);
                    slot.releasedHandle = handle;
                } finally {
                    slot.releasingHandle = null;
                }
                return Boolean.TRUE;
            }, budget, released -> completeLateUnload(slot, handle));
        } catch (TimeoutException e) {
            if (slot.releasedHandle == handle) {
                return completeUnload(slot, start);
            }
            return failUnload(slot, loaded, ErrorType.TIMEOUT,
                    "Unload timed out after " + budget.toMillis() + " ms", start);
        } catch (ExecutionException e) {
            return failUnload(slot, loaded, ErrorType.BACKEND_FAILURE,
                    "Unload failed: " + describe(e.getCause()), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (slot.releasedHandle == handle) {
                return completeUnload(slot, start);
            }
            return failUnload(slot, loaded, ErrorType.UNAVAILABLE, "Unload interrupted", start);
        } catch (RuntimeException e) {
            return failUnload(slot, loaded, ErrorType.BACKEND_FAILURE, "Unload failed: " + describe(e), start);
        }

        return completeUnload(slot, start);
    }

    private LifecycleResult completeUnload(ResourceSlot slot, long start) {
        reclaimMemory(slot.id());
        slot.transition(slot.state.transitionTo(ResourcePhase.DOWNLOADED, clock.instant()).clearError());
        log.info("Unload completed: resourceId={}, durationMs={}", slot.id(), since(start).toMillis());
        return success(slot, Operation.UNLOAD, "Unloaded", start);
    }

    /**
     * Runs on the worker when a release finishes after its caller timed out.
     * The resource was left LOADED with the now released handle; move it to DOWNLOADED.
     */
    private void completeLateUnload(ResourceSlot slot, ModelHandle handle) {
        slot.lock.lock();
        try {
            ResourceState state = slot.state;
            if (state.isLoaded() && state.handle() == handle) {
                reclaimMemory(slot.id());
                slot.transition(state.transitionTo(ResourcePhase.DOWNLOADED, clock.instant()).clearError());
                log.info("Late release completed: resourceId={}", slot.id());
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private void reclaimMemory(String id) {
        try {
            backend.reclaimMemory();
        } catch (RuntimeException e) {
            log.warn("Memory reclamation failed: resourceId={}, error={}", id, e.getMessage());
        }
    }

    private LifecycleResult failUnload(
            ResourceSlot slot, ResourceState loaded, ErrorType type, String message, long start) {
        slot.transition(loaded.withError(message));
        return error(slot, Operation.UNLOAD, type, message, start);
    }

    // ------------------------------------------------------------------- reads

    /**
     * Returns a serving view when the resource is loaded.
     */
    public Optional<ServingModel> get(String id) {
        ResourceSlot slot = slots.get(id);
        if (slot == null) {
            return Optional.empty();
        }
        ResourceState state = slot.state;
        if (!state.isLoaded()) {
            return Optional.empty();
        }
        return Optional.of(new ServingModel(slot.descriptor, state.handle(), backend));
    }

    /**
     * Snapshot of every resource in catalog order. Never blocks.
     */
    public List<ResourceSnapshot> list() {
        return slots.values().stream()
                .map(ResourceSlot::snapshot)
                .toList();
    }

    public Optional<ResourceSnapshot> status(String id) {
        return Optional.ofNullable(slots.get(id)).map(ResourceSlot::snapshot);
    }

    public int loadedCount() {
        return (int) slots.values().stream()
                .filter(slot -> slot.state.isLoaded())
                .count();
    }

    public ResourceCatalog getCatalog() {
        return catalog;
    }

    public String getBackendName() {
        return backend.getName();
    }

    public Path artifactPath(String id) {
        Path storageDir = settings.storageDir().toAbsolutePath().normalize();
        Path path = storageDir.resolve(id).normalize();
        if (!storageDir.equals(path.getParent())) {
            throw new IllegalArgumentException("Resource path escapes the storage directory: " + id);
        }
        return path;
    }

    // ----------------------------------------------------------------- cleanup

    /**
     * Unloads every loaded resource, continuing past failures.
     */
    public CleanupReport cleanupAll() {
        List<String> unloaded = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (ResourceSlot slot : slots.values()) {
            if (!slot.state.isLoaded()) {
                continue;
            }
            LifecycleResult result = unload(slot.id());
            if (result.success()) {
                unloaded.add(slot.id());
            } else {
                failures.put(slot.id(), result.message());
            }
        }

        log.info("Cleanup completed: unloaded={}, failed={}", unloaded.size(), failures.size());
        return new CleanupReport(unloaded, failures);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            CleanupReport report = cleanupAll();
            if (!report.isClean()) {
                log.warn("Resources still loaded at shutdown: {}", report.failures().keySet());
            }
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("LifecycleManager closed");
        }
    }

    // ----------------------------------------------------------------- helpers

    private LifecycleResult withLock(
            ResourceSlot slot, Operation operation, Duration timeout, long start,
            java.util.function.Supplier<LifecycleResult> action
    ) {
        try {
            if (!slot.lock.tryLock(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS)) {
                return finish(error(slot, operation, ErrorType.TIMEOUT,
                        "Timed out waiting for another operation on " + slot.id(), start));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(error(slot, operation, ErrorType.UNAVAILABLE, "Interrupted while waiting", start));
        }
        try {
            return finish(action.get());
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Runs {@code work} on the worker pool and waits at most {@code timeout}.
     * A value produced after the caller stopped waiting goes to {@code discardLate}.
     */
    private <T> T callBounded(Callable<T> work, Duration timeout, Consumer<T> discardLate)
            throws TimeoutException, ExecutionException, InterruptedException {
        Attempt<T> attempt = new Attempt<>();
        Future<T> future = workers.submit(() -> {
            T value = work.call();
            if (!attempt.complete(value)) {
                discardLate.accept(value);
            }
            return value;
        });
        try {
            return future.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            T late = attempt.abandon();
            if (late != null) {
                discardLate.accept(late);
            }
            throw e;
        }
    }

    private LifecycleResult finish(LifecycleResult result) {
        // Unknown ids are not tagged, to keep meter cardinality bounded
        if (result.errorType() != ErrorType.NOT_FOUND) {
            metrics.recordOperation(result);
        }
        if (result.isError()) {
            log.warn("Lifecycle operation failed: resourceId={}, operation={}, errorType={}, message={}",
                    result.resourceId(), result.operation(), result.errorType(), result.message());
        }
        return result;
    }

    private LifecycleResult success(ResourceSlot slot, Operation operation, String message, long start) {
        return LifecycleResult.success(slot.id(), operation, message, slot.state.phase(), since(start));
    }

    private LifecycleResult error(ResourceSlot slot, Operation operation, ErrorType type, String message, long start) {
        return LifecycleResult.error(slot.id(), operation, type, message, slot.state.phase(), since(start));
    }

    private LifecycleResult notFound(String id, Operation operation, long start) {
        return LifecycleResult.error(String.valueOf(id), operation, ErrorType.NOT_FOUND,
                "Unknown resource: " + id, null, since(start));
    }

    private static ErrorType classify(Throwable cause) {
        return cause instanceof ResourceExhaustedException
                ? ErrorType.RESOURCE_EXHAUSTED
                : ErrorType.BACKEND_FAILURE;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static Duration remaining(long startNanos, Duration timeout) {
        Duration left = timeout.minus(since(startNanos));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private void prepareStorage() {
        Path storageDir = settings.storageDir();
        try {
            Files.createDirectories(storageDir);
            try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(storageDir, "*" + STAGING_MARKER + "*")) {
                for (Path leftover : leftovers) {
                    log.info("Removing leftover staging directory: path={}", leftover);
                    deleteQuietly(leftover);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot prepare storage directory " + storageDir, e);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            deleteRecursively(path);
        } catch (IOException e) {
            log.warn("Failed to delete: path={}, error={}", path, e.getMessage());
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }

    /**
     * Per-resource lock and current state.
     */
    private static final class ResourceSlot {
        private final ResourceDescriptor descriptor;
        private final ReentrantLock lock = new ReentrantLock(true);
        private volatile ResourceState state;
        // Handle whose release is running on a worker
        private volatile ModelHandle releasingHandle;
        // Last handle the backend confirmed released
        private volatile ModelHandle releasedHandle;

        ResourceSlot(ResourceDescriptor descriptor, ResourceState initial) {
            this.descriptor = descriptor;
            this.state = initial;
        }

        String id() {
            return descriptor.id();
        }

        // Only called with the lock held
        void transition(ResourceState next) {
            state = next;
        }

        ResourceSnapshot snapshot() {
            return ResourceSnapshot.of(descriptor, state);
        }
    }

    /**
     * Hand-off between a worker and a caller that may stop waiting.
     * Whichever side observes the result last owns its disposal.
     */
    private static final class Attempt<T> {
        private T result;
        private boolean abandoned;

        synchronized boolean complete(T value) {
            if (abandoned) {
                return false;
            }
            result = value;
            return true;
        }

        synchronized T abandon() {
            abandoned = true;
            T value = result;
            result = null;
            return value;
        }
    }
}
