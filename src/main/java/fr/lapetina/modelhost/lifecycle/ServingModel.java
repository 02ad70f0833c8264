package fr.lapetina.modelhost.lifecycle;

import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ModelHandle;
import fr.lapetina.modelhost.domain.model.ResourceDescriptor;
import fr.lapetina.modelhost.lifecycle.backend.GenerationParameters;
import fr.lapetina.modelhost.lifecycle.backend.ModelBackend;

/**
 * Serve-only view of a loaded resource.
 *
 * Callers can run generations but cannot release the underlying handle;
 * eviction goes through {@link LifecycleManager#unload(String)}. A serving
 * model obtained before an unload fails with a backend error once the
 * handle has been released.
 */
public final class ServingModel {

    private final ResourceDescriptor descriptor;
    private final ModelHandle handle;
    private final ModelBackend backend;

    ServingModel(ResourceDescriptor descriptor, ModelHandle handle, ModelBackend backend) {
        this.descriptor = descriptor;
        this.handle = handle;
        this.backend = backend;
    }

    public String generate(String prompt, GenerationParameters parameters) {
        return backend.serve(handle, prompt, parameters);
    }

    public String generate(String prompt) {
        return generate(prompt, GenerationParameters.defaults());
    }

    public String id() {
        return descriptor.id();
    }

    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    public Device device() {
        return handle.device();
    }

    @Override
    public String toString() {
        return "ServingModel{id='" + descriptor.id() + "', device=" + handle.device() + "}";
    }
}
