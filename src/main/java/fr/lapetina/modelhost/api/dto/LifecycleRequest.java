package fr.lapetina.modelhost.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the download, load and unload endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LifecycleRequest {

    @JsonProperty("model_id")
    private String modelId;

    private boolean force;

    private String device;

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public boolean isForce() { return force; }
    public void setForce(boolean force) { this.force = force; }

    public String getDevice() { return device; }
    public void setDevice(String device) { this.device = device; }
}
