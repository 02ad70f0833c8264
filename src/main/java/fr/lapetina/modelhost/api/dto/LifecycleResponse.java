package fr.lapetina.modelhost.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.modelhost.domain.model.LifecycleResult;

import java.util.Locale;

/**
 * Outcome of a lifecycle call as returned over HTTP.
 * Successful calls carry {@code message}; failed ones {@code error} and {@code error_type}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LifecycleResponse {

    @JsonProperty("model_id")
    private String modelId;

    private String operation;
    private boolean success;
    private String message;
    private String error;

    @JsonProperty("error_type")
    private String errorType;

    private String phase;

    @JsonProperty("elapsed_ms")
    private long elapsedMs;

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public String getPhase() { return phase; }
    public void setPhase(String phase) { this.phase = phase; }

    public long getElapsedMs() { return elapsedMs; }
    public void setElapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; }

    public static LifecycleResponse from(LifecycleResult result) {
        LifecycleResponse api = new LifecycleResponse();
        api.setModelId(result.resourceId());
        api.setOperation(result.operation().name().toLowerCase(Locale.ROOT));
        api.setSuccess(result.success());
        if (result.success()) {
            api.setMessage(result.message());
        } else {
            api.setError(result.message());
            api.setErrorType(result.errorType().name());
        }
        if (result.phase() != null) {
            api.setPhase(result.phase().name().toLowerCase(Locale.ROOT));
        }
        api.setElapsedMs(result.elapsed().toMillis());
        return api;
    }
}
