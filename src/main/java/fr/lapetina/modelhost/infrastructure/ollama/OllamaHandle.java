package fr.lapetina.modelhost.infrastructure.ollama;

import fr.lapetina.modelhost.domain.model.Device;
import fr.lapetina.modelhost.domain.model.ModelHandle;

/**
 * A model kept resident by an Ollama server.
 *
 * @param model Ollama model tag the resource was loaded under
 */
record OllamaHandle(String resourceId, String model, Device device) implements ModelHandle {
}
