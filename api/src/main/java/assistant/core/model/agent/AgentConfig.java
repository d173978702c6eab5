package assistant.core.model.agent;

import java.util.List;

/**
 * Configuration sent to llama-stack when creating an agent.
 *
 * @param model         model identifier
 * @param instructions  system instructions
 * @param toolGroups    tool groups the agent may call
 * @param maxInferIters maximum inference iterations per turn
 */
public record AgentConfig(String model, String instructions, List<String> toolGroups, int maxInferIters) {

    public static final int DEFAULT_MAX_INFER_ITERS = 10;

    public AgentConfig {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model cannot be null or blank");
        }
        if (instructions == null) {
            instructions = "";
        }
        toolGroups = toolGroups == null ? List.of() : List.copyOf(toolGroups);
        if (maxInferIters <= 0) {
            maxInferIters = DEFAULT_MAX_INFER_ITERS;
        }
    }
}
