package assistant.adapter.in.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;

import assistant.core.model.agent.AgentConfig;
import assistant.core.model.agent.AgentKind;

/**
 * DTO for agent creation and attach requests.
 *
 * @param kind          "standard" or "react" (optional, defaults to standard)
 * @param model         model identifier (required)
 * @param instructions  system instructions
 * @param toolGroups    tool groups the agent may call
 * @param maxInferIters maximum inference iterations, 0 for the default
 */
public record CreateAgentRequest(
        String kind,
        @NotBlank(message = "model is required") String model,
        String instructions,
        List<String> toolGroups,
        int maxInferIters) {

    public AgentKind agentKind() {
        return AgentKind.parse(kind);
    }

    public AgentConfig toConfig() {
        return new AgentConfig(model, instructions, toolGroups, maxInferIters);
    }
}
