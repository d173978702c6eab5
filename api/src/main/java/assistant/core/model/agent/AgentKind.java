package assistant.core.model.agent;

import java.util.Locale;

/**
 * Agent flavours supported by llama-stack.
 */
public enum AgentKind {
    /** Plain tool-calling agent. */
    STANDARD,
    /** Reason-and-act agent that emits structured thoughts and actions. */
    REACT;

    /**
     * Parse a kind name, ignoring case. Null or blank yields {@link #STANDARD}.
     *
     * @param value kind name such as "react"
     * @return the kind
     * @throws IllegalArgumentException for an unknown name
     */
    public static AgentKind parse(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown agent kind: " + value);
        }
    }
}
