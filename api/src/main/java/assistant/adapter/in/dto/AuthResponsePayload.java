package assistant.adapter.in.dto;

import java.util.List;
import java.util.Map;

import assistant.core.model.auth.AuthDecision;

/**
 * Successful authentication response.
 *
 * @param principal  the authenticated username
 * @param attributes role attributes
 * @param message    outcome message
 */
public record AuthResponsePayload(String principal, Map<String, List<String>> attributes, String message) {

    public static AuthResponsePayload from(AuthDecision decision) {
        return new AuthResponsePayload(decision.principal(), decision.attributes(), decision.message());
    }
}
