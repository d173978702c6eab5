package assistant.adapter.in.dto;

import java.util.List;
import java.util.Map;

import assistant.core.model.auth.AuthDecision;

/**
 * Result of the peer authentication self-test.
 *
 * @param principal  principal returned by the peer
 * @param attributes attributes returned by the peer
 */
public record PeerUserResponse(String principal, Map<String, List<String>> attributes) {

    public static PeerUserResponse from(AuthDecision decision) {
        return new PeerUserResponse(decision.principal(), decision.attributes());
    }
}
