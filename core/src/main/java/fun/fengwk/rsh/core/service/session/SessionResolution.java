package fun.fengwk.rsh.core.service.session;

import fun.fengwk.rsh.core.service.state.StoredSessionState;

import java.util.Optional;

/**
 * Effective session identity of one request.
 *
 * @param sessionId effective session id
 * @param restoreState state to seed the context with, empty for a blank context
 * @param resumed whether the client supplied id was verified and kept
 * @author fengwk
 */
public record SessionResolution(String sessionId, Optional<StoredSessionState> restoreState, boolean resumed) {
}
