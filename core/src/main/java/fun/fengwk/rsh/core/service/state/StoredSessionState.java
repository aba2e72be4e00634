package fun.fengwk.rsh.core.service.state;

/**
 * Serialized browser storage state (cookies and origin storage) of one session.
 *
 * @param json storage state json as produced by the render engine
 * @author fengwk
 */
public record StoredSessionState(String json) {
}
