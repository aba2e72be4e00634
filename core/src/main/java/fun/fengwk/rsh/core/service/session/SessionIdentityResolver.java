package fun.fengwk.rsh.core.service.session;

import fun.fengwk.rsh.core.service.render.RenderProperties;
import fun.fengwk.rsh.core.service.state.StateStoreAdapter;
import fun.fengwk.rsh.core.service.state.StoredSessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Optional;

/**
 * Decides the effective session id of a render request.
 *
 * <p>A client supplied id is kept only when the store confirms it exists. Otherwise a fresh id is minted and
 * the supplied one is discarded, so unverified ids can never be used to reach another session's state.
 * Resolution never allocates a browser resource.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionIdentityResolver {

    private final StateStoreAdapter stateStoreAdapter;
    private final SessionIdGenerator sessionIdGenerator;
    private final RenderProperties renderProperties;

    /**
     * @param url target url, validated before anything else
     * @param candidateSessionId client supplied session id, null or blank if none, never normalized
     * @throws IllegalArgumentException if the url is missing or not an accepted absolute url
     */
    public SessionResolution resolve(String url, String candidateSessionId) {
        validateUrl(url);

        if (!StringUtils.hasText(candidateSessionId)) {
            String sessionId = sessionIdGenerator.generate();
            log.info("generated new session id, sessionId={}", sessionId);
            return new SessionResolution(sessionId, Optional.empty(), false);
        }

        // Verified exactly as sent, the returned id always equals the supplied one.
        String candidate = candidateSessionId;
        if (!stateStoreAdapter.tryExists(candidate)) {
            String sessionId = sessionIdGenerator.generate();
            log.info("provided session not found, generated new session id, providedSessionId={}, newSessionId={}",
                candidate, sessionId);
            return new SessionResolution(sessionId, Optional.empty(), false);
        }

        log.info("using existing provided session, sessionId={}", candidate);
        Optional<StoredSessionState> restoreState = stateStoreAdapter.tryGet(candidate);
        if (restoreState.isEmpty()) {
            log.warn("session exists but state unreadable, continue with blank context, sessionId={}", candidate);
        }
        return new SessionResolution(candidate, restoreState, true);
    }

    private void validateUrl(String url) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("URL is required");
        }
        // WHATWG parsing, same as the browser.
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(url.trim(), UriComponentsBuilder.ParserType.WHAT_WG).build();
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid URL format");
        }
        if (!StringUtils.hasText(uri.getScheme())) {
            throw new IllegalArgumentException("Invalid URL format");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        boolean allowed = renderProperties.getAllowedSchemes().stream()
            .anyMatch(s -> s.equalsIgnoreCase(scheme));
        if (!allowed) {
            throw new IllegalArgumentException("Unsupported URL scheme: " + scheme);
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new IllegalArgumentException("Invalid URL format");
        }
    }

}
