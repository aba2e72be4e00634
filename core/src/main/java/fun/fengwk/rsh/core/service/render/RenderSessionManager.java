package fun.fengwk.rsh.core.service.render;

import fun.fengwk.rsh.core.service.browser.engine.ContextOptions;
import fun.fengwk.rsh.core.service.browser.engine.RenderContext;
import fun.fengwk.rsh.core.service.browser.engine.RenderEngine;
import fun.fengwk.rsh.core.service.browser.engine.RenderedPage;
import fun.fengwk.rsh.core.service.state.StateStoreAdapter;
import fun.fengwk.rsh.core.service.state.StoredSessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Runs one render inside a fresh isolated context.
 *
 * <p>The context is disposed in a finally block, so it is released on every exit path. After the render,
 * successful or not, the context state is persisted best-effort before disposal.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenderSessionManager {

    private static final String ACCEPT_LANGUAGE_HEADER = "Accept-Language";

    private final RenderEngine renderEngine;
    private final StateStoreAdapter stateStoreAdapter;
    private final RenderProperties renderProperties;

    public RenderOutcome render(String url, String sessionId, Optional<StoredSessionState> restoreState) {
        RenderContext context;
        try {
            context = renderEngine.newIsolatedContext(buildContextOptions(restoreState));
        } catch (RuntimeException ex) {
            RenderFailureType failureType = RenderFailureType.classify(ex);
            log.error("failed to create render context, url={}, sessionId={}, error={}",
                url, sessionId, ex.getMessage(), ex);
            return RenderOutcome.failure(failureType, errorMessage(ex), false);
        }

        try {
            return renderInContext(context, url, sessionId);
        } finally {
            dispose(context, sessionId);
        }
    }

    private void dispose(RenderContext context, String sessionId) {
        // A disposal failure never replaces the render outcome.
        try {
            context.close();
        } catch (RuntimeException ex) {
            log.warn("failed to dispose render context, sessionId={}, error={}", sessionId, ex.getMessage(), ex);
        }
    }

    private RenderOutcome renderInContext(RenderContext context, String url, String sessionId) {
        RenderedPage page = null;
        RuntimeException failure = null;
        try {
            page = context.render(url, renderProperties.getNavigateTimeoutMs(), renderProperties.getSettleTimeoutMs());
        } catch (RuntimeException ex) {
            failure = ex;
        }

        boolean stateStored = persistState(context, sessionId);

        if (failure != null) {
            RenderFailureType failureType = RenderFailureType.classify(failure);
            log.error("error fetching content, url={}, sessionId={}, failureType={}, error={}",
                url, sessionId, failureType, failure.getMessage(), failure);
            return RenderOutcome.failure(failureType, errorMessage(failure), stateStored);
        }
        return RenderOutcome.success(page, stateStored);
    }

    private boolean persistState(RenderContext context, String sessionId) {
        if (!stateStoreAdapter.isEnabled()) {
            log.debug("state storage disabled, skip persisting, sessionId={}", sessionId);
            return false;
        }
        String state;
        try {
            state = context.captureState();
        } catch (RuntimeException ex) {
            log.warn("failed to capture session state, sessionId={}, error={}", sessionId, ex.getMessage());
            return false;
        }
        return stateStoreAdapter.trySet(sessionId, new StoredSessionState(state), stateStoreAdapter.ttlSeconds());
    }

    private ContextOptions buildContextOptions(Optional<StoredSessionState> restoreState) {
        ContextOptions.ContextOptionsBuilder builder = ContextOptions.builder()
            .viewportWidth(renderProperties.getViewportWidth())
            .viewportHeight(renderProperties.getViewportHeight())
            .userAgent(renderProperties.getUserAgent())
            .ignoreHttpsErrors(renderProperties.isIgnoreHttpsErrors())
            .javaScriptEnabled(renderProperties.isJavaScriptEnabled())
            .storageState(restoreState.map(StoredSessionState::json).orElse(null));
        if (StringUtils.hasText(renderProperties.getAcceptLanguage())) {
            builder.extraHeaders(Map.of(ACCEPT_LANGUAGE_HEADER, renderProperties.getAcceptLanguage()));
        } else {
            builder.extraHeaders(Map.of());
        }
        return builder.build();
    }

    private static String errorMessage(Throwable ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
    }

}
