package fun.fengwk.rsh.core.service.render.impl;

import fun.fengwk.rsh.core.service.render.RenderOutcome;
import fun.fengwk.rsh.core.service.render.RenderService;
import fun.fengwk.rsh.core.service.render.RenderSessionManager;
import fun.fengwk.rsh.core.service.render.model.RenderRequest;
import fun.fengwk.rsh.core.service.render.model.RenderResponse;
import fun.fengwk.rsh.core.service.session.SessionIdentityResolver;
import fun.fengwk.rsh.core.service.session.SessionResolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Render service implementation.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenderServiceImpl implements RenderService {

    private static final int STATUS_BAD_REQUEST = 400;
    private static final int STATUS_OK = 200;

    private final SessionIdentityResolver sessionIdentityResolver;
    private final RenderSessionManager renderSessionManager;

    @Override
    public RenderResponse render(RenderRequest request) {
        String url = request == null || request.getUrl() == null ? null : request.getUrl().trim();
        String candidateSessionId = request == null ? null : request.getSessionId();

        SessionResolution resolution;
        try {
            resolution = sessionIdentityResolver.resolve(url, candidateSessionId);
        } catch (IllegalArgumentException ex) {
            log.warn("render request invalid, url={}, error={}", url, ex.getMessage());
            return RenderResponse.builder()
                .httpStatus(STATUS_BAD_REQUEST)
                .statusCode(STATUS_BAD_REQUEST)
                .error(ex.getMessage())
                .build();
        }

        long startAt = System.currentTimeMillis();
        log.info("fetching content, url={}, sessionId={}, resumed={}, restoreState={}",
            url, resolution.sessionId(), resolution.resumed(), resolution.restoreState().isPresent());
        RenderOutcome outcome = renderSessionManager.render(url, resolution.sessionId(), resolution.restoreState());
        long elapsedMs = System.currentTimeMillis() - startAt;

        if (!outcome.isSuccess()) {
            log.warn("fetch content failed, url={}, sessionId={}, status={}, stateStored={}, elapsedMs={}",
                url, resolution.sessionId(), outcome.statusCode(), outcome.stateStored(), elapsedMs);
            return RenderResponse.builder()
                .httpStatus(outcome.statusCode())
                .error(outcome.error())
                .build();
        }

        log.info("fetched content, url={}, statusCode={}, contentLength={}, stateStored={}, elapsedMs={}",
            url, outcome.statusCode(), outcome.html() == null ? 0 : outcome.html().length(),
            outcome.stateStored(), elapsedMs);
        return RenderResponse.builder()
            .httpStatus(STATUS_OK)
            .statusCode(outcome.statusCode())
            .content(outcome.html())
            .sessionId(resolution.sessionId())
            .stateStored(outcome.stateStored())
            .build();
    }

}
