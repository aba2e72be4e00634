package fun.fengwk.rsh.core.web;

import fun.fengwk.rsh.core.service.render.RenderService;
import fun.fengwk.rsh.core.service.render.model.RenderRequest;
import fun.fengwk.rsh.core.service.render.model.RenderResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Renders a url and returns the resulting html.
 *
 * @author fengwk
 */
@RestController
@RequiredArgsConstructor
public class ContentController {

    private final RenderService renderService;

    @PostMapping("/content")
    public ResponseEntity<RenderResponse> content(@RequestBody(required = false) RenderRequest request) {
        RenderResponse response = renderService.render(request == null ? new RenderRequest() : request);
        return ResponseEntity.status(response.getHttpStatus()).body(response);
    }

}
