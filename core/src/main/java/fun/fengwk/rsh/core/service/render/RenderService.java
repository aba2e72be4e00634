package fun.fengwk.rsh.core.service.render;

import fun.fengwk.rsh.core.service.render.model.RenderRequest;
import fun.fengwk.rsh.core.service.render.model.RenderResponse;

/**
 * Render service entry.
 *
 * @author fengwk
 */
public interface RenderService {

    RenderResponse render(RenderRequest request);

}
