package fun.fengwk.rsh.core.service.render.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Render request model.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenderRequest {

    private String url;

    /**
     * Session id returned by an earlier render, optional.
     */
    private String sessionId;

}
