package fun.fengwk.rsh.core.service.render.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Render response model.
 *
 * @author fengwk
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RenderResponse {

    /**
     * Status of the http response carrying this body.
     */
    @JsonIgnore
    private int httpStatus;

    /**
     * Status of the rendered page, or 400 for an invalid request.
     */
    private Integer statusCode;
    private String content;
    private String sessionId;
    private Boolean stateStored;
    private String error;

}
