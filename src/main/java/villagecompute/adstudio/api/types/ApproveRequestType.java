package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Request type for approving a rendered video.
 *
 * @param notes
 *            optional reviewer notes; existing notes are kept when omitted
 */
public record ApproveRequestType(@JsonProperty("notes") @Size(
        max = 4000) String notes) {
}
