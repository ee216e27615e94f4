package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Request type for rejecting a rendered video.
 *
 * @param notes
 *            optional reviewer notes
 * @param regenerate
 *            when true, a new pending job is created from the same inputs
 */
public record RejectRequestType(@JsonProperty("notes") @Size(
        max = 4000) String notes, @JsonProperty("regenerate") Boolean regenerate) {

    public boolean shouldRegenerate() {
        return Boolean.TRUE.equals(regenerate);
    }
}
