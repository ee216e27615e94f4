package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic success acknowledgement ({@code {"success": true, "message": "..."}}).
 */
public record ActionResultType(@JsonProperty("success") boolean success, @JsonProperty("message") String message) {
}
