package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body produced by the exception mappers.
 *
 * @param error
 *            message safe to show to the caller
 * @param status
 *            current job status, only for invalid state errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorType(@JsonProperty("error") String error, @JsonProperty("status") String status) {

    public static ErrorType of(String error) {
        return new ErrorType(error, null);
    }
}
