package villagecompute.adstudio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.adstudio.data.models.Ad;

import java.util.List;

/**
 * Denormalized summary of the ad a generation job was derived from.
 */
public record SourceAdSummaryType(@JsonProperty("id") String id, @JsonProperty("headline") String headline,
        @JsonProperty("bodyText") String bodyText, @JsonProperty("thumbnailUrl") String thumbnailUrl,
        @JsonProperty("mediaUrls") List<String> mediaUrls) {

    public static SourceAdSummaryType from(Ad ad, List<String> mediaUrls) {
        return new SourceAdSummaryType(ad.id, ad.headline, ad.bodyText, ad.thumbnailUrl, mediaUrls);
    }
}
