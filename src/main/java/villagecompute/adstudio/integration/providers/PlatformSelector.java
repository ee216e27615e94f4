/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.adstudio.integration.providers;

/**
 * Chooses which video provider renders a new generation job.
 *
 * <h2>Routing Rules (first match wins)</h2>
 * <ol>
 * <li>Explicit platform requested by the caller, unchanged</li>
 * <li>Product URL present: {@value #TOPVIEW} (URL-to-video)</li>
 * <li>Input type {@value #INPUT_TYPE_TEXT_TO_VIDEO}: {@value #HIGGSFIELD}</li>
 * <li>Image URL present: {@value #HIGGSFIELD} (image-to-video)</li>
 * <li>Avatar id present: {@value #TOPVIEW} (avatar presenter)</li>
 * <li>Otherwise {@value #HIGGSFIELD}</li>
 * </ol>
 * "Present" means non-null and non-blank.
 */
public final class PlatformSelector {

    public static final String HIGGSFIELD = "higgsfield";
    public static final String TOPVIEW = "topview";

    public static final String INPUT_TYPE_TEXT_TO_VIDEO = "text-to-video";

    private PlatformSelector() {
        // Utility class
    }

    /**
     * Resolves the provider tag for a job.
     *
     * @param explicitPlatform
     *            platform requested by the caller (may be null)
     * @param inputType
     *            job input mode
     * @param productUrl
     *            product page URL (may be null)
     * @param imageUrl
     *            source image URL (may be null)
     * @param avatarId
     *            presenter avatar id (may be null)
     * @return provider tag, never null
     */
    public static String select(String explicitPlatform, String inputType, String productUrl, String imageUrl,
            String avatarId) {
        if (isPresent(explicitPlatform)) {
            return explicitPlatform;
        }
        if (isPresent(productUrl)) {
            return TOPVIEW;
        }
        if (INPUT_TYPE_TEXT_TO_VIDEO.equals(inputType)) {
            return HIGGSFIELD;
        }
        if (isPresent(imageUrl)) {
            return HIGGSFIELD;
        }
        if (isPresent(avatarId)) {
            return TOPVIEW;
        }
        return HIGGSFIELD;
    }

    /**
     * Whether the tag names a provider this service can correlate callbacks for.
     */
    public static boolean isKnown(String platform) {
        return HIGGSFIELD.equals(platform) || TOPVIEW.equals(platform);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
