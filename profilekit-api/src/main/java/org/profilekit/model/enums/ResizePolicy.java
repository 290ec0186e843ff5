package org.profilekit.model.enums;

public enum ResizePolicy {
    /**
     * Maps source bounds straight onto the target bounds, ignoring aspect ratio.
     */
    STRETCH_TO_FILL,
    /**
     * Crops the largest centred region matching the target aspect ratio, then scales it.
     */
    CENTER_CROP_TO_FILL
}
