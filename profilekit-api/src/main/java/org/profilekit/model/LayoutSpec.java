package org.profilekit.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.profilekit.exception.ApiError;

import java.util.List;

/**
 * One target canvas: banner size, portrait diameter and the top-left anchor of the portrait.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public final class LayoutSpec {

    public static final LayoutSpec DESKTOP = LayoutSpec.builder()
            .name("desktop")
            .canvasWidth(1584)
            .canvasHeight(396)
            .portraitDiameter(220)
            .anchorX(60)
            .anchorY(240)
            .build();

    public static final LayoutSpec MOBILE = LayoutSpec.builder()
            .name("mobile")
            .canvasWidth(800)
            .canvasHeight(450)
            .portraitDiameter(220)
            .anchorX(290)
            .anchorY(280)
            .build();

    private final String name;
    private final int canvasWidth;
    private final int canvasHeight;
    private final int portraitDiameter;
    private final int anchorX;
    private final int anchorY;

    public static List<LayoutSpec> standardLayouts() {
        return List.of(DESKTOP, MOBILE);
    }

    public LayoutSpec validate() {
        if (name == null || name.isBlank()) {
            throw ApiError.INVALID_ARGUMENT.createException("layout name must not be blank");
        }
        if (canvasWidth <= 0 || canvasHeight <= 0) {
            throw ApiError.INVALID_ARGUMENT.createException("layout '" + name + "' canvas must be positive, got " + canvasWidth + "x" + canvasHeight);
        }
        if (portraitDiameter <= 0) {
            throw ApiError.INVALID_ARGUMENT.createException("layout '" + name + "' portrait diameter must be positive, got " + portraitDiameter);
        }
        return this;
    }

    /**
     * Whether any part of the portrait's bounding box lands on the canvas.
     */
    public boolean portraitOverlapsCanvas() {
        return anchorX < canvasWidth
                && anchorY < canvasHeight
                && anchorX + portraitDiameter > 0
                && anchorY + portraitDiameter > 0;
    }

    /**
     * Whether the portrait's bounding box lies entirely inside the canvas.
     */
    public boolean portraitFitsCanvas() {
        return anchorX >= 0
                && anchorY >= 0
                && anchorX + portraitDiameter <= canvasWidth
                && anchorY + portraitDiameter <= canvasHeight;
    }
}
