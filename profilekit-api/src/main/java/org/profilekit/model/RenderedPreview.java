package org.profilekit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.profilekit.model.enums.PasteOutcome;

/**
 * Encoded preview ready to be written to disk or offered as a download.
 */
@Builder
@Getter
@ToString(exclude = "png")
@AllArgsConstructor
public class RenderedPreview {
    private final String layoutName;
    private final String fileName;
    private final int width;
    private final int height;
    private final PasteOutcome pasteOutcome;
    private final byte[] png;
}
