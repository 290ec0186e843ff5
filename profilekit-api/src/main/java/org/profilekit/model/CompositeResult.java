package org.profilekit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.profilekit.model.enums.PasteOutcome;

@Builder
@Getter
@ToString
@AllArgsConstructor
public class CompositeResult {
    private final String layoutName;
    private final RasterImage image;
    private final PasteOutcome pasteOutcome;
}
