package org.profilekit.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.profilekit.config.AppProperties;
import org.profilekit.model.CompositeResult;
import org.profilekit.model.LayoutSpec;
import org.profilekit.model.RasterImage;
import org.profilekit.model.RenderedPreview;
import org.profilekit.service.compose.PreviewCompositor;
import org.profilekit.service.image.PreviewImageCodec;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Turns uploaded portrait and banner bytes into PNG previews, one per layout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfilePreviewService {

    private final PreviewCompositor previewCompositor;
    private final PreviewImageCodec previewImageCodec;
    private final LayoutCatalog layoutCatalog;
    private final AppProperties appProperties;

    public List<RenderedPreview> renderPreviews(byte[] portraitBytes, byte[] bannerBytes) {
        return renderPreviews(portraitBytes, bannerBytes, List.of());
    }

    /**
     * @param layoutNames layouts to render, in order; empty renders every configured layout
     */
    public List<RenderedPreview> renderPreviews(byte[] portraitBytes, byte[] bannerBytes, Collection<String> layoutNames) {
        long start = System.nanoTime();
        List<LayoutSpec> layouts = layoutCatalog.resolve(layoutNames);

        RasterImage portrait = previewImageCodec.decode(portraitBytes);
        RasterImage banner = previewImageCodec.decode(bannerBytes);

        List<RenderedPreview> previews = previewCompositor.composePreviews(portrait, banner, layouts).stream()
                .map(this::encode)
                .toList();

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        log.info("Rendered {} previews from {}x{} portrait and {}x{} banner in {} ms",
                previews.size(), portrait.getWidth(), portrait.getHeight(), banner.getWidth(), banner.getHeight(), elapsedMs);
        return previews;
    }

    private RenderedPreview encode(CompositeResult result) {
        RasterImage image = result.getImage();
        return RenderedPreview.builder()
                .layoutName(result.getLayoutName())
                .fileName(String.format(appProperties.getOutput().getFileNamePattern(), result.getLayoutName()))
                .width(image.getWidth())
                .height(image.getHeight())
                .pasteOutcome(result.getPasteOutcome())
                .png(previewImageCodec.encodePng(image))
                .build();
    }
}
