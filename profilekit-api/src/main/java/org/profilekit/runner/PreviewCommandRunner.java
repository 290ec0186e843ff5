package org.profilekit.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.profilekit.config.AppProperties;
import org.profilekit.model.RenderedPreview;
import org.profilekit.service.ProfilePreviewService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Renders previews from files: {@code --portrait=<file> --banner=<file> [--output=<dir>] [--layouts=a,b]}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PreviewCommandRunner implements ApplicationRunner {

    static final String PORTRAIT = "portrait";
    static final String BANNER = "banner";
    static final String OUTPUT = "output";
    static final String LAYOUTS = "layouts";

    private final ProfilePreviewService profilePreviewService;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        String portrait = singleValue(args, PORTRAIT);
        String banner = singleValue(args, BANNER);
        if (portrait == null || banner == null) {
            log.info("No input given. Usage: --portrait=<file> --banner=<file> [--output=<dir>] [--layouts=desktop,mobile]");
            return;
        }

        String output = singleValue(args, OUTPUT);
        Path outputDir = Paths.get(output != null ? output : appProperties.getOutput().getDirectory());
        List<String> layoutNames = parseLayouts(singleValue(args, LAYOUTS));

        try {
            byte[] portraitBytes = Files.readAllBytes(Paths.get(portrait));
            byte[] bannerBytes = Files.readAllBytes(Paths.get(banner));
            List<RenderedPreview> previews = profilePreviewService.renderPreviews(portraitBytes, bannerBytes, layoutNames);

            Files.createDirectories(outputDir);
            for (RenderedPreview preview : previews) {
                Path file = outputDir.resolve(preview.getFileName());
                Files.write(file, preview.getPng());
                log.info("Wrote {} preview {}x{} ({}) to {}", preview.getLayoutName(),
                        preview.getWidth(), preview.getHeight(), preview.getPasteOutcome(), file);
            }
        } catch (IOException e) {
            log.error("Failed to render previews for portrait {} and banner {}", portrait, banner, e);
            throw new UncheckedIOException(e);
        }
    }

    static List<String> parseLayouts(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String singleValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
