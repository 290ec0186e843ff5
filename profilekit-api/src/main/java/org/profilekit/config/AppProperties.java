package org.profilekit.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    /**
     * Preview layouts in rendering order. When empty the built-in desktop and mobile layouts are used.
     */
    private List<Layout> layouts = new ArrayList<>();
    private Output output = new Output();

    @Getter
    @Setter
    public static class Layout {
        private String name;
        private int canvasWidth;
        private int canvasHeight;
        private int portraitDiameter;
        private int anchorX;
        private int anchorY;
    }

    @Getter
    @Setter
    public static class Output {
        private String directory = "previews";
        private String fileNamePattern = "%s_preview.png";
    }
}
