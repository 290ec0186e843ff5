package org.profilekit.config;

import org.junit.jupiter.api.Test;
import org.profilekit.model.LayoutSpec;
import org.profilekit.service.LayoutCatalog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

class AppPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class);

    @Test
    void bindsLayoutListAndOutputSettings() {
        contextRunner
                .withPropertyValues(
                        "app.layouts[0].name=banner-only",
                        "app.layouts[0].canvas-width=1200",
                        "app.layouts[0].canvas-height=300",
                        "app.layouts[0].portrait-diameter=150",
                        "app.layouts[0].anchor-x=20",
                        "app.layouts[0].anchor-y=120",
                        "app.output.directory=/tmp/previews",
                        "app.output.file-name-pattern=%s.png")
                .run(context -> {
                    AppProperties properties = context.getBean(AppProperties.class);
                    assertThat(properties.getOutput().getDirectory()).isEqualTo("/tmp/previews");
                    assertThat(properties.getOutput().getFileNamePattern()).isEqualTo("%s.png");

                    LayoutSpec layout = context.getBean(LayoutCatalog.class).getLayout("banner-only");
                    assertThat(layout.getCanvasWidth()).isEqualTo(1200);
                    assertThat(layout.getCanvasHeight()).isEqualTo(300);
                    assertThat(layout.getPortraitDiameter()).isEqualTo(150);
                    assertThat(layout.getAnchorX()).isEqualTo(20);
                    assertThat(layout.getAnchorY()).isEqualTo(120);
                });
    }

    @Test
    void defaultsToStandardLayouts() {
        contextRunner.run(context -> {
            assertThat(context.getBean(LayoutCatalog.class).getLayouts())
                    .containsExactly(LayoutSpec.DESKTOP, LayoutSpec.MOBILE);
            assertThat(context.getBean(AppProperties.class).getOutput().getFileNamePattern()).isEqualTo("%s_preview.png");
        });
    }

    @Test
    void invalidLayoutFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "app.layouts[0].name=broken",
                        "app.layouts[0].canvas-width=0",
                        "app.layouts[0].canvas-height=300",
                        "app.layouts[0].portrait-diameter=150")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(AppProperties.class)
    @Import(LayoutCatalog.class)
    static class TestConfig {
    }
}
