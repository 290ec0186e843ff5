package org.profilekit.service;

import lombok.extern.slf4j.Slf4j;
import org.profilekit.config.AppProperties;
import org.profilekit.exception.ApiError;
import org.profilekit.model.LayoutSpec;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class LayoutCatalog {

    private final Map<String, LayoutSpec> layoutsByName;

    public LayoutCatalog(AppProperties appProperties) {
        this.layoutsByName = index(toLayoutSpecs(appProperties.getLayouts()));
        log.info("Loaded {} preview layouts: {}", layoutsByName.size(), layoutsByName.keySet());
    }

    public List<LayoutSpec> getLayouts() {
        return List.copyOf(layoutsByName.values());
    }

    public LayoutSpec getLayout(String name) {
        LayoutSpec layout = name == null ? null : layoutsByName.get(key(name));
        if (layout == null) {
            throw ApiError.LAYOUT_NOT_FOUND.createException(name);
        }
        return layout;
    }

    public List<LayoutSpec> resolve(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return getLayouts();
        }
        return names.stream().map(this::getLayout).toList();
    }

    private static List<LayoutSpec> toLayoutSpecs(List<AppProperties.Layout> configured) {
        if (configured == null || configured.isEmpty()) {
            return LayoutSpec.standardLayouts();
        }
        List<LayoutSpec> specs = new ArrayList<>(configured.size());
        for (AppProperties.Layout layout : configured) {
            specs.add(LayoutSpec.builder()
                    .name(layout.getName())
                    .canvasWidth(layout.getCanvasWidth())
                    .canvasHeight(layout.getCanvasHeight())
                    .portraitDiameter(layout.getPortraitDiameter())
                    .anchorX(layout.getAnchorX())
                    .anchorY(layout.getAnchorY())
                    .build()
                    .validate());
        }
        return specs;
    }

    private static Map<String, LayoutSpec> index(List<LayoutSpec> specs) {
        Map<String, LayoutSpec> byName = new LinkedHashMap<>();
        for (LayoutSpec spec : specs) {
            if (byName.putIfAbsent(key(spec.getName()), spec) != null) {
                throw ApiError.INVALID_ARGUMENT.createException("duplicate layout name '" + spec.getName() + "'");
            }
        }
        return byName;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
