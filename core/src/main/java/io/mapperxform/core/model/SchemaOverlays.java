package io.mapperxform.core.model;

import java.util.List;

/** Source- and target-side schema overlays. Both lists are non-null and immutable. */
public record SchemaOverlays(List<SchemaOverlay> source, List<SchemaOverlay> target) {

    /** No overlays on either side. */
    public static final SchemaOverlays NONE = new SchemaOverlays(List.of(), List.of());

    public SchemaOverlays {
        source = source == null ? List.of() : List.copyOf(source);
        target = target == null ? List.of() : List.copyOf(target);
    }
}
