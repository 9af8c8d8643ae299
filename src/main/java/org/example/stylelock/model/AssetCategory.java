package org.example.stylelock.model;

import java.util.Locale;
import java.util.Optional;

public enum AssetCategory {
    CHARACTER("characters"),
    ENVIRONMENT("environments", "backgrounds"),
    UI("ui elements", "ui_elements", "interface"),
    PROP("props"),
    ITEM("items", "collectibles"),
    EFFECT("effects", "vfx");

    private final String[] aliases;

    AssetCategory(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolve a label such as {@code "Characters"} or {@code "ui elements"}.
     */
    public static Optional<AssetCategory> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (AssetCategory category : values()) {
            if (category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(category);
            }
            for (String alias : category.aliases) {
                if (alias.equals(normalized)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }
}
