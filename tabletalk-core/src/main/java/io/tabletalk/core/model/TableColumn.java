package io.tabletalk.core.model;

import java.util.Locale;
import java.util.Objects;

public record TableColumn(String name, String type) {
    public static final String STRING = "string";
    public static final String INTEGER = "integer";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";

    public TableColumn {
        Objects.requireNonNull(name, "name must not be null");
        type = type == null || type.isBlank() ? STRING : type.trim().toLowerCase(Locale.ROOT);
    }
}
