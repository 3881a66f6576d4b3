package io.notebookhive.bus.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ConversionStatus {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    static ConversionStatus fromJson(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
