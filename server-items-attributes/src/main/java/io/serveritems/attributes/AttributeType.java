package io.serveritems.attributes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AttributeType {
    STRING,
    NUMBER,
    BOOLEAN,
    MIXED;

    @JsonCreator
    public static AttributeType fromJson(String value) {
        if (value == null) return STRING;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
