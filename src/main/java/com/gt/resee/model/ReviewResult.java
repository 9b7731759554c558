package com.gt.resee.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.resee.serialization.ReviewResultDeserializer;
import com.gt.resee.serialization.ReviewResultSerializer;

import java.util.Arrays;

@JsonSerialize(using = ReviewResultSerializer.class)
@JsonDeserialize(using = ReviewResultDeserializer.class)
public enum ReviewResult {
    Remembered("remembered"),
    Partial("partial"),
    Forgot("forgot");

    private final String label;

    ReviewResult(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ReviewResult fromLabel(String label) {
        return Arrays.stream(values())
                .filter(result -> result.label.equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown review result " + label));
    }
}
