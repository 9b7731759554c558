package com.gt.resee.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.resee.model.ReviewResult;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ReviewResultDeserializer extends JsonDeserializer<ReviewResult> {
    @Override
    public ReviewResult deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String label = jsonParser.getValueAsString();

        try {
            return ReviewResult.fromLabel(label);
        } catch (IllegalArgumentException ex) {
            return (ReviewResult) deserializationContext.handleWeirdStringValue(ReviewResult.class, label, ex.getMessage());
        }
    }
}
