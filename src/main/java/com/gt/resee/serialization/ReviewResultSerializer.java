package com.gt.resee.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.resee.model.ReviewResult;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class ReviewResultSerializer extends JsonSerializer<ReviewResult> {
    @Override
    public void serialize(ReviewResult reviewResult, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(reviewResult.getLabel());
    }
}
