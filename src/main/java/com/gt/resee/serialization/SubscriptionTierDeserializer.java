package com.gt.resee.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.resee.model.SubscriptionTier;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SubscriptionTierDeserializer extends JsonDeserializer<SubscriptionTier> {
    @Override
    public SubscriptionTier deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        return SubscriptionTier.fromLabel(jsonParser.getValueAsString());
    }
}
