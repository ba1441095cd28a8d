package com.gt.dailyprep.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.dailyprep.model.MasteryState;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class MasteryStateDeserializer extends JsonDeserializer<MasteryState> {
    @Override
    public MasteryState deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String color = jsonParser.getValueAsString();
        MasteryState masteryState = MasteryState.fromColor(color);

        if (masteryState == null) {
            return (MasteryState) deserializationContext.handleWeirdStringValue(MasteryState.class, color,
                    "Color must be one of: gray, orange, yellow, green");
        }

        return masteryState;
    }
}
