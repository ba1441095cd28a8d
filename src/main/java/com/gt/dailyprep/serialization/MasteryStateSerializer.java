package com.gt.dailyprep.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.dailyprep.model.MasteryState;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class MasteryStateSerializer extends JsonSerializer<MasteryState> {
    @Override
    public void serialize(MasteryState masteryState, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(masteryState.getColor());
    }
}
