package io.flowcraft.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowcraft.core.state.StateContainer;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a `StateContainer` as a plain object of its field values.
///
/// The schema is not written; unset optional fields appear as `null`.
///
/// @implNote Package-private. Registered by {@link FlowcraftJacksonModule}.
class StateContainerSerializer extends StdSerializer<StateContainer> {

    @Serial private static final long serialVersionUID = 6120937730529118472L;

    StateContainerSerializer() {
        super(StateContainer.class);
    }

    @Override
    public void serialize(StateContainer state, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> entry : state.asMap().entrySet()) {
            gen.writeFieldName(entry.getKey());
            provider.defaultSerializeValue(entry.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
