package io.arbor.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.arbor.core.exception.EvaluationException;
import io.arbor.core.execution.ValueDecoder;

/// Jackson-backed {@link ValueDecoder} for `json` workflow outputs.
///
/// Objects decode to `Map`, arrays to `List`, integral numbers to `Integer`/`Long` as
/// Jackson chooses, other scalars to their natural Java types.
public final class JacksonValueDecoder implements ValueDecoder {

    private final ObjectMapper mapper;

    public JacksonValueDecoder() {
        this(new ObjectMapper());
    }

    public JacksonValueDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Object decode(String text) throws EvaluationException {
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Invalid JSON output: " + e.getOriginalMessage(), e);
        }
    }
}
