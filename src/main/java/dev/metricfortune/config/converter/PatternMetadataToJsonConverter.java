package dev.metricfortune.config.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.metricfortune.entity.PatternMetadata;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * R2DBC writing converter: PatternMetadata → PostgreSQL JSONB (Json).
 */
@WritingConverter
@RequiredArgsConstructor
public class PatternMetadataToJsonConverter implements Converter<PatternMetadata, Json> {

    private final ObjectMapper objectMapper;

    @Override
    public Json convert(PatternMetadata source) {
        try {
            // serialize against the interface type so the "kind" discriminator is written
            return Json.of(objectMapper.writerFor(PatternMetadata.class).writeValueAsString(source));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Pattern metadata could not be serialized", e);
        }
    }
}
