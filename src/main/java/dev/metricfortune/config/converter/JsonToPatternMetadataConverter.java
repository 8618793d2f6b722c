package dev.metricfortune.config.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.metricfortune.entity.PatternMetadata;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * R2DBC reading converter: PostgreSQL JSONB (Json) → PatternMetadata variant, chosen by the {@code kind} property.
 */
@ReadingConverter
@RequiredArgsConstructor
public class JsonToPatternMetadataConverter implements Converter<Json, PatternMetadata> {

    private final ObjectMapper objectMapper;

    @Override
    public PatternMetadata convert(Json source) {
        try {
            return objectMapper.readValue(source.asString(), PatternMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable pattern metadata", e);
        }
    }
}
