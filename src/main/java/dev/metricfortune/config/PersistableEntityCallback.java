package dev.metricfortune.config;

import dev.metricfortune.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks loaded entities as existing, so a later {@code save()} of a recommendation
 * status change issues an UPDATE rather than an INSERT with the same Snowflake id.
 * Only invoked for entity types implementing {@link NewRecordAware}.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<NewRecordAware> {

    @Override
    public Publisher<NewRecordAware> onAfterConvert(NewRecordAware entity, SqlIdentifier table) {
        entity.setNewRecord(false);
        return Mono.just(entity);
    }
}
