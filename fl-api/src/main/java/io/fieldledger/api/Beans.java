package io.fieldledger.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldledger.core.CausalityTracker;
import io.fieldledger.core.Determinism;
import io.fieldledger.core.EventFactory;
import io.fieldledger.core.EventJsonModule;
import io.fieldledger.core.conflict.ConflictPolicyTable;
import io.fieldledger.core.conflict.ConflictQueue;
import io.fieldledger.core.conflict.ConflictResolver;
import io.fieldledger.core.conflict.InMemoryConflictQueue;
import io.fieldledger.engine.Ledger;
import io.fieldledger.engine.projection.MigrationRegistry;
import io.fieldledger.engine.projection.Projector;
import io.fieldledger.engine.sync.InMemoryRemoteAuthority;
import io.fieldledger.engine.sync.SyncManager;
import io.fieldledger.store.EventPersistence;
import io.fieldledger.store.EventStore;
import io.fieldledger.store.HashChainedEventStore;
import io.fieldledger.store.InMemoryEventPersistence;
import io.fieldledger.store.InMemorySyncCursorStore;
import io.fieldledger.store.SyncCursorStore;
import io.fieldledger.store.pg.JdbcConflictQueue;
import io.fieldledger.store.pg.JdbcEventPersistence;
import io.fieldledger.store.pg.JdbcSyncCursorStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class Beans {

    /** Picked up by Spring Boot's ObjectMapper, so events travel in their wire envelope. */
    @Bean
    EventJsonModule eventJsonModule() {
        return new EventJsonModule();
    }

    @Bean
    @Profile("inmem")
    EventPersistence inMemoryPersistence() {
        return new InMemoryEventPersistence();
    }

    @Bean
    @Profile("inmem")
    SyncCursorStore inMemoryCursors() {
        return new InMemorySyncCursorStore();
    }

    @Bean
    @Profile("inmem")
    ConflictQueue inMemoryConflicts(FieldLedgerProperties props) {
        return new InMemoryConflictQueue(props.conflictQueueCapacity());
    }

    @Bean
    @Profile("pg")
    EventPersistence postgresPersistence(JdbcTemplate jdbc, ObjectMapper mapper) {
        return new JdbcEventPersistence(jdbc, mapper);
    }

    @Bean
    @Profile("pg")
    SyncCursorStore postgresCursors(JdbcTemplate jdbc) {
        return new JdbcSyncCursorStore(jdbc);
    }

    @Bean
    @Profile("pg")
    ConflictQueue postgresConflicts(JdbcTemplate jdbc, ObjectMapper mapper, FieldLedgerProperties props) {
        return new JdbcConflictQueue(jdbc, mapper, props.conflictQueueCapacity());
    }

    @Bean
    EventStore eventStore(EventPersistence persistence) {
        return new HashChainedEventStore(persistence);
    }

    @Bean
    EventFactory eventFactory() {
        return new EventFactory(Determinism.system());
    }

    @Bean
    CausalityTracker causalityTracker() {
        return new CausalityTracker();
    }

    @Bean
    ConflictResolver conflictResolver(ConflictQueue queue, EventFactory factory) {
        return new ConflictResolver(ConflictPolicyTable.defaults(), queue, factory);
    }

    @Bean(destroyMethod = "close")
    Projector projector(EventStore store, ConflictResolver resolver, CausalityTracker tracker) {
        return new Projector(store, resolver, tracker, MigrationRegistry.defaults());
    }

    @Bean
    Ledger ledger(EventFactory factory, CausalityTracker tracker, EventStore store, Projector projector,
                  ConflictResolver resolver) {
        var ledger = new Ledger(factory, tracker, store, projector, resolver);
        ledger.bootstrap();
        return ledger;
    }

    @Bean
    @ConditionalOnProperty(name = "fieldledger.authority.enabled", havingValue = "true", matchIfMissing = true)
    InMemoryRemoteAuthority hostedAuthority(FieldLedgerProperties props) {
        return new InMemoryRemoteAuthority(new HashChainedEventStore(new InMemoryEventPersistence()),
                props.authority().pageSize());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "fieldledger.sync.enabled", havingValue = "true")
    SyncManager syncManager(Ledger ledger, SyncCursorStore cursors, FieldLedgerProperties props, RestClient.Builder http) {
        var sync = props.sync();
        // Boot's builder carries the application ObjectMapper, event module included
        var remote = new HttpRemoteAuthority(http.baseUrl(sync.remoteUrl()).build());
        var manager = new SyncManager(ledger, remote, cursors, sync.settings(), Clock.systemUTC(), props.deviceId());
        if (sync.operationId() != null && !sync.operationId().isBlank()) manager.switchOperation(sync.operationId());
        manager.start();
        return manager;
    }
}
