package io.github.chirino.checkin.config;

import io.github.chirino.checkin.store.MeteredSubmissionStore;
import io.github.chirino.checkin.store.SubmissionStore;
import io.github.chirino.checkin.store.impl.InMemorySubmissionStore;
import io.github.chirino.checkin.store.impl.PostgresSubmissionStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Locale;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class SubmissionStoreSelector {

    @ConfigProperty(name = "checkin.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PostgresSubmissionStore> postgresStore;

    @Inject Instance<InMemorySubmissionStore> inMemoryStore;

    @Inject MeterRegistry meterRegistry;

    private SubmissionStore meteredStore;

    @PostConstruct
    void init() {
        meteredStore = new MeteredSubmissionStore(meterRegistry, selectDelegate());
    }

    public SubmissionStore getStore() {
        return meteredStore;
    }

    SubmissionStore selectDelegate() {
        String type =
                datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase(Locale.ROOT);
        if ("postgres".equals(type) || "postgresql".equals(type)) {
            return postgresStore.get();
        }
        if ("memory".equals(type) || "in-memory".equals(type)) {
            return inMemoryStore.get();
        }
        throw new IllegalStateException("Unsupported checkin.datastore.type: " + datastoreType);
    }
}
