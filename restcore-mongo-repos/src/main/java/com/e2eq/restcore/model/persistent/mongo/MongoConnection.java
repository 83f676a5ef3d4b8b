package com.e2eq.restcore.model.persistent.mongo;

import com.e2eq.restcore.config.RestCoreConfig;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.UuidRepresentation;

/**
 * Owns the single {@link MongoClient} of the process. The client is created on first use with the
 * standard UUID representation.
 */
@ApplicationScoped
public class MongoConnection implements AutoCloseable {

    private final RestCoreConfig.Mongo config;
    private MongoClient client;

    @Inject
    public MongoConnection(RestCoreConfig config) {
        this(config.mongo());
    }

    public MongoConnection(RestCoreConfig.Mongo config) {
        this.config = config;
    }

    public synchronized MongoClient getClient(boolean refresh) {
        if (client == null || refresh) {
            if (client != null) {
                Log.infof("Refreshing mongo client for %s", config.uri());
                client.close();
            }
            client = createClient();
        }
        return client;
    }

    public MongoClient getClient() {
        return getClient(false);
    }

    public MongoDatabase getDatabase() {
        String database = config.database()
                .filter(d -> !d.isBlank())
                .orElseThrow(() -> new IllegalStateException("Missing database setting, set restcore.mongo.database"));
        return getClient().getDatabase(database);
    }

    protected MongoClient createClient() {
        MongoClientSettings.Builder settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(config.uri()))
                .uuidRepresentation(UuidRepresentation.STANDARD);
        config.appName().ifPresent(settings::applicationName);
        Log.infof("Creating mongo client for %s", config.uri());
        return MongoClients.create(settings.build());
    }

    @Override
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
