package io.intellixity.strata.persistence.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.strata.persistence.spi.StorageProvider;
import io.intellixity.strata.persistence.spi.config.StorageSettings;
import io.intellixity.strata.persistence.spi.storage.Storage;
import org.bson.Document;
import org.bson.UuidRepresentation;

public final class MongoStorageProvider implements StorageProvider {
  @Override public String id() { return "mongo"; }

  @Override
  public Storage open(String collection, String primaryName, StorageSettings settings) {
    MongoClient client = MongoClients.create(clientSettings(settings.mongoUri()));
    return new MongoStorage(client.getDatabase(settings.mongoDatabase()).getCollection(collection, Document.class),
        primaryName, client);
  }

  static MongoClientSettings clientSettings(String uri) {
    return MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(uri))
        .uuidRepresentation(UuidRepresentation.STANDARD)
        .build();
  }
}
