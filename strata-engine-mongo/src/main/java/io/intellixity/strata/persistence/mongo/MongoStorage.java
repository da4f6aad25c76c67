package io.intellixity.strata.persistence.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.QuerySource;
import io.intellixity.strata.persistence.spi.storage.AbstractStorage;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Storage over a MongoDB collection. Documents are stored with {@code _id} set to the primary key;
 * queries are translated with {@link MongoFilterTranslator} and sort, offset and limit run on the
 * server.
 */
public final class MongoStorage extends AbstractStorage implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MongoStorage.class);
  static final String ID = "_id";

  private final MongoCollection<Document> collection;
  private final MongoFilterTranslator translator = new MongoFilterTranslator();
  private final MongoClient owner;

  public MongoStorage(MongoCollection<Document> collection, String primaryName) {
    this(collection, primaryName, null);
  }

  MongoStorage(MongoCollection<Document> collection, String primaryName, MongoClient owner) {
    super(collection.getNamespace().getCollectionName(), primaryName);
    this.collection = collection;
    this.owner = owner;
  }

  /** Filter document for {@code query}; exposed for diagnostics. */
  public Document filter(QueryElement query) {
    Document filter = translator.translate(query);
    log.debug("Mongo filter on '{}': {}", collection(), filter);
    return filter;
  }

  @Override
  public Optional<Map<String, Object>> get(Object key) {
    Document doc = collection.find(Filters.eq(ID, key)).first();
    return Optional.ofNullable(doc).map(this::toRecord);
  }

  @Override
  public boolean contains(Object key) {
    return collection.countDocuments(Filters.eq(ID, key)) > 0;
  }

  @Override
  public void insert(Object key, Map<String, Object> value) {
    try {
      collection.insertOne(toDocument(key, withPrimaryKey(key, value)));
    } catch (MongoWriteException e) {
      if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) throw new KeyExistsException(collection(), key, e);
      throw e;
    }
  }

  @Override
  public void upsert(Object key, Map<String, Object> value) {
    collection.replaceOne(Filters.eq(ID, key), toDocument(key, withPrimaryKey(key, value)), new ReplaceOptions().upsert(true));
  }

  @Override
  public long update(QueryElement query, Map<String, Object> data) {
    Objects.requireNonNull(data, "data");
    Document filter = filter(query);
    if (data.containsKey(primaryName())) {
      for (Document doc : collection.find(filter)) checkUpdate(doc.get(ID), data);
    }
    if (data.isEmpty()) return collection.countDocuments(filter);
    return collection.updateMany(filter, new Document("$set", new Document(data))).getMatchedCount();
  }

  @Override
  public long remove(QueryElement query) {
    return collection.deleteMany(filter(query)).getDeletedCount();
  }

  @Override
  protected QuerySource select(QueryElement query) {
    return new MongoCursorSource(collection, filter(query), this::toRecord);
  }

  @Override
  public void flush() {
    // acknowledged writes are durable per the client's write concern
  }

  @Override
  public void close() {
    if (owner != null) owner.close();
  }

  private Document toDocument(Object key, Map<String, Object> record) {
    Document doc = new Document(ID, key);
    doc.putAll(record);
    return doc;
  }

  private Map<String, Object> toRecord(Document doc) {
    Map<String, Object> record = MongoValues.toRecord(doc);
    if (!ID.equals(primaryName())) record.remove(ID);
    return record;
  }

  @Override
  public String toString() {
    return "<MongoStorage: '" + collection.getNamespace().getFullName() + "'>";
  }
}
