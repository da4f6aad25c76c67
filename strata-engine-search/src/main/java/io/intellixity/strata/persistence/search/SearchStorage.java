package io.intellixity.strata.persistence.search;

import io.intellixity.strata.persistence.exec.KeyExistsException;
import io.intellixity.strata.persistence.query.QueryElement;
import io.intellixity.strata.persistence.queryset.ListQuerySource;
import io.intellixity.strata.persistence.queryset.QuerySource;
import io.intellixity.strata.persistence.spi.storage.AbstractStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Storage over a search engine index. The collection is the document type; documents are indexed
 * under the string form of their primary key. Queries are translated with
 * {@link SearchFilterTranslator} and evaluated by the engine; sorting and paging happen in process.
 * Records are converted with {@link SearchValues}. {@link #update} merges in process and reindexes
 * each matching document whole, so the recorded value types always describe the stored document.
 */
public final class SearchStorage extends AbstractStorage {
  private static final Logger log = LoggerFactory.getLogger(SearchStorage.class);

  private final SearchClient client;
  private final String index;
  private final SearchFilterTranslator translator = new SearchFilterTranslator();

  public SearchStorage(SearchClient client, String index, String collection, String primaryName) {
    super(collection, primaryName);
    this.client = Objects.requireNonNull(client, "client");
    this.index = Objects.requireNonNull(index, "index");
  }

  public String index() { return index; }

  @Override
  public Optional<Map<String, Object>> get(Object key) {
    return client.get(index, collection(), id(key)).map(SearchStorage::fromDocument);
  }

  @Override
  public void insert(Object key, Map<String, Object> value) {
    Map<String, Object> record = withPrimaryKey(key, value);
    if (!client.create(index, collection(), id(key), toDocument(record))) {
      throw new KeyExistsException(collection(), key);
    }
  }

  @Override
  public void upsert(Object key, Map<String, Object> value) {
    client.index(index, collection(), id(key), toDocument(withPrimaryKey(key, value)));
  }

  @Override
  public long update(QueryElement query, Map<String, Object> data) {
    Objects.requireNonNull(data, "data");
    List<Map<String, Object>> matches = search(query);
    for (Map<String, Object> r : matches) checkUpdate(r.get(primaryName()), data);
    for (Map<String, Object> r : matches) {
      Object key = r.get(primaryName());
      client.index(index, collection(), id(key), toDocument(merge(r, data)));
    }
    return matches.size();
  }

  @Override
  public long remove(QueryElement query) {
    Map<String, Object> body = translator.requestBody(query);
    log.debug("delete_by_query on '{}': {}", collection(), body);
    return client.deleteByQuery(index, collection(), body);
  }

  @Override
  protected QuerySource select(QueryElement query) {
    return new ListQuerySource(search(query));
  }

  @Override
  public void flush() {
    client.refresh(index);
  }

  private List<Map<String, Object>> search(QueryElement query) {
    Map<String, Object> body = translator.requestBody(query);
    log.debug("search on '{}': {}", collection(), body);
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> doc : client.search(index, collection(), body)) out.add(fromDocument(doc));
    return out;
  }

  private static String id(Object key) {
    return String.valueOf(Objects.requireNonNull(key, "key"));
  }

  private static Map<String, Object> toDocument(Map<String, Object> record) {
    return SearchValues.toDocument(record);
  }

  private static Map<String, Object> fromDocument(Map<String, Object> doc) {
    return SearchValues.fromDocument(doc);
  }

  @Override
  public String toString() {
    return "<SearchStorage: '" + index + "/" + collection() + "'>";
  }
}
