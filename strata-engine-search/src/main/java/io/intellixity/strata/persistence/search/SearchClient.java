package io.intellixity.strata.persistence.search;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document operations of a search engine, addressed by index, document type and id.
 * Documents are JSON-shaped maps.
 */
public interface SearchClient {
  Optional<Map<String, Object>> get(String index, String type, String id);

  /** Creates a document; returns false without writing if the id is taken. */
  boolean create(String index, String type, String id, Map<String, Object> document);

  /** Creates or replaces a document. */
  void index(String index, String type, String id, Map<String, Object> document);

  /** Sources of every document accepted by {@code body}, a {@code {"filter": ...}} request, however many. */
  List<Map<String, Object>> search(String index, String type, Map<String, Object> body);

  /** @return number of documents deleted */
  long deleteByQuery(String index, String type, Map<String, Object> body);

  /** Makes preceding writes visible to search. */
  void refresh(String index);
}
