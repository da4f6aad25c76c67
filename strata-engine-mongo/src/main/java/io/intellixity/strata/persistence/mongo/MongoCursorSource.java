package io.intellixity.strata.persistence.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.CountOptions;
import io.intellixity.strata.persistence.query.SortField;
import io.intellixity.strata.persistence.queryset.QueryDirectives;
import io.intellixity.strata.persistence.queryset.QuerySource;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Applies sort, skip and limit on the server. */
final class MongoCursorSource implements QuerySource {
  private final MongoCollection<Document> collection;
  private final Document filter;
  private final Function<Document, Map<String, Object>> toRecord;

  MongoCursorSource(MongoCollection<Document> collection, Document filter, Function<Document, Map<String, Object>> toRecord) {
    this.collection = collection;
    this.filter = filter;
    this.toRecord = toRecord;
  }

  @Override
  public List<Map<String, Object>> fetch(QueryDirectives d) {
    List<Map<String, Object>> out = new ArrayList<>();
    // the driver reads limit(0) as "no limit"
    if (d.limit() != null && d.limit() == 0) return out;

    FindIterable<Document> find = collection.find(filter);
    Document sort = sortDocument(d.sort());
    if (!sort.isEmpty()) find = find.sort(sort);
    if (d.offset() != null) find = find.skip(d.offset());
    if (d.limit() != null) find = find.limit(d.limit());
    for (Document doc : find) out.add(toRecord.apply(doc));
    return out;
  }

  @Override
  public long nativeCount(QueryDirectives d) {
    if (d.limit() != null && d.limit() == 0) return 0;
    CountOptions opts = new CountOptions();
    if (d.offset() != null) opts.skip(d.offset());
    if (d.limit() != null) opts.limit(d.limit());
    return collection.countDocuments(filter, opts);
  }

  /** First declared key is most significant; a repeated field keeps its first direction. */
  static Document sortDocument(List<SortField> fields) {
    Document sort = new Document();
    for (SortField f : fields) {
      if (!sort.containsKey(f.field())) sort.append(f.field(), f.descending() ? -1 : 1);
    }
    return sort;
  }
}
