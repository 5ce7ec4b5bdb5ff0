package com.example.documentdb.core.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates query pages whose records may differ in shape, e.g. aggregate pages next to
 * projection pages. Merging never fails: the merged records share the union of all fields.
 *
 * <p>Not thread-safe; one instance serves one query invocation.
 */
public final class RecordMerger {

  private final Set<String> fields = new LinkedHashSet<>();
  private final List<Map<String, Object>> records = new ArrayList<>();

  public void add(final List<? extends Map<String, ?>> page) {
    for (final var record : page) {
      fields.addAll(record.keySet());
      records.add(new LinkedHashMap<>(record));
    }
  }

  public int size() {
    return records.size();
  }

  public List<String> fields() {
    return List.copyOf(fields);
  }

  /**
   * Returns the accumulated records, each keyed by the full field union in first-seen order.
   *
   * @return merged, unmodifiable records
   */
  public List<Map<String, Object>> records() {
    final var merged = new ArrayList<Map<String, Object>>(records.size());
    for (final var record : records) {
      final var row = new LinkedHashMap<String, Object>();
      for (final var field : fields) row.put(field, record.get(field));
      merged.add(Collections.unmodifiableMap(row));
    }
    return merged;
  }
}
