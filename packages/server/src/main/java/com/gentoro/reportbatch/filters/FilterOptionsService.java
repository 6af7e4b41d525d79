package com.gentoro.reportbatch.filters;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.reportbatch.exception.LimitExceededException;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.security.AllowlistValidator;
import com.gentoro.reportbatch.upstream.RecordExtractor;
import com.gentoro.reportbatch.upstream.UpstreamClient;
import com.gentoro.reportbatch.upstream.UpstreamRequest;
import com.gentoro.reportbatch.upstream.UpstreamResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the permissible values of report filter fields. Cached fields are answered from
 * {@link FilterCache}; the remaining ones are computed from a single upstream fetch and cached.
 */
public final class FilterOptionsService {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(FilterOptionsService.class);

  private final FilterCache cache;
  private final AllowlistValidator validator;
  private final UpstreamClient upstream;
  private final String defaultEndpoint;
  private final OptionalLong maxRecords;
  private final int maxValuesPerField;

  public FilterOptionsService(
      FilterCache cache,
      AllowlistValidator validator,
      UpstreamClient upstream,
      String defaultEndpoint,
      OptionalLong maxRecords,
      int maxValuesPerField) {
    this.cache = cache;
    this.validator = validator;
    this.upstream = upstream;
    this.defaultEndpoint = StringUtils.trimToEmpty(defaultEndpoint);
    this.maxRecords = maxRecords;
    this.maxValuesPerField = maxValuesPerField;
  }

  public FilterOptions resolve(FilterQuery query) {
    if (query.fields().isEmpty()) {
      throw new ValidationException("At least one filter field is required");
    }
    String endpoint = StringUtils.defaultIfBlank(query.endpoint(), defaultEndpoint);
    if (endpoint.isEmpty()) {
      throw new ValidationException("Endpoint is required and no default upstream is configured");
    }

    Map<String, List<JsonNode>> options = new LinkedHashMap<>();
    Map<String, FilterOptions.FieldMeta> meta = new LinkedHashMap<>();
    Map<String, Boolean> truncated = new LinkedHashMap<>();
    Map<String, String> missing = new LinkedHashMap<>();

    for (String field : query.fields()) {
      String key = FilterCacheKeys.forField(query, field);
      Optional<CacheEntry> hit = cache.lookup(key);
      if (hit.isPresent()) {
        CacheEntry entry = hit.get();
        options.put(field, entry.values());
        meta.put(field, new FilterOptions.FieldMeta(true, entry.values().size()));
        truncated.put(field, entry.truncated());
      } else {
        missing.put(field, key);
      }
    }

    if (!missing.isEmpty()) {
      String url = validator.requirePermitted(endpoint);
      UpstreamResponse response = upstream.execute(UpstreamRequest.of(url, query.method(), query.body()));
      List<JsonNode> records = RecordExtractor.records(response.body());
      if (maxRecords.isPresent() && records.size() > maxRecords.getAsLong()) {
        throw new LimitExceededException("Record limit", records.size(), maxRecords.getAsLong());
      }
      log.debug(
          "Resolving {} filter field(s) from {} record(s) of {}", missing.size(), records.size(), url);
      missing.forEach(
          (field, key) -> {
            DistinctValues values = distinct(records, field);
            cache.put(key, values.values(), values.truncated());
            options.put(field, values.values());
            meta.put(field, new FilterOptions.FieldMeta(false, values.values().size()));
            truncated.put(field, values.truncated());
          });
    }

    // restore the requested field order
    Map<String, List<JsonNode>> orderedOptions = new LinkedHashMap<>();
    Map<String, FilterOptions.FieldMeta> orderedMeta = new LinkedHashMap<>();
    Map<String, Boolean> orderedTruncated = new LinkedHashMap<>();
    for (String field : query.fields()) {
      orderedOptions.put(field, options.get(field));
      orderedMeta.put(field, meta.get(field));
      orderedTruncated.put(field, truncated.get(field));
    }
    return new FilterOptions(orderedOptions, orderedMeta, orderedTruncated);
  }

  private DistinctValues distinct(List<JsonNode> records, String field) {
    Set<JsonNode> seen = new LinkedHashSet<>();
    boolean cut = false;
    for (JsonNode record : records) {
      JsonNode value = record.get(field);
      if (value == null || value.isNull()) continue;
      if (seen.contains(value)) continue;
      if (seen.size() >= maxValuesPerField) {
        cut = true;
        break;
      }
      seen.add(value);
    }
    return new DistinctValues(new ArrayList<>(seen), cut);
  }

  private record DistinctValues(List<JsonNode> values, boolean truncated) {}
}
