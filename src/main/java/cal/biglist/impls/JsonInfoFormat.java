package cal.biglist.impls;

import cal.biglist.types.BiglistInfo;
import cal.biglist.types.DataFileEntry;
import cal.biglist.types.DataFileInfo;
import cal.prim.MalformedDataException;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON documents that make up a biglist's metadata: the index
 * <pre>
 *   {"storage_format": "java-xz", "storage_version": 3, "batch_size": 1000,
 *    "data_files_info": [["20240101000000.000000_abc_1000.java_xz", 1000, 1000], ...]}
 * </pre>
 * and the interim records written by eager flushes
 * <pre>
 *   [["20240101000000.000000_abc_1000.java_xz", 1000], ...]
 * </pre>
 */
public class JsonInfoFormat {

  @JsonPropertyOrder({"storage_format", "storage_version", "batch_size", "data_files_info"})
  private static class JsonInfo {
    @JsonProperty("storage_format")
    public @Nullable String storageFormat;

    @JsonProperty("storage_version")
    public int storageVersion = BiglistInfo.CURRENT_STORAGE_VERSION;

    @JsonProperty("batch_size")
    public int batchSize;

    @JsonProperty("data_files_info")
    public List<List<Object>> dataFilesInfo = new ArrayList<>();

    private final Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOther(String key, Object value) {
      other.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
      return other;
    }
  }

  private static final TypeReference<List<List<Object>>> INTERIM_TYPE = new TypeReference<>() { };

  private final ObjectMapper mapper = new ObjectMapper();

  public BiglistInfo loadInfo(byte[] data) throws IOException {
    final JsonInfo f;
    try {
      f = mapper.readValue(data, JsonInfo.class);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Biglist index is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Biglist index JSON is not well-formed", e);
    }
    if (f == null) {
      throw new MalformedDataException("Biglist index is empty");
    }
    String storageFormat = f.storageFormat;
    if (storageFormat == null) {
      throw new MalformedDataException("Biglist index has no storage_format");
    }

    List<DataFileInfo> files = new ArrayList<>(f.dataFilesInfo.size());
    long expectedCumulative = 0;
    for (List<Object> row : f.dataFilesInfo) {
      if (row == null || row.size() != 3) {
        throw new MalformedDataException("Biglist index row is not [name, count, cumulative count]: " + row);
      }
      DataFileInfo info = new DataFileInfo(asName(row.get(0)), asCount(row.get(1)), asLong(row.get(2)));
      expectedCumulative += info.count();
      if (info.cumulativeCount() != expectedCumulative) {
        throw new MalformedDataException("Biglist index row " + row + " should have cumulative count " + expectedCumulative);
      }
      files.add(info);
    }

    return new BiglistInfo(storageFormat, f.storageVersion, f.batchSize, files, f.other);
  }

  public byte[] serializeInfo(BiglistInfo info) throws IOException {
    JsonInfo f = new JsonInfo();
    f.storageFormat = info.getStorageFormat();
    f.storageVersion = info.getStorageVersion();
    f.batchSize = info.getBatchSize();
    for (DataFileInfo file : info.getDataFilesInfo()) {
      f.dataFilesInfo.add(List.of(file.fileName(), file.count(), file.cumulativeCount()));
    }
    f.other.putAll(info.getOtherFields());
    return mapper.writeValueAsBytes(f);
  }

  public List<DataFileEntry> loadInterim(byte[] data) throws IOException {
    final List<List<Object>> rows;
    try {
      rows = mapper.readValue(data, INTERIM_TYPE);
    } catch (JsonParseException e) {
      throw new MalformedDataException("Interim record is not legal JSON", e);
    } catch (JsonMappingException e) {
      throw new MalformedDataException("Interim record JSON is not well-formed", e);
    }
    if (rows == null) {
      throw new MalformedDataException("Interim record is empty");
    }
    List<DataFileEntry> result = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row == null || row.size() != 2) {
        throw new MalformedDataException("Interim record row is not [name, count]: " + row);
      }
      result.add(new DataFileEntry(asName(row.get(0)), asCount(row.get(1))));
    }
    return result;
  }

  public byte[] serializeInterim(List<DataFileEntry> entries) throws IOException {
    List<List<Object>> rows = new ArrayList<>(entries.size());
    for (DataFileEntry e : entries) {
      rows.add(List.of(e.fileName(), e.count()));
    }
    return mapper.writeValueAsBytes(rows);
  }

  private static String asName(@Nullable Object o) throws MalformedDataException {
    if (o instanceof String s && !s.isEmpty()) {
      return s;
    }
    throw new MalformedDataException("expected a file name but found " + o);
  }

  private static long asLong(@Nullable Object o) throws MalformedDataException {
    if (o instanceof Integer || o instanceof Long) {
      return ((Number)o).longValue();
    }
    throw new MalformedDataException("expected an integer but found " + o);
  }

  private static int asCount(@Nullable Object o) throws MalformedDataException {
    long n = asLong(o);
    if (n < 0 || n > Integer.MAX_VALUE) {
      throw new MalformedDataException("count out of range: " + n);
    }
    return (int)n;
  }

}
