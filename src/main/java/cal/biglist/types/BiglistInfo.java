package cal.biglist.types;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The durable index of a biglist: how its data files are encoded and which data files,
 * in which order, make up the list.
 */
@Value
public class BiglistInfo {

  public static final int CURRENT_STORAGE_VERSION = 3;

  @NonNull String storageFormat;
  int storageVersion;
  int batchSize;
  @NonNull ImmutableList<DataFileInfo> dataFilesInfo;

  /**
   * Top-level fields this version does not understand.  They are kept so that merges
   * written by this version do not drop them.
   */
  @NonNull Map<String, Object> otherFields;

  public BiglistInfo(String storageFormat, int storageVersion, int batchSize, List<DataFileInfo> dataFilesInfo, Map<String, Object> otherFields) {
    this.storageFormat = storageFormat;
    this.storageVersion = storageVersion;
    this.batchSize = batchSize;
    this.dataFilesInfo = ImmutableList.copyOf(dataFilesInfo);
    // may hold JSON nulls, so no ImmutableMap
    this.otherFields = Collections.unmodifiableMap(new LinkedHashMap<>(otherFields));
  }

  public static BiglistInfo empty(String storageFormat, int batchSize) {
    return new BiglistInfo(storageFormat, CURRENT_STORAGE_VERSION, batchSize, ImmutableList.of(), Collections.emptyMap());
  }

  public BiglistInfo withDataFilesInfo(List<DataFileInfo> newDataFilesInfo) {
    return new BiglistInfo(storageFormat, storageVersion, batchSize, newDataFilesInfo, otherFields);
  }

  public long numDataItems() {
    return dataFilesInfo.isEmpty() ? 0L : dataFilesInfo.get(dataFilesInfo.size() - 1).cumulativeCount();
  }

}
