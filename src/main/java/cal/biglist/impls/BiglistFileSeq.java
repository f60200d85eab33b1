package cal.biglist.impls;

import cal.biglist.types.DataFileInfo;
import cal.biglist.types.FileReader;
import cal.biglist.types.FileSeq;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The data files of one biglist, as of one version of its index.
 */
public class BiglistFileSeq<T> extends FileSeq<T> {

  private final String dataFolder;
  private final ImmutableList<DataFileInfo> dataFilesInfo;
  private final BiglistFileReader.Loader<T> loader;

  /**
   * @param dataFolder prefix for file names, such as <code>"store/"</code>
   * @param dataFilesInfo the index
   * @param loader reads a file given its full name
   */
  public BiglistFileSeq(String dataFolder, List<DataFileInfo> dataFilesInfo, BiglistFileReader.Loader<T> loader) {
    this.dataFolder = dataFolder;
    this.dataFilesInfo = ImmutableList.copyOf(dataFilesInfo);
    this.loader = loader;
  }

  @Override
  public List<DataFileInfo> dataFilesInfo() {
    return dataFilesInfo;
  }

  @Override
  public FileReader<T> get(int index) {
    return new BiglistFileReader<>(dataFolder + dataFilesInfo.get(index).fileName(), loader);
  }

}
