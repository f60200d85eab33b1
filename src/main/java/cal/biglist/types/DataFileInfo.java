package cal.biglist.types;

/**
 * One row of the index.
 *
 * @param fileName the data file's name relative to the data folder
 * @param count the number of elements in the file
 * @param cumulativeCount the number of elements in this file and all files before it
 */
public record DataFileInfo(String fileName, int count, long cumulativeCount) {

  public DataFileEntry entry() {
    return new DataFileEntry(fileName, count);
  }

}
