package cal.biglist.impls;

import cal.prim.concurrency.DynamoDBStringRegister;
import cal.prim.concurrency.StringRegister;
import cal.prim.storage.Directory;
import cal.prim.storage.S3Directory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.io.IOException;

/**
 * A location under a key prefix in an S3 bucket.  Registers are items in a DynamoDB table
 * keyed by the full location, so many biglists can share one table.
 *
 * <p>The clients belong to the caller; {@link #close()} does not close them.
 */
public class AwsLocation extends AbstractLocation {

  private final String bucket;
  private final String prefix;
  private final S3Directory directory;
  private final DynamoDbClient dynamo;
  private final String tableName;

  /**
   * @param s3 the S3 client
   * @param bucket the bucket; created if missing
   * @param prefix the key prefix, such as <code>"datasets/2024/run-1"</code>
   * @param dynamo the DynamoDB client
   * @param tableName the register table; created if missing
   * @throws IOException if the bucket or the table cannot be reached or created
   */
  public AwsLocation(S3Client s3, String bucket, String prefix, DynamoDbClient dynamo, String tableName) throws IOException {
    String normalized = prefix.isEmpty() || prefix.endsWith("/") ? prefix : prefix + '/';
    this.bucket = bucket;
    this.prefix = normalized;
    this.directory = new S3Directory(s3, bucket, normalized);
    this.dynamo = dynamo;
    this.tableName = tableName;
    DynamoDBStringRegister.ensureTable(dynamo, tableName);
  }

  @Override
  public Directory directory() {
    return directory;
  }

  @Override
  protected StringRegister newRegister(String name) {
    return new DynamoDBStringRegister(dynamo, tableName, this + "#" + name);
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return "s3://" + bucket + '/' + prefix;
  }

}
