package cal.prim.concurrency;

import cal.prim.PreconditionFailed;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link StringRegister} backed by Amazon's DynamoDB.  Conditional writes give the
 * compare-and-swap, so any number of machines can share a register.
 *
 * <p>Many registers can share one table; each is an item keyed by the register name.
 * Call {@link #ensureTable(DynamoDbClient, String)} once before constructing registers.
 */
public class DynamoDBStringRegister implements StringRegister {

  private static final Logger log = LoggerFactory.getLogger(DynamoDBStringRegister.class);

  private static final String KEY_ATTRIBUTE = "Id";
  private static final String VALUE_ATTRIBUTE = "Value";

  private final DynamoDbClient dynamo;
  private final String table;
  private final String registerName;

  public DynamoDBStringRegister(DynamoDbClient dynamo, String table, String registerName) {
    this.dynamo = Objects.requireNonNull(dynamo);
    this.table = Objects.requireNonNull(table);
    this.registerName = Objects.requireNonNull(registerName);
  }

  /**
   * Create the register table if it does not exist yet, and wait until it is active.
   *
   * @param dynamo the client to use
   * @param table the table name
   * @throws IOException if the table could not be created
   */
  public static void ensureTable(DynamoDbClient dynamo, String table) throws IOException {
    try {
      dynamo.createTable(b -> b.tableName(table)
          .keySchema(k -> k.attributeName(KEY_ATTRIBUTE).keyType(KeyType.HASH))
          .attributeDefinitions(a -> a.attributeName(KEY_ATTRIBUTE).attributeType(ScalarAttributeType.S))
          .billingMode(BillingMode.PAY_PER_REQUEST));
    } catch (ResourceInUseException alreadyExists) {
      log.debug("DynamoDB table `{}` already exists", table);
      return;
    } catch (SdkException e) {
      throw new IOException("failed to create DynamoDB table " + table, e);
    }

    log.info("Waiting for DynamoDB table `{}`...", table);
    try (DynamoDbWaiter waiter = dynamo.waiter()) {
      waiter.waitUntilTableExists(b -> b.tableName(table));
    } catch (SdkException e) {
      throw new IOException("DynamoDB table " + table + " did not become active", e);
    }
  }

  private Map<String, AttributeValue> key() {
    return Map.of(KEY_ATTRIBUTE, AttributeValue.fromS(registerName));
  }

  @Override
  public String read() throws IOException {
    GetItemRequest request = GetItemRequest.builder()
        .tableName(table)
        .key(key())
        .consistentRead(true)
        .build();
    Map<String, AttributeValue> row;
    try {
      row = dynamo.getItem(request).item();
    } catch (SdkException e) {
      throw new IOException("failed to read " + this, e);
    }
    if (row == null || !row.containsKey(VALUE_ATTRIBUTE)) {
      return "";
    }
    return row.get(VALUE_ATTRIBUTE).s();
  }

  /**
   * The condition under which a write may proceed.  DynamoDB rejects empty strings, so a
   * register holding <code>""</code> is a register with no item.
   */
  private static String condition(String expectedValue) {
    return expectedValue.isEmpty() ? "attribute_not_exists(#v)" : "#v = :expected";
  }

  private static @Nullable Map<String, AttributeValue> conditionValues(String expectedValue) {
    // the service rejects an empty value map
    return expectedValue.isEmpty() ? null : Map.of(":expected", AttributeValue.fromS(expectedValue));
  }

  @Override
  public void write(String expectedValue, String newValue) throws IOException, PreconditionFailed {
    Objects.requireNonNull(expectedValue, "expected value may not be null");
    Objects.requireNonNull(newValue, "new value may not be null");

    String condition = condition(expectedValue);
    Map<String, String> names = Map.of("#v", VALUE_ATTRIBUTE);
    Map<String, AttributeValue> values = conditionValues(expectedValue);
    try {
      if (newValue.isEmpty()) {
        dynamo.deleteItem(b -> b.tableName(table)
            .key(key())
            .conditionExpression(condition)
            .expressionAttributeNames(names)
            .expressionAttributeValues(values));
      } else {
        Map<String, AttributeValue> row = new HashMap<>(key());
        row.put(VALUE_ATTRIBUTE, AttributeValue.fromS(newValue));
        dynamo.putItem(b -> b.tableName(table)
            .item(row)
            .conditionExpression(condition)
            .expressionAttributeNames(names)
            .expressionAttributeValues(values));
      }
    } catch (ConditionalCheckFailedException e) {
      throw new PreconditionFailed(e);
    } catch (SdkException e) {
      throw new IOException("failed to write " + this, e);
    }
  }

  @Override
  public String toString() {
    return "dynamodb:" + table + '#' + registerName;
  }

}
