package cal.prim.storage;

import cal.prim.Util;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A {@link Directory} holding the objects under a key prefix in an S3 bucket.
 *
 * <p>S3 has strong read-after-write consistency, but no conditional create, so
 * {@link #create(String, InputStream)} is only a best-effort check.
 */
public class S3Directory implements Directory {

  /**
   * Objects larger than this are uploaded in parts of this size.
   */
  public static final int BYTES_PER_MULTIPART_UPLOAD_CHUNK = 64 * (int)Util.ONE_MB;

  private final S3Client s3;
  private final String bucket;
  private final String keyPrefix;

  /**
   * @param s3 the client to use
   * @param bucket the bucket; it is created if it does not exist
   * @param keyPrefix a prefix for every key, usually ending in "/"; may be empty
   * @throws IOException if the bucket cannot be reached or created
   */
  public S3Directory(S3Client s3, String bucket, String keyPrefix) throws IOException {
    this.s3 = s3;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix;
    try {
      s3.headBucket(b -> b.bucket(bucket));
    } catch (NoSuchBucketException missing) {
      try {
        s3.createBucket(b -> b.bucket(bucket));
      } catch (SdkException e) {
        throw new IOException("failed to create bucket " + bucket, e);
      }
    } catch (SdkException e) {
      throw new IOException("failed to reach bucket " + bucket, e);
    }
  }

  private String key(String name) {
    return keyPrefix + name;
  }

  /**
   * Pages through the whole listing before returning, so that failures surface here as
   * <code>IOException</code>s rather than during iteration.
   */
  @Override
  public Stream<String> list(String prefix) throws IOException {
    List<String> names;
    try {
      names = s3.listObjectsV2Paginator(b -> b.bucket(bucket).prefix(key(prefix)))
          .contents()
          .stream()
          .map(S3Object::key)
          .map(k -> k.substring(keyPrefix.length()))
          .collect(Collectors.toList());
    } catch (SdkException e) {
      throw new IOException("failed to list " + this + prefix, e);
    }
    return names.stream();
  }

  @Override
  public boolean exists(String name) throws IOException {
    try {
      s3.headObject(b -> b.bucket(bucket).key(key(name)));
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (SdkException e) {
      throw new IOException("failed to check " + this + name, e);
    }
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    String key = key(name);
    byte[] chunk = new byte[BYTES_PER_MULTIPART_UPLOAD_CHUNK];
    int n = Util.readChunk(stream, chunk);
    try {
      if (n < chunk.length) {
        s3.putObject(b -> b.bucket(bucket).key(key), RequestBody.fromBytes(Arrays.copyOf(chunk, n)));
      } else {
        uploadInParts(key, chunk, stream);
      }
    } catch (SdkException e) {
      throw new IOException("failed to write " + this + name, e);
    }
  }

  /**
   * @param chunk a full first part; reused as the buffer for the following parts
   */
  private void uploadInParts(String key, byte[] chunk, InputStream rest) throws IOException {
    String uploadId = s3.createMultipartUpload(b -> b.bucket(bucket).key(key)).uploadId();
    try {
      List<CompletedPart> parts = new ArrayList<>();
      int length = chunk.length;
      while (length > 0) {
        int partNumber = parts.size() + 1;
        String eTag = s3.uploadPart(
            b -> b.bucket(bucket).key(key).uploadId(uploadId).partNumber(partNumber),
            RequestBody.fromBytes(Arrays.copyOf(chunk, length))).eTag();
        parts.add(CompletedPart.builder().partNumber(partNumber).eTag(eTag).build());
        length = Util.readChunk(rest, chunk);
      }
      s3.completeMultipartUpload(b -> b.bucket(bucket).key(key).uploadId(uploadId)
          .multipartUpload(u -> u.parts(parts)));
    } catch (IOException | SdkException e) {
      try {
        s3.abortMultipartUpload(b -> b.bucket(bucket).key(key).uploadId(uploadId));
      } catch (SdkException onAbort) {
        e.addSuppressed(onAbort);
      }
      throw e;
    }
  }

  @Override
  public void create(String name, InputStream stream) throws IOException {
    if (exists(name)) {
      throw new FileAlreadyExistsException(name);
    }
    createOrReplace(name, stream);
  }

  @Override
  public InputStream open(String name) throws IOException {
    try {
      return s3.getObject(b -> b.bucket(bucket).key(key(name)));
    } catch (NoSuchKeyException e) {
      NoSuchFileException ex = new NoSuchFileException(name);
      ex.initCause(e);
      throw ex;
    } catch (SdkException e) {
      throw new IOException("failed to open " + this + name, e);
    }
  }

  @Override
  public void delete(String name) throws IOException {
    try {
      s3.deleteObject(b -> b.bucket(bucket).key(key(name)));
    } catch (SdkException e) {
      throw new IOException("failed to delete " + this + name, e);
    }
  }

  @Override
  public String toString() {
    return "s3://" + bucket + '/' + keyPrefix;
  }

}
