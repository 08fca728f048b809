package com.codeheadsystems.coffer.client.manager;

import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.model.keys.FileKey;
import com.codeheadsystems.coffer.model.keys.MissingKeysResponse;
import com.codeheadsystems.coffer.model.keys.PublicKeyContainer;
import com.codeheadsystems.coffer.model.keys.UserFileKeySetBatchRequest;
import com.codeheadsystems.coffer.model.keys.UserFileKeySetRequest;
import com.codeheadsystems.coffer.model.keys.UserIdFileIdItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out wrapped file keys to users who have access to an encrypted file but no key for it.
 */
@Singleton
public class FileKeyDistributor {

  public static final int MISSING_KEYS_BATCH = 50;

  private static final Logger log = LoggerFactory.getLogger(FileKeyDistributor.class);

  private final NodesAccessor nodesAccessor;

  @Inject
  public FileKeyDistributor(final NodesAccessor nodesAccessor) {
    log.info("FileKeyDistributor()");
    this.nodesAccessor = nodesAccessor;
  }

  /**
   * Wraps the key of a freshly uploaded file for everyone missing it. All pages are read before
   * anything is submitted, so the server side list does not shift while it is paged; the wrapped
   * keys then go out in one batch.
   *
   * @param fileId   the file
   * @param plainKey the file's content key
   * @return the number of keys submitted
   */
  public int distribute(final long fileId, final PlainFileKey plainKey) {
    log.debug("distribute(fileId={})", fileId);
    List<UserFileKeySetRequest> requests = new ArrayList<>();
    long offset = 0;
    while (true) {
      MissingKeysResponse page = nodesAccessor.getMissingFileKeys(fileId, MISSING_KEYS_BATCH, offset);
      if (page.isEmpty()) {
        break;
      }
      for (UserIdFileIdItem item : page.items()) {
        if (item.fileId() != fileId) {
          continue;
        }
        Optional<PublicKeyContainer> publicKey = page.publicKeyFor(item.userId());
        if (publicKey.isEmpty()) {
          log.warn("distribute(fileId={}): no public key for user {}", fileId, item.userId());
          continue;
        }
        requests.add(new UserFileKeySetRequest(item.userId(), fileId,
            FileKeyCrypto.encryptFileKey(plainKey, publicKey.get())));
      }
      offset += page.items().size();
      if (!hasMore(page, offset)) {
        break;
      }
    }
    return submit(requests);
  }

  /**
   * Distributes every missing key the caller can provide, for any file. Each file key is first
   * unwrapped with the caller's own key pair.
   *
   * @param keyPair the caller's unlocked key pair
   * @return the number of keys submitted
   */
  public int distributeAll(final UnlockedKeyPair keyPair) {
    log.debug("distributeAll()");
    Map<Long, PlainFileKey> unwrapped = new HashMap<>();
    List<UserFileKeySetRequest> requests = new ArrayList<>();
    try {
      long offset = 0;
      while (true) {
        MissingKeysResponse page = nodesAccessor.getMissingFileKeys(null, MISSING_KEYS_BATCH, offset);
        if (page.isEmpty()) {
          break;
        }
        for (UserIdFileIdItem item : page.items()) {
          Optional<PublicKeyContainer> publicKey = page.publicKeyFor(item.userId());
          Optional<FileKey> ownKey = page.fileKeyFor(item.fileId());
          if (publicKey.isEmpty() || ownKey.isEmpty()) {
            log.warn("distributeAll(): incomplete entry user={} file={}", item.userId(), item.fileId());
            continue;
          }
          PlainFileKey plainKey = unwrapped.computeIfAbsent(item.fileId(),
              id -> FileKeyCrypto.decryptFileKey(ownKey.get(), keyPair));
          requests.add(new UserFileKeySetRequest(item.userId(), item.fileId(),
              FileKeyCrypto.encryptFileKey(plainKey, publicKey.get())));
        }
        offset += page.items().size();
        if (!hasMore(page, offset)) {
          break;
        }
      }
    } finally {
      unwrapped.values().forEach(PlainFileKey::close);
    }
    return submit(requests);
  }

  private int submit(final List<UserFileKeySetRequest> requests) {
    if (requests.isEmpty()) {
      return 0;
    }
    log.debug("submit(keys={})", requests.size());
    nodesAccessor.setFileKeys(new UserFileKeySetBatchRequest(requests));
    return requests.size();
  }

  private static boolean hasMore(final MissingKeysResponse page, final long offset) {
    return page.range() != null && offset < page.range().total()
        && page.items().size() >= MISSING_KEYS_BATCH;
  }
}
