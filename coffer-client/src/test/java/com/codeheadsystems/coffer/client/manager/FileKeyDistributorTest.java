package com.codeheadsystems.coffer.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.crypto.FileDecrypter;
import com.codeheadsystems.coffer.crypto.FileEncrypter;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.PlainFileKey;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.crypto.UnlockedKeyPair;
import com.codeheadsystems.coffer.crypto.UserKeyPairCrypto;
import com.codeheadsystems.coffer.model.keys.FileFileKeys;
import com.codeheadsystems.coffer.model.keys.MissingKeysResponse;
import com.codeheadsystems.coffer.model.keys.UserFileKeySetBatchRequest;
import com.codeheadsystems.coffer.model.keys.UserIdFileIdItem;
import com.codeheadsystems.coffer.model.keys.UserKeyPairContainer;
import com.codeheadsystems.coffer.model.keys.UserUserPublicKey;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FileKeyDistributorTest {

  private static final SecretValue SECRET = SecretValue.of("Secret123!");
  private static final long FILE_ID = 5;

  private static UserKeyPairContainer alice;
  private static UserKeyPairContainer bob;

  @Mock private NodesAccessor nodesAccessor;

  private FileKeyDistributor distributor;

  @BeforeAll
  static void generateKeyPairs() {
    alice = UserKeyPairCrypto.generate(FileKeyCrypto.KEYPAIR_VERSION_2048, SECRET);
    bob = UserKeyPairCrypto.generate(FileKeyCrypto.KEYPAIR_VERSION_2048, SECRET);
  }

  @BeforeEach
  void setUp() {
    distributor = new FileKeyDistributor(nodesAccessor);
  }

  @Test
  void distribute_nothingMissing_submitsNothing() {
    when(nodesAccessor.getMissingFileKeys(FILE_ID, FileKeyDistributor.MISSING_KEYS_BATCH, 0L))
        .thenReturn(new MissingKeysResponse(null, List.of(), List.of(), List.of()));

    assertThat(distributor.distribute(FILE_ID, FileEncrypter.encryptAll(new byte[1]).fileKey())).isZero();
    verify(nodesAccessor, never()).setFileKeys(any());
  }

  @Test
  void distribute_readsEveryPageThenSubmitsOneBatch() {
    int total = FileKeyDistributor.MISSING_KEYS_BATCH + 1;
    when(nodesAccessor.getMissingFileKeys(FILE_ID, FileKeyDistributor.MISSING_KEYS_BATCH, 0L))
        .thenReturn(page(1, FileKeyDistributor.MISSING_KEYS_BATCH, total));
    when(nodesAccessor.getMissingFileKeys(FILE_ID, FileKeyDistributor.MISSING_KEYS_BATCH, 50L))
        .thenReturn(page(51, 1, total));

    int submitted = distributor.distribute(FILE_ID, FileEncrypter.encryptAll(new byte[1]).fileKey());

    assertThat(submitted).isEqualTo(total);
    ArgumentCaptor<UserFileKeySetBatchRequest> batch = ArgumentCaptor.forClass(UserFileKeySetBatchRequest.class);
    verify(nodesAccessor).setFileKeys(batch.capture());
    assertThat(batch.getValue().items()).hasSize(total);
    assertThat(batch.getValue().items()).allSatisfy(item -> assertThat(item.fileId()).isEqualTo(FILE_ID));
  }

  @Test
  void distributeAll_unwrapsOwnKeyAndWrapsForRecipient() {
    byte[] content = "shared secret".getBytes(StandardCharsets.UTF_8);
    FileEncrypter.EncryptedContent encrypted = FileEncrypter.encryptAll(content);
    when(nodesAccessor.getMissingFileKeys(null, FileKeyDistributor.MISSING_KEYS_BATCH, 0L)).thenReturn(
        new MissingKeysResponse(new MissingKeysResponse.Range(0, 50, 1),
            List.of(new UserIdFileIdItem(2, FILE_ID)),
            List.of(new UserUserPublicKey(2, bob.publicKeyContainer())),
            List.of(new FileFileKeys(FILE_ID,
                FileKeyCrypto.encryptFileKey(encrypted.fileKey(), alice.publicKeyContainer())))));

    int submitted;
    try (UnlockedKeyPair own = UserKeyPairCrypto.unlock(alice, SECRET)) {
      submitted = distributor.distributeAll(own);
    }

    assertThat(submitted).isEqualTo(1);
    ArgumentCaptor<UserFileKeySetBatchRequest> batch = ArgumentCaptor.forClass(UserFileKeySetBatchRequest.class);
    verify(nodesAccessor).setFileKeys(batch.capture());
    try (UnlockedKeyPair bobs = UserKeyPairCrypto.unlock(bob, SECRET);
         PlainFileKey key = FileKeyCrypto.decryptFileKey(batch.getValue().items().get(0).fileKey(), bobs)) {
      assertThat(FileDecrypter.decryptAll(encrypted.cipherText(), key)).isEqualTo(content);
    }
  }

  private static MissingKeysResponse page(final long firstUser, final int size, final long total) {
    List<UserIdFileIdItem> items = new ArrayList<>();
    List<UserUserPublicKey> users = new ArrayList<>();
    for (long user = firstUser; user < firstUser + size; user++) {
      items.add(new UserIdFileIdItem(user, FILE_ID));
      users.add(new UserUserPublicKey(user, bob.publicKeyContainer()));
    }
    return new MissingKeysResponse(new MissingKeysResponse.Range(firstUser - 1, 50, total), items, users, List.of());
  }
}
