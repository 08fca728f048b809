package com.codeheadsystems.coffer.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.coffer.client.TestConfigs;
import com.codeheadsystems.coffer.client.accessor.ContentAccessor;
import com.codeheadsystems.coffer.client.accessor.NodesAccessor;
import com.codeheadsystems.coffer.client.accessor.UserAccountAccessor;
import com.codeheadsystems.coffer.client.exceptions.StorageBackendException;
import com.codeheadsystems.coffer.crypto.CryptoException;
import com.codeheadsystems.coffer.crypto.FileEncrypter;
import com.codeheadsystems.coffer.crypto.FileKeyCrypto;
import com.codeheadsystems.coffer.crypto.SecretValue;
import com.codeheadsystems.coffer.crypto.UserKeyPairCrypto;
import com.codeheadsystems.coffer.model.download.DownloadUrlResponse;
import com.codeheadsystems.coffer.model.error.S3ErrorResponse;
import com.codeheadsystems.coffer.model.keys.UserKeyPairContainer;
import com.codeheadsystems.coffer.model.node.Node;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DownloadManagerTest {

  private static final SecretValue SECRET = SecretValue.of("Secret123!");
  private static final byte[] CONTENT = "0123456789".getBytes(StandardCharsets.UTF_8);

  private static UserKeyPairContainer alice;

  @Mock private NodesAccessor nodesAccessor;
  @Mock private ContentAccessor contentAccessor;
  @Mock private UserAccountAccessor userAccountAccessor;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final List<Long> progress = new ArrayList<>();
  private KeyPairManager keyPairManager;
  private DownloadManager manager;

  @BeforeAll
  static void generateKeyPair() {
    alice = UserKeyPairCrypto.generate(FileKeyCrypto.KEYPAIR_VERSION_2048, SECRET);
  }

  @BeforeEach
  void setUp() {
    keyPairManager = new KeyPairManager(userAccountAccessor);
    manager = new DownloadManager(TestConfigs.config(1, 4), nodesAccessor, contentAccessor, keyPairManager);
  }

  @Test
  void download_plain_fetchesRangesWithFreshUrls() {
    stubDownloadUrls();
    stubRanges(CONTENT);

    manager.download(file(10L, false), out, (soFar, total) -> progress.add(soFar), null);

    assertThat(out.toByteArray()).isEqualTo(CONTENT);
    assertThat(progress).containsExactly(4L, 8L, 10L);
    verify(nodesAccessor, times(3)).getDownloadUrl(42);
    ArgumentCaptor<URI> urls = ArgumentCaptor.forClass(URI.class);
    verify(contentAccessor, times(3)).getRange(urls.capture(), anyLong(), anyLong());
    assertThat(urls.getAllValues()).extracting(URI::toString)
        .containsExactly("https://dl.example.com/1", "https://dl.example.com/2", "https://dl.example.com/3");
    verify(contentAccessor).getRange(any(), eq(8L), eq(9L));
  }

  @Test
  void download_unknownSize_readsTotalFromContentRange() {
    stubDownloadUrls();
    stubRanges(CONTENT);
    when(contentAccessor.fetchTotalSize(URI.create("https://dl.example.com/1"))).thenReturn(Optional.of(10L));

    manager.download(file(null, false), out);

    assertThat(out.toByteArray()).isEqualTo(CONTENT);
  }

  @Test
  void download_emptyFile_makesNoRangeRequest() {
    when(nodesAccessor.getDownloadUrl(42)).thenReturn(new DownloadUrlResponse("https://dl.example.com/1"));

    manager.download(file(0L, false), out);

    assertThat(out.toByteArray()).isEmpty();
    verify(contentAccessor, times(0)).getRange(any(), anyLong(), anyLong());
  }

  @Test
  void download_encrypted_decryptsAndWritesOnce() {
    FileEncrypter.EncryptedContent encrypted = FileEncrypter.encryptAll(CONTENT);
    unlock();
    stubDownloadUrls();
    stubRanges(encrypted.cipherText());
    when(nodesAccessor.getUserFileKey(42))
        .thenReturn(FileKeyCrypto.encryptFileKey(encrypted.fileKey(), alice.publicKeyContainer()));

    manager.download(file(10L, true), out);

    assertThat(out.toByteArray()).isEqualTo(CONTENT);
  }

  @Test
  void download_encryptedTampered_throwsAndWritesNothing() {
    FileEncrypter.EncryptedContent encrypted = FileEncrypter.encryptAll(CONTENT);
    byte[] tampered = encrypted.cipherText().clone();
    tampered[3] ^= 0x01;
    unlock();
    stubDownloadUrls();
    stubRanges(tampered);
    when(nodesAccessor.getUserFileKey(42))
        .thenReturn(FileKeyCrypto.encryptFileKey(encrypted.fileKey(), alice.publicKeyContainer()));

    assertThatThrownBy(() -> manager.download(file(10L, true), out)).isInstanceOf(CryptoException.class);
    assertThat(out.toByteArray()).isEmpty();
  }

  @Test
  void download_rangeFails_abortsWithStorageError() {
    when(nodesAccessor.getDownloadUrl(42)).thenReturn(
        new DownloadUrlResponse("https://dl.example.com/1"), new DownloadUrlResponse("https://dl.example.com/2"));
    when(contentAccessor.getRange(any(), anyLong(), anyLong()))
        .thenReturn(Arrays.copyOfRange(CONTENT, 0, 4))
        .thenThrow(new StorageBackendException(403, new S3ErrorResponse("AccessDenied", "expired", null, null, null)));

    assertThatThrownBy(() -> manager.download(file(10L, false), out))
        .isInstanceOfSatisfying(StorageBackendException.class, e -> assertThat(e.isForbidden()).isTrue());
    assertThat(out.toByteArray()).hasSize(4);
  }

  private void unlock() {
    when(userAccountAccessor.getUserKeyPair()).thenReturn(alice);
    keyPairManager.getUnlockedKeyPair(SECRET);
  }

  private void stubDownloadUrls() {
    when(nodesAccessor.getDownloadUrl(42)).thenReturn(
        new DownloadUrlResponse("https://dl.example.com/1"),
        new DownloadUrlResponse("https://dl.example.com/2"),
        new DownloadUrlResponse("https://dl.example.com/3"));
  }

  private void stubRanges(final byte[] source) {
    when(contentAccessor.getRange(any(), anyLong(), anyLong())).thenAnswer(inv -> {
      long start = inv.getArgument(1);
      long end = inv.getArgument(2);
      return Arrays.copyOfRange(source, (int) start, (int) end + 1);
    });
  }

  private static Node file(final Long size, final boolean encrypted) {
    return new Node(42, "file", "notes.txt", 7L, size, encrypted);
  }
}
