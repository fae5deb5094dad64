package com.codeheadsystems.delegate.server.store;

import static com.codeheadsystems.delegate.server.store.InMemorySessionKeyStoreTest.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.delegate.server.manager.SessionKeyManager;
import com.codeheadsystems.delegate.server.model.Amounts;
import com.codeheadsystems.delegate.server.model.SessionKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSessionKeyStoreTest {

  @TempDir
  Path root;

  @Test
  void records_surviveReopen() {
    SessionKey key = record("0xaa", "0x01");
    FileSessionKeyStore first = new FileSessionKeyStore(root);
    first.insert(key);
    first.save(key.withUsage(BigInteger.valueOf(7), 19792L));

    FileSessionKeyStore reopened = new FileSessionKeyStore(root);

    assertThat(reopened.load(key.id())).contains(key.withUsage(BigInteger.valueOf(7), 19792L));
    assertThat(reopened.size()).isEqualTo(1);
  }

  @Test
  void slowWriteOfOneKey_doesNotBlockAnotherKey() throws Exception {
    AtomicBoolean gateArmed = new AtomicBoolean(false);
    CountDownLatch slowWriteStarted = new CountDownLatch(1);
    CountDownLatch releaseSlowWrite = new CountDownLatch(1);
    ObjectMapper gated = new ObjectMapper() {
      @Override
      public void writeValue(File resultFile, Object value) throws IOException {
        if (gateArmed.get() && value instanceof StoredSessionKey stored && stored.keyId().equals("0x01")) {
          slowWriteStarted.countDown();
          try {
            releaseSlowWrite.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException(e);
          }
        }
        super.writeValue(resultFile, value);
      }
    };
    FileSessionKeyStore store = new FileSessionKeyStore(root, gated);
    SessionKey slowKey = record("0xaa", "0x01");
    SessionKey fastKey = record("0xbb", "0x02");
    store.insert(slowKey);
    store.insert(fastKey);
    gateArmed.set(true);

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<?> slow = executor.submit(() -> store.save(slowKey.withUsage(BigInteger.ONE, 19792L)));
      assertThat(slowWriteStarted.await(5, TimeUnit.SECONDS)).isTrue();

      Future<?> fast = executor.submit(() -> store.save(fastKey.withUsage(BigInteger.TWO, 19792L)));
      fast.get(5, TimeUnit.SECONDS);

      assertThat(slow).isNotDone();
      assertThat(store.load(fastKey.id())).contains(fastKey.withUsage(BigInteger.TWO, 19792L));

      releaseSlowWrite.countDown();
      slow.get(5, TimeUnit.SECONDS);
      assertThat(store.load(slowKey.id())).contains(slowKey.withUsage(BigInteger.ONE, 19792L));
    } finally {
      releaseSlowWrite.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void largeAmounts_areStoredExactly() {
    SessionKey key = new SessionKey("0xaa", "0x01", Amounts.MAX_UINT256, Amounts.MAX_UINT256,
        Amounts.MAX_UINT256.subtract(BigInteger.ONE), 1L, Instant.parse("2030-01-01T00:00:00Z"),
        Set.of("0xbb", "0xcc"), false,
        Instant.parse("2024-01-01T00:00:00Z"));
    new FileSessionKeyStore(root).insert(key);

    assertThat(new FileSessionKeyStore(root).load(key.id())).contains(key);
  }

  @Test
  void identities_areHexEncodedIntoFileNames() throws IOException {
    new FileSessionKeyStore(root).insert(record("../escape", "a/b"));

    try (Stream<Path> files = Files.walk(root)) {
      assertThat(files.filter(Files::isRegularFile).map(p -> root.relativize(p).toString()))
          .containsExactly(Path.of("2e2e2f657363617065", "612f62.json").toString());
    }
  }

  @Test
  void insert_existing_returnsFalse() {
    FileSessionKeyStore store = new FileSessionKeyStore(root);
    store.insert(record("0xaa", "0x01"));

    assertThat(store.insert(record("0xaa", "0x01"))).isFalse();
  }

  @Test
  void unreadableRecord_failsOnOpen() throws IOException {
    Path accountDir = Files.createDirectories(root.resolve("3078616161"));
    Files.writeString(accountDir.resolve("3078303031.json"), "{not json");

    assertThatThrownBy(() -> new FileSessionKeyStore(root)).isInstanceOf(UncheckedIOException.class);
  }

  @Test
  void manager_stateSurvivesRestart() {
    Instant now = Instant.parse("2024-03-10T12:00:00Z");
    Clock clock = Clock.fixed(now, ZoneOffset.UTC);
    SessionKeyManager before = new SessionKeyManager(new FileSessionKeyStore(root), e -> { }, clock);
    before.grant("0xaa", "0x01", BigInteger.TEN, BigInteger.valueOf(15), now.plusSeconds(600), List.of());
    before.authorize("0xaa", "0x01", "0xcc", BigInteger.TEN);

    SessionKeyManager after = new SessionKeyManager(new FileSessionKeyStore(root), e -> { }, clock);

    assertThat(after.getUsage("0xaa", "0x01").value().usedToday()).isEqualTo(BigInteger.TEN);
    assertThat(after.authorize("0xaa", "0x01", "0xcc", BigInteger.TEN).allowed()).isFalse();
  }
}
