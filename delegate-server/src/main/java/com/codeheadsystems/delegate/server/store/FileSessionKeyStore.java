package com.codeheadsystems.delegate.server.store;

import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyId;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link SessionKeyStore} writing one JSON document per record.
 * <p>
 * Layout: {@code <root>/<hex(accountId)>/<hex(keyId)>.json}. Identities are hex-encoded so any
 * identity string yields a safe file name.  Each write goes to a temporary file that is then
 * atomically moved over the target, so a crash never leaves a half-written record.
 * <p>
 * All records are read into memory at construction; reads are served from memory and every
 * write goes through to disk before the in-memory copy is updated. Writes to one record are
 * serialized on that record's monitor; writes to different records run in parallel.
 */
public class FileSessionKeyStore implements SessionKeyStore {

  private static final Logger log = LoggerFactory.getLogger(FileSessionKeyStore.class);
  private static final HexFormat HEX = HexFormat.of();
  private static final String SUFFIX = ".json";

  private final Path root;
  private final ObjectMapper objectMapper;
  private final SessionKeyIndex index = new SessionKeyIndex();
  private final ConcurrentHashMap<SessionKeyId, Object> monitors = new ConcurrentHashMap<>();

  /**
   * Instantiates a new File session key store.
   *
   * @param root the storage directory, created if missing
   */
  public FileSessionKeyStore(Path root) {
    this(root, new ObjectMapper());
  }

  /**
   * Instantiates a new File session key store.
   *
   * @param root         the storage directory, created if missing
   * @param objectMapper the object mapper
   * @throws UncheckedIOException if the directory cannot be created or an existing record cannot be read
   */
  public FileSessionKeyStore(Path root, ObjectMapper objectMapper) {
    this.root = root;
    this.objectMapper = objectMapper;
    try {
      Files.createDirectories(root);
      loadExisting();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to open session key storage at " + root, e);
    }
    log.info("Opened session key storage at {} with {} record(s)", root, index.size());
  }

  private void loadExisting() throws IOException {
    try (Stream<Path> accounts = Files.list(root)) {
      for (Path accountDir : accounts.filter(Files::isDirectory).toList()) {
        try (Stream<Path> files = Files.list(accountDir)) {
          for (Path file : files.filter(f -> f.getFileName().toString().endsWith(SUFFIX)).toList()) {
            StoredSessionKey stored = objectMapper.readValue(file.toFile(), StoredSessionKey.class);
            index.put(stored.toSessionKey());
          }
        }
      }
    }
  }

  @Override
  public Optional<SessionKey> load(SessionKeyId id) {
    return index.get(id);
  }

  @Override
  public boolean insert(SessionKey sessionKey) {
    synchronized (monitorFor(sessionKey.id())) {
      if (index.get(sessionKey.id()).isPresent()) {
        return false;
      }
      write(sessionKey);
      index.put(sessionKey);
    }
    log.debug("insert({})", sessionKey.id());
    return true;
  }

  @Override
  public void save(SessionKey sessionKey) {
    synchronized (monitorFor(sessionKey.id())) {
      if (index.get(sessionKey.id()).isEmpty()) {
        throw new IllegalStateException("No stored record for " + sessionKey.id());
      }
      write(sessionKey);
      index.replace(sessionKey);
    }
    log.debug("save({})", sessionKey.id());
  }

  @Override
  public List<SessionKey> loadAll(String accountId) {
    return index.all(accountId);
  }

  @Override
  public int size() {
    return index.size();
  }

  @Override
  public boolean isAvailable() {
    return Files.isDirectory(root) && Files.isWritable(root);
  }

  private Object monitorFor(SessionKeyId id) {
    return monitors.computeIfAbsent(id, k -> new Object());
  }

  private void write(SessionKey sessionKey) {
    Path dir = root.resolve(HEX.formatHex(sessionKey.accountId().getBytes(StandardCharsets.UTF_8)));
    Path target = dir.resolve(HEX.formatHex(sessionKey.keyId().getBytes(StandardCharsets.UTF_8)) + SUFFIX);
    try {
      Files.createDirectories(dir);
      Path tmp = Files.createTempFile(dir, "record", ".tmp");
      try {
        objectMapper.writeValue(tmp.toFile(), StoredSessionKey.from(sessionKey));
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to write session key " + sessionKey.id(), e);
    }
  }
}
