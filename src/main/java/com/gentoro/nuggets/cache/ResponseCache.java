package com.gentoro.nuggets.cache;

import com.gentoro.nuggets.exception.NuggetsErrorCode;
import com.gentoro.nuggets.exception.NuggetsException;
import com.gentoro.nuggets.model.NuggetType;
import com.gentoro.nuggets.model.RawCandidate;
import com.gentoro.nuggets.similarity.TextNormalizer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bounded cache of provider responses keyed by content, prompt and requested types.
 *
 * <p>Entries expire after a fixed time-to-live and are evicted oldest-by-insertion once the
 * capacity is exceeded. All operations run under one lock.
 */
public class ResponseCache {
  private static final org.slf4j.Logger log =
      com.gentoro.nuggets.logging.LoggingService.getLogger(ResponseCache.class);

  public static final int DEFAULT_CAPACITY = 10;
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

  /** Cached provider answer. */
  public record Entry(List<RawCandidate> candidates, String providerId, Instant storedAt) {
    public Entry {
      candidates = List.copyOf(candidates);
    }
  }

  private final int capacity;
  private final Duration ttl;
  private final Clock clock;
  private final Object lock = new Object();
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

  public ResponseCache() {
    this(DEFAULT_CAPACITY, DEFAULT_TTL, Clock.systemUTC());
  }

  public ResponseCache(int capacity, Duration ttl, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    this.capacity = capacity;
    this.ttl = ttl;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** SHA-256 hex of the normalized content, the prompt and the sorted type names. */
  public static String key(String content, String prompt, Collection<NuggetType> types) {
    EnumSet<NuggetType> selected =
        types == null || types.isEmpty() ? EnumSet.allOf(NuggetType.class) : EnumSet.copyOf(types);
    String raw =
        TextNormalizer.normalize(content)
            + "\u0000"
            + Objects.requireNonNullElse(prompt, "")
            + "\u0000"
            + selected.stream().map(NuggetType::wireName).collect(Collectors.joining(","));
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
      StringBuilder hexString = new StringBuilder();
      for (byte b : hash) {
        String hex = Integer.toHexString(0xff & b);
        if (hex.length() == 1) {
          hexString.append('0');
        }
        hexString.append(hex);
      }
      return hexString.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new NuggetsException(
          NuggetsErrorCode.FAILED_PRECONDITION, "SHA-256 algorithm not available", e);
    }
  }

  /** The live entry for {@code key}; an expired entry is removed and reported as absent. */
  public Optional<Entry> get(String key) {
    synchronized (lock) {
      Entry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (isExpired(entry)) {
        entries.remove(key);
        log.debug("Cache entry expired: {}", key);
        return Optional.empty();
      }
      return Optional.of(entry);
    }
  }

  /** Stores an entry, replacing any previous one, and evicts the oldest entries beyond capacity. */
  public void put(String key, List<RawCandidate> candidates, String providerId) {
    Objects.requireNonNull(key, "key");
    synchronized (lock) {
      entries.remove(key);
      entries.put(key, new Entry(candidates, providerId, clock.instant()));
      while (entries.size() > capacity) {
        evictOldest();
      }
    }
  }

  /** Removes the entry inserted first. Returns its key, or empty when the cache is empty. */
  public Optional<String> evictOldest() {
    synchronized (lock) {
      Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
      if (!it.hasNext()) {
        return Optional.empty();
      }
      String oldest = it.next().getKey();
      it.remove();
      log.debug("Evicted oldest cache entry: {}", oldest);
      return Optional.of(oldest);
    }
  }

  /** Drops expired entries. Returns how many were removed. */
  public int purgeExpired() {
    synchronized (lock) {
      int before = entries.size();
      entries.values().removeIf(this::isExpired);
      return before - entries.size();
    }
  }

  public int size() {
    synchronized (lock) {
      return entries.size();
    }
  }

  public void clear() {
    synchronized (lock) {
      entries.clear();
    }
  }

  private boolean isExpired(Entry entry) {
    return !clock.instant().isBefore(entry.storedAt().plus(ttl));
  }
}
