package io.intellixity.typeset.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns each identity-bearing instance a token that is unique for the life of the registry.
 *
 * <p>Lookup is by reference identity, never by {@code equals}: two content-equal instances get
 * different tokens. Tokens are never reused.</p>
 *
 * <p>The registry is append-only and holds its instances strongly, so anything registered stays
 * reachable for as long as the registry does. Create a registry per unit of work (or per test)
 * where that matters.</p>
 */
public final class IdentityRegistry {
  private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

  private final Map<Object, Long> tokens = new IdentityHashMap<>();
  private long next = 1;

  /** Token of {@code instance}, minting one on first sight. */
  public synchronized long tokenFor(Object instance) {
    Objects.requireNonNull(instance, "instance");
    Long existing = tokens.get(instance);
    if (existing != null) return existing;
    long minted = next++;
    tokens.put(instance, minted);
    if (log.isTraceEnabled()) {
      log.trace("typeset.identity mint token={} type={}", minted, instance.getClass().getName());
    }
    return minted;
  }

  /** True if {@code instance} already has a token. Does not register it. */
  public synchronized boolean isRegistered(Object instance) {
    return instance != null && tokens.containsKey(instance);
  }

  public synchronized int size() {
    return tokens.size();
  }
}
