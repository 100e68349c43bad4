package io.intellixity.typeset.collections;

import io.intellixity.typeset.keys.IdentityRegistry;
import io.intellixity.typeset.keys.KeyCodec;
import io.intellixity.typeset.types.TypeCapabilities;
import io.intellixity.typeset.types.TypeSet;

import java.util.Objects;

/**
 * Runtime shared by containers: the identity registry behind object keys, the codec over it, and
 * the capabilities used for named-type matching.
 *
 * <p>Containers that must agree on object-key identity must share a context. {@link #shared()} is
 * the process default; tests usually create their own.</p>
 */
public final class CollectionContext {
  private static final class Shared {
    static final CollectionContext INSTANCE =
        new CollectionContext(new IdentityRegistry(), TypeCapabilities.shared());
  }

  private final KeyCodec codec;
  private final TypeCapabilities capabilities;

  public CollectionContext(IdentityRegistry registry, TypeCapabilities capabilities) {
    this.codec = new KeyCodec(Objects.requireNonNull(registry, "registry"));
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  /** Fresh registry, process-wide capabilities. */
  public static CollectionContext isolated() {
    return new CollectionContext(new IdentityRegistry(), TypeCapabilities.shared());
  }

  public static CollectionContext shared() {
    return Shared.INSTANCE;
  }

  public KeyCodec codec() { return codec; }
  public IdentityRegistry registry() { return codec.registry(); }
  public TypeCapabilities capabilities() { return capabilities; }

  /** Empty (unconstrained) set bound to this context's capabilities. */
  public TypeSet types() {
    return new TypeSet(capabilities);
  }

  /** Parses {@code spec} into a set bound to this context's capabilities; null means unconstrained. */
  public TypeSet types(String spec) {
    TypeSet ts = types();
    return spec == null ? ts : ts.add(spec);
  }
}
