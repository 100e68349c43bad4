package io.intellixity.typeset.types;

import java.util.Collection;
import java.util.Map;

/**
 * Contributes declared traits for named-type matching.
 *
 * Resolution semantics:
 * - Providers are discovered through {@code META-INF/typeset.factories}.
 * - A trait declared for a type also applies to its subtypes.
 * - Traits add to, never replace, the names a type already answers to.
 */
public interface CapabilityProvider {
  /** Declared traits, keyed by the type that carries them. */
  Map<Class<?>, Collection<String>> traits();
}
