package io.intellixity.typeset.types;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class TypeTagsTest {

  static final class Task implements Runnable {
    @Override public void run() {}
  }

  @FunctionalInterface
  interface Handler {
    void handle(String event);
  }

  @Test
  void basicOf_scalars() {
    assertEquals(BuiltinType.NULL, TypeTags.basicOf(null));
    assertEquals(BuiltinType.BOOL, TypeTags.basicOf(false));
    assertEquals(BuiltinType.INT, TypeTags.basicOf(1));
    assertEquals(BuiltinType.INT, TypeTags.basicOf(1L));
    assertEquals(BuiltinType.INT, TypeTags.basicOf((short) 1));
    assertEquals(BuiltinType.INT, TypeTags.basicOf((byte) 1));
    assertEquals(BuiltinType.INT, TypeTags.basicOf(BigInteger.TEN));
    assertEquals(BuiltinType.FLOAT, TypeTags.basicOf(1.0));
    assertEquals(BuiltinType.FLOAT, TypeTags.basicOf(1.0f));
    assertEquals(BuiltinType.TEXT, TypeTags.basicOf(""));
    assertEquals(BuiltinType.TEXT, TypeTags.basicOf('x'));
  }

  @Test
  void basicOf_composites() {
    assertEquals(BuiltinType.COMPOSITE, TypeTags.basicOf(List.of()));
    assertEquals(BuiltinType.COMPOSITE, TypeTags.basicOf(Map.of()));
    assertEquals(BuiltinType.COMPOSITE, TypeTags.basicOf(new int[0]));
    assertEquals(BuiltinType.COMPOSITE, TypeTags.basicOf(new String[] {"a"}));
  }

  @Test
  void basicOf_identityBearing() {
    assertEquals(BuiltinType.HANDLE, TypeTags.basicOf(new ByteArrayInputStream(new byte[0])));
    assertEquals(BuiltinType.CALLABLE, TypeTags.basicOf(new Task()));
    assertEquals(BuiltinType.CALLABLE, TypeTags.basicOf((Callable<Integer>) () -> 1));
    assertEquals(BuiltinType.CALLABLE, TypeTags.basicOf((Supplier<String>) () -> "x"));
    assertEquals(BuiltinType.CALLABLE, TypeTags.basicOf((Handler) e -> {}));
    assertEquals(BuiltinType.OBJECT, TypeTags.basicOf(new Object()));
    assertEquals(BuiltinType.OBJECT, TypeTags.basicOf(LocalDate.of(2024, 1, 1)));
  }

  @Test
  void basicOf_neverReturnsPseudoTag() {
    for (Object v : new Object[] {null, 1, 1.0, "s", true, List.of(), new Object(), new Task()}) {
      assertFalse(TypeTags.basicOf(v).pseudo(), String.valueOf(v));
    }
  }

  @Test
  void describe_namesClassForIdentityBearingValues() {
    assertEquals("int", TypeTags.describe(5L));
    assertEquals("null", TypeTags.describe(null));
    assertEquals("array", TypeTags.describe(List.of(1)));
    assertEquals("object(java.lang.Object)", TypeTags.describe(new Object()));
    assertEquals("handle(java.io.ByteArrayInputStream)", TypeTags.describe(new ByteArrayInputStream(new byte[0])));
  }

  @Test
  void builtinKeywords() {
    assertEquals(BuiltinType.INT, BuiltinType.forKeyword("Integer"));
    assertEquals(BuiltinType.MIXED, BuiltinType.forKeyword("ANY"));
    assertNull(BuiltinType.forKeyword("LocalDate"));
    assertNull(BuiltinType.forKeyword(null));
    assertTrue(BuiltinType.SCALAR.pseudo());
    assertFalse(BuiltinType.OBJECT.pseudo());
    assertEquals("string", BuiltinType.TEXT.toString());
  }
}
