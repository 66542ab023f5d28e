package io.intellixity.resref.ref;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultResolverTableTest {

  @Test
  void exactCollectionBeatsWildcard() {
    DefaultResolverTable t = new DefaultResolverTable();
    t.setDefault("compute", DefaultResolverTable.WILDCARD, "zone", Resolver.literal("us-a"));
    t.setDefault("compute", "instances", "zone", Resolver.literal("eu-b"));

    assertEquals(Optional.of("eu-b"), t.lookup("compute", "instances", "zone"));
    assertEquals(Optional.of("us-a"), t.lookup("compute", "disks", "zone"));
    assertEquals(Optional.empty(), t.lookup("compute", "disks", "project"));
    assertEquals(Optional.empty(), t.lookup("storage", "buckets", "zone"));
  }

  @Test
  void nullCollectionIsWildcardAndIdsAreNormalized() {
    DefaultResolverTable t = new DefaultResolverTable();
    t.setDefault("compute", null, "project", Resolver.literal("p"));
    t.setDefault("compute", "compute.instances", "zone", Resolver.literal("z"));

    assertEquals(Optional.of("p"), t.lookup("compute", "instances", "project"));
    assertEquals(Optional.of("z"), t.lookup("compute", "instances", "zone"));
    assertTrue(t.getDefault("compute", "compute.instances", "zone").isPresent());
  }

  @Test
  void setOverwrites() {
    DefaultResolverTable t = new DefaultResolverTable();
    t.setDefault("svc", null, "project", Resolver.literal("a"));
    t.setDefault("svc", null, "project", Resolver.literal("b"));
    assertEquals(Optional.of("b"), t.lookup("svc", "things", "project"));
  }

  @Test
  void emptyResolverFallsThroughToNothing() {
    DefaultResolverTable t = new DefaultResolverTable();
    t.setDefault("svc", null, "project", Resolver.function(Optional::empty));
    assertTrue(t.getDefault("svc", "things", "project").isPresent());
    assertEquals(Optional.empty(), t.lookup("svc", "things", "project"));
  }

  @Test
  void blankKeysAreRejected() {
    DefaultResolverTable t = new DefaultResolverTable();
    assertThrows(IllegalArgumentException.class, () -> t.setDefault("", null, "p", Resolver.literal("x")));
    assertThrows(IllegalArgumentException.class, () -> t.setDefault("svc", null, " ", Resolver.literal("x")));
    assertThrows(IllegalArgumentException.class, () -> t.getDefault(null, null, "p"));
  }

  @Test
  void copyIsIndependent() {
    DefaultResolverTable t = new DefaultResolverTable();
    t.setDefault("svc", null, "project", Resolver.literal("a"));
    DefaultResolverTable copy = t.copy();
    copy.setDefault("svc", null, "project", Resolver.literal("b"));
    copy.setDefault("svc", null, "zone", Resolver.literal("z"));

    assertEquals(Optional.of("a"), t.lookup("svc", "x", "project"));
    assertEquals(Optional.empty(), t.lookup("svc", "x", "zone"));
    assertEquals(Optional.of("b"), copy.lookup("svc", "x", "project"));
  }
}
