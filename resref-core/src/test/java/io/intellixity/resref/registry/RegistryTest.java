package io.intellixity.resref.registry;

import io.intellixity.resref.TestApis;
import io.intellixity.resref.catalog.InMemoryApiCatalog;
import io.intellixity.resref.config.RegistryConfig;
import io.intellixity.resref.error.AmbiguousAPIException;
import io.intellixity.resref.error.AmbiguousResourcePathException;
import io.intellixity.resref.error.InvalidEndpointException;
import io.intellixity.resref.error.InvalidResourceException;
import io.intellixity.resref.error.MalformedSchemaException;
import io.intellixity.resref.error.UnknownCollectionException;
import io.intellixity.resref.error.UnknownFieldException;
import io.intellixity.resref.error.WrongFieldNumberException;
import io.intellixity.resref.error.WrongResourceCollectionException;
import io.intellixity.resref.ref.Reference;
import io.intellixity.resref.ref.Resolver;
import io.intellixity.resref.schema.ApiDefinition;
import io.intellixity.resref.schema.ApiVersion;
import io.intellixity.resref.schema.CollectionSchema;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RegistryTest {
  private static final String WIDGETS = "svc.projects.widgets";
  private static final String WIDGET_URL = "https://svc.googleapis.com/v1/projects/myproj/widgets/mywidget";

  private static Registry registry() {
    return new Registry(TestApis.catalog(), RegistryConfig.defaults());
  }

  @Test
  void parsesFullCollectionPath() {
    Reference ref = registry().parse("myproj/mywidget", Map.of(), WIDGETS);
    assertEquals(WIDGETS, ref.collection());
    assertEquals("svc", ref.api());
    assertEquals("v1", ref.version());
    assertEquals("myproj", ref.get("project"));
    assertEquals("mywidget", ref.get("widget"));
    assertEquals("mywidget", ref.name());
    assertEquals(WIDGET_URL, ref.selfLink());
  }

  @Test
  void leadingSlashAndCollectionPrefixAreAccepted() {
    Registry r = registry();
    assertEquals(WIDGET_URL, r.parse("/myproj/mywidget", Map.of(), WIDGETS).selfLink());
    assertEquals(WIDGET_URL, r.parse("svc.projects.widgets::myproj/mywidget").selfLink());
  }

  @Test
  void contextFillsMissingLeadingField() {
    Reference ref = registry().parse("mywidget", Map.of("project", Resolver.literal("ctx-proj")), WIDGETS, true, false);
    ref.weakResolve();
    assertEquals("ctx-proj", ref.get("project"));
    assertEquals("mywidget", ref.get("widget"));
  }

  @Test
  void urlAndCollectionPathGiveEqualReferences() {
    Registry r = registry();
    Reference fromPath = r.parse("myproj/mywidget", Map.of(), WIDGETS);
    Reference fromUrl = r.parse(WIDGET_URL);

    assertEquals(WIDGETS, fromUrl.collection());
    assertEquals(Map.of("project", "myproj", "widget", "mywidget"), fromUrl.params());
    assertEquals("https://svc.googleapis.com/v1/", fromUrl.endpointUrl());
    assertEquals(fromPath, fromUrl);
    assertEquals(fromPath.hashCode(), fromUrl.hashCode());
    assertEquals(WIDGET_URL, fromUrl.toString());
  }

  @Test
  void secondApiClaimingSameCollectionIsRejected() {
    Registry r = new Registry(InMemoryApiCatalog.of(), RegistryConfig.defaults());
    r.registerSchema(TestApis.svcV1().collections().get(1));

    CollectionSchema other = new CollectionSchema(new ApiVersion("other", "v1"), WIDGETS,
        List.of("project", "widget"), "projects/{project}/widgets/{widget}", "https://other.googleapis.com/v1/");
    assertThrows(AmbiguousAPIException.class, () -> r.registerSchema(other));
  }

  @Test
  void catalogApiClaimingRegisteredCollectionIsRejected() {
    ApiDefinition other = ApiDefinition.builder("other", "v1")
        .defaultVersion(true)
        .baseUrl("https://other.googleapis.com/v1/")
        .schema(WIDGETS, "projects/{project}/widgets/{widget}", List.of("project", "widget"))
        .build();
    Registry r = new Registry(InMemoryApiCatalog.of(TestApis.svcV1(), other), RegistryConfig.defaults());
    r.parse("p/w", Map.of(), WIDGETS);

    AmbiguousAPIException e = assertThrows(AmbiguousAPIException.class, () -> r.registerApi("other", null));
    assertTrue(e.getMessage().contains(WIDGETS));
  }

  @Test
  void rejectedApiIsNotHalfRegistered() {
    ApiDefinition other = ApiDefinition.builder("other", "v1")
        .defaultVersion(true)
        .baseUrl("https://other.googleapis.com/v1/")
        .collection("things", "things/{thing}", "thing")
        .schema(WIDGETS, "projects/{project}/widgets/{widget}", List.of("project", "widget"))
        .build();
    Registry r = new Registry(InMemoryApiCatalog.of(TestApis.svcV1(), other), RegistryConfig.defaults());
    r.parse("p/w", Map.of(), WIDGETS);

    assertThrows(AmbiguousAPIException.class, () -> r.registerApi("other", null));
    assertFalse(r.knownApis().contains(new ApiVersion("other", "v1")));
    // still unregistered, so the next use tries again and fails the same way
    assertThrows(AmbiguousAPIException.class, () -> r.parse("other.things::t"));
    assertEquals("svc", r.parse("p/w", Map.of(), WIDGETS).api());
  }

  @Test
  void referenceStaysFindableInHashSetAfterDefaultsChange() {
    Registry r = registry();
    Reference ref = r.parse("w", Map.of(), WIDGETS, true, false);
    Set<Reference> seen = new HashSet<>();
    seen.add(ref);

    r.setDefault("svc", null, "project", Resolver.literal("p"));
    assertTrue(seen.contains(ref));
    assertNull(ref.get("project"));
  }

  @Test
  void twoCollectionsOnOneUrlShapeAreRejected() {
    Registry r = new Registry(InMemoryApiCatalog.of(), RegistryConfig.defaults());
    ApiVersion svc = new ApiVersion("svc", "v1");
    String base = "https://svc.googleapis.com/v1/";
    r.registerSchema(new CollectionSchema(svc, WIDGETS, List.of("project", "widget"),
        "projects/{project}/widgets/{widget}", base));

    assertThrows(AmbiguousResourcePathException.class, () -> r.registerSchema(new CollectionSchema(svc,
        "svc.projects.things", List.of("project", "widget"), "projects/{project}/widgets/{widget}", base)));
    assertThrows(MalformedSchemaException.class, () -> r.registerSchema(new CollectionSchema(svc,
        "svc.projects.others", List.of("project", "other"), "projects/{project}/{other}", base)));
    // rejected schemas are not half-registered
    assertThrows(UnknownCollectionException.class, () -> r.parse("p/x", Map.of(), "svc.projects.things"));
  }

  @Test
  void missingFieldIsReportedByName() {
    Reference ref = registry().parse("mywidget", Map.of(), WIDGETS, true, false);
    UnknownFieldException e = assertThrows(UnknownFieldException.class, ref::name);
    assertEquals("project", e.field());
    assertThrows(UnknownFieldException.class, ref::selfLink);
    assertThrows(UnknownFieldException.class, () -> registry().parse("mywidget", Map.of(), WIDGETS));
  }

  @Test
  void weakSelfLinkUsesWildcardForMissingFields() {
    Reference ref = registry().parse("mywidget", Map.of(), WIDGETS, true, false);
    assertEquals("https://svc.googleapis.com/v1/projects/*/widgets/mywidget", ref.weakSelfLink());
    assertNull(ref.get("project"));
    assertEquals(ref.weakSelfLink(), ref.toString());
  }

  @Test
  void weakResolveIsIdempotentAndEvaluatesContextOnce() {
    AtomicInteger calls = new AtomicInteger();
    Resolver project = Resolver.function(() -> {
      calls.incrementAndGet();
      return Optional.of("fn-proj");
    });
    Reference ref = registry().parse("w", Map.of("project", project), WIDGETS, true, false);

    String first = ref.weakSelfLink();
    String second = ref.weakSelfLink();
    assertEquals(first, second);
    assertEquals("https://svc.googleapis.com/v1/projects/fn-proj/widgets/w", second);
    assertEquals(1, calls.get());
  }

  @Test
  void defaultsApplyAfterContext() {
    Registry r = registry();
    r.setDefault("svc", null, "project", Resolver.literal("wild"));
    r.setDefault("svc", "projects.widgets", "project", Resolver.literal("specific"));

    assertEquals("specific", r.parse("w", Map.of(), WIDGETS).get("project"));
    assertEquals("wild", r.parse("z/g", Map.of(), "svc.projects.zones.gadgets").get("project"));
    assertEquals("ctx", r.parse("w", Map.of("project", Resolver.literal("ctx")), WIDGETS).get("project"));
    assertTrue(r.getDefault("svc", WIDGETS, "project").isPresent());
    assertTrue(r.getDefault("svc", "projects.widgets", "zone").isEmpty());
  }

  @Test
  void createRoundTripsThroughSelfLink() {
    Registry r = registry();
    Map<String, String> params = Map.of("project", "p", "zone", "z", "gadget", "g");
    Reference created = r.create("svc.projects.zones.gadgets", params);
    assertEquals("https://svc.googleapis.com/v1/projects/p/zones/z/gadgets/g", created.selfLink());
    assertEquals("projects/p/zones/z/gadgets/g", created.relativeName());

    Reference parsed = r.parseUrl(created.selfLink());
    assertEquals(params, parsed.params());
    assertEquals(created, parsed);
  }

  @Test
  void encodedTerminalValueRoundTrips() {
    Registry r = registry();
    Reference created = r.create(WIDGETS, Map.of("project", "p", "widget", "a/b c"));
    assertEquals("https://svc.googleapis.com/v1/projects/p/widgets/a%2Fb%20c", created.selfLink());
    assertEquals("a/b c", r.parseUrl(created.selfLink()).get("widget"));
  }

  @Test
  void reservedTerminalKeepsSlashes() {
    Registry r = registry();
    Reference created = r.create("files.folders.entries", Map.of("folder", "f", "entry", "x/y.txt"));
    assertEquals("https://files.googleapis.com/v1/folders/f/entries/x/y.txt", created.selfLink());
    assertEquals("x/y.txt", r.parse(created.selfLink()).get("entry"));
  }

  @Test
  void unquotedApisKeepLinksReadable() {
    Registry r = registry();
    Reference ref = r.create("compute.instances", Map.of("project", "p", "zone", "z", "instance", "a b"));
    assertEquals("https://www.googleapis.com/compute/v1/projects/p/zones/z/instances/a b", ref.selfLink());
  }

  @Test
  void parsesPathStyleUrlOnNonCanonicalHost() {
    Reference ref = registry().parse("https://www.googleapis.com/compute/v1/projects/p/zones/z/instances/i");
    assertEquals("compute.instances", ref.collection());
    assertEquals("i", ref.name());
    assertEquals("https://www.googleapis.com/compute/v1/", ref.endpointUrl());
  }

  @Test
  void urlWithoutVersionUsesDefaultVersion() {
    Reference ref = registry().parse("https://svc.googleapis.com/projects/p/widgets/w");
    assertEquals("v1", ref.version());
    assertEquals("https://svc.googleapis.com/projects/p/widgets/w", ref.selfLink());
  }

  @Test
  void wrongFieldCounts() {
    Registry r = registry();
    WrongFieldNumberException e = assertThrows(WrongFieldNumberException.class,
        () -> r.parse("a/b/c", Map.of(), WIDGETS));
    assertTrue(e.getMessage().contains("WIDGET, /PROJECT/WIDGET"));
    assertThrows(WrongFieldNumberException.class, () -> r.parse("/p", Map.of(), WIDGETS));
    assertThrows(WrongFieldNumberException.class, () -> r.parse("p//g", Map.of(), "svc.projects.zones.gadgets"));

    Reference partial = r.parse("z/g", Map.of(), "svc.projects.zones.gadgets", true, false);
    assertNull(partial.get("project"));
    assertEquals("z", partial.get("zone"));
  }

  @Test
  void collectionMismatches() {
    Registry r = registry();
    WrongResourceCollectionException e = assertThrows(WrongResourceCollectionException.class,
        () -> r.parse(WIDGET_URL, Map.of(), "svc.projects"));
    assertEquals("svc.projects", e.expected());
    assertEquals(WIDGETS, e.got());
    assertEquals(WIDGETS, r.parse(WIDGET_URL, Map.of(), "svc.projects", false, true).collection());

    assertThrows(WrongResourceCollectionException.class, () -> r.parse("svc.projects::p", Map.of(), WIDGETS));
  }

  @Test
  void unknownCollections() {
    Registry r = registry();
    assertThrows(UnknownCollectionException.class, () -> r.parse("p/w"));
    assertThrows(UnknownCollectionException.class, () -> r.parse(null));
    assertThrows(UnknownCollectionException.class, () -> r.parse("svc.nope::x"));
    assertThrows(UnknownCollectionException.class, () -> r.parse("nope.things::x"));
  }

  @Test
  void unparseableUrls() {
    Registry r = registry();
    assertThrows(InvalidEndpointException.class, () -> r.parseUrl("ftp://svc.googleapis.com/v1/projects/p"));
    assertThrows(InvalidResourceException.class, () -> r.parse("https://nope.googleapis.com/v1/x/y"));
    assertThrows(InvalidResourceException.class, () -> r.parse("https://svc.googleapis.com/v9/projects/p"));
    assertThrows(InvalidResourceException.class,
        () -> r.parse("https://svc.googleapis.com/v1/projects/p/unknown/x"));
    assertThrows(InvalidResourceException.class, () -> r.parse("https://svc.googleapis.com/v1/projects//widgets/w"));
  }

  @Test
  void apisAreRegisteredOnFirstUse() {
    Registry r = registry();
    assertTrue(r.knownApis().isEmpty());
    r.parse("p/w", Map.of(), WIDGETS);
    assertEquals(Set.of(new ApiVersion("svc", "v1")), r.knownApis());
  }

  @Test
  void defaultConstructorLoadsClasspathConfig() {
    Registry r = new Registry(TestApis.catalog());
    assertEquals(Optional.of("v2"), r.config().versionOverride("demo"));
    assertEquals("v1", r.parse("p/w", Map.of(), WIDGETS).version());
  }

  @Test
  void versionOverrideSelectsRegisteredVersion() {
    Registry r = new Registry(TestApis.catalog(), RegistryConfig.defaults().withVersionOverride("svc", "v2"));
    Reference ref = r.parse("p/w", Map.of(), WIDGETS);
    assertEquals("v2", ref.version());
    assertEquals("https://svc.googleapis.com/v2/projects/p/widgets/w", ref.selfLink());
    assertThrows(UnknownCollectionException.class, () -> r.parse("p", Map.of(), "svc.projects"));
  }

  @Test
  void endpointOverrideAppliesToPathsAndUrls() {
    String local = "http://localhost:8080/svc/v1/";
    Registry r = new Registry(TestApis.catalog(), RegistryConfig.defaults().withEndpointOverride("svc", local));

    Reference fromPath = r.parse("p/w", Map.of(), WIDGETS);
    assertEquals(local + "projects/p/widgets/w", fromPath.selfLink());

    Reference fromUrl = r.parse(local + "projects/p/widgets/w");
    assertEquals(WIDGETS, fromUrl.collection());
    assertEquals(local, fromUrl.endpointUrl());
    assertEquals(fromPath, fromUrl);
  }
}
