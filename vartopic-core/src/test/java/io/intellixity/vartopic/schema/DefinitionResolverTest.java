package io.intellixity.vartopic.schema;

import io.intellixity.vartopic.TestSchemas;
import io.intellixity.vartopic.error.FileOpenException;
import io.intellixity.vartopic.error.InvalidDataTypeException;
import io.intellixity.vartopic.error.InvalidMessageTypeException;
import io.intellixity.vartopic.error.PackageNotFoundException;
import io.intellixity.vartopic.pkg.PackageLocator;
import io.intellixity.vartopic.pkg.SearchPathPackageLocator;
import io.intellixity.vartopic.schema.parse.RegexLineMatcher;
import io.intellixity.vartopic.types.DataType;
import io.intellixity.vartopic.types.DataTypeRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefinitionResolverTest {
  private static final String RULE = "=".repeat(80);

  private static DefinitionResolver resolver() {
    return new DefinitionResolver(TestSchemas.packages(), new RegexLineMatcher(), TestSchemas.builtins());
  }

  private static String raw(String pkg, String type) throws IOException {
    return Files.readString(TestSchemas.shareDir().resolve(pkg).resolve("msg").resolve(type + ".msg"), StandardCharsets.UTF_8);
  }

  @Test
  void schemaWithoutDependencies_isReturnedVerbatim() throws Exception {
    SchemaIdentity s = resolver().resolve("geometry_msgs/Point");

    assertEquals("geometry_msgs/Point", s.getTypeId());
    assertEquals(raw("geometry_msgs", "Point"), s.getDefinition());
    assertEquals(SchemaIdentity.ANY_CHECKSUM, s.getChecksum());
    assertTrue(s.isValid());
  }

  @Test
  void nestedSchemas_areInlinedAfterRule() throws Exception {
    SchemaIdentity s = resolver().resolve("geometry_msgs/PointStamped");

    String expected = raw("geometry_msgs", "PointStamped")
        + "\n" + RULE + "\nMSG: std_msgs/Header\n" + raw("std_msgs", "Header")
        + "\n" + RULE + "\nMSG: geometry_msgs/Point\n" + raw("geometry_msgs", "Point");
    assertEquals(expected, s.getDefinition());
  }

  @Test
  void dependencies_appearInBreadthFirstDiscoveryOrder() {
    SchemaIdentity s = resolver().resolve("demo_msgs/Root");

    assertEquals(List.of("demo_msgs/Root", "std_msgs/Header", "demo_msgs/B", "demo_msgs/A", "demo_msgs/C"),
        markers("demo_msgs/Root", s.getDefinition()));
  }

  @Test
  void sharedDependencies_areInlinedOnce() {
    SchemaIdentity s = resolver().resolve("demo_msgs/Root");

    // C is reached through A and B, B directly and through A
    Map<String, String> sections = FlattenedDefinitions.split(s);
    assertEquals(5, sections.size());
    assertEquals(1, count(s.getDefinition(), "MSG: demo_msgs/C\n"));
    assertEquals(1, count(s.getDefinition(), "MSG: demo_msgs/B\n"));
  }

  @Test
  void resolution_isDeterministic() {
    DefinitionResolver r = resolver();
    String first = r.resolve("demo_msgs/Root").getDefinition();
    for (int i = 0; i < 5; i++) {
      assertEquals(first, r.resolve("demo_msgs/Root").getDefinition());
    }
  }

  @Test
  void bareHeaderRoot_resolvesFromBasePackage() throws Exception {
    SchemaIdentity s = resolver().resolve("Header");

    assertEquals("Header", s.getTypeId());
    assertEquals(raw("std_msgs", "Header"), s.getDefinition());
  }

  @Test
  void bareTypeOtherThanHeader_isRejected() {
    InvalidMessageTypeException ex = assertThrows(InvalidMessageTypeException.class, () -> resolver().resolve("bareType"));
    assertEquals("bareType", ex.messageType());
  }

  @Test
  void bareNestedReference_isRejected() {
    InvalidMessageTypeException ex = assertThrows(InvalidMessageTypeException.class, () -> resolver().resolve("demo_msgs/Bare"));
    assertEquals("Point", ex.messageType());
  }

  @Test
  void emptyLocalType_isInvalidDataType() {
    assertThrows(InvalidDataTypeException.class, () -> resolver().resolve("demo_msgs/"));
  }

  @Test
  void unknownPackage_fails() {
    PackageNotFoundException ex = assertThrows(PackageNotFoundException.class, () -> resolver().resolve("missingPkg/Foo"));
    assertEquals("missingPkg", ex.packageName());
  }

  @Test
  void unknownNestedPackage_failsWholeResolution() {
    PackageNotFoundException ex = assertThrows(PackageNotFoundException.class,
        () -> resolver().resolve("demo_msgs/ForeignPackage"));
    assertEquals("missing_msgs", ex.packageName());
  }

  @Test
  void missingSchemaFile_fails() {
    FileOpenException ex = assertThrows(FileOpenException.class, () -> resolver().resolve("demo_msgs/Dangling"));
    assertTrue(ex.filename().endsWith("Nope.msg"), ex.filename());
  }

  @Test
  void emptySchema_yieldsUnresolvedIdentity() {
    SchemaIdentity s = resolver().resolve("std_msgs/Empty");

    assertEquals("", s.getTypeId());
    assertEquals("", s.getDefinition());
    assertFalse(s.isValid());
  }

  @Test
  void emptyDependency_contributesNoSection() throws Exception {
    SchemaIdentity s = resolver().resolve("demo_msgs/WithEmpty");

    assertEquals("demo_msgs/WithEmpty", s.getTypeId());
    assertEquals(raw("demo_msgs", "WithEmpty"), s.getDefinition());
  }

  @Test
  void builtinCheck_usesInjectedRegistry() {
    // a registry that treats demo_msgs/C as primitive stops expansion there
    DataTypeRegistry builtins = TestSchemas.builtins();
    DataTypeRegistry fake = new DataTypeRegistry() {
      @Override public Optional<DataType<?>> find(String typeId) { return builtins.find(typeId); }
      @Override public boolean isBuiltin(String typeId) { return "demo_msgs/C".equals(typeId) || builtins.isBuiltin(typeId); }
    };
    DefinitionResolver r = new DefinitionResolver(TestSchemas.packages(), new RegexLineMatcher(), fake);

    assertEquals(List.of("demo_msgs/Root", "std_msgs/Header", "demo_msgs/B", "demo_msgs/A"),
        markers("demo_msgs/Root", r.resolve("demo_msgs/Root").getDefinition()));
  }

  @Test
  void lineMatcher_isConsultedPerLine() {
    List<String> seen = new ArrayList<>();
    PackageLocator packages = TestSchemas.packages();
    DefinitionResolver r = new DefinitionResolver(packages, line -> {
      seen.add(line);
      return Optional.empty();
    }, TestSchemas.builtins());

    SchemaIdentity s = r.resolve("demo_msgs/A");

    assertTrue(seen.contains("demo_msgs/C c"));
    assertEquals("demo_msgs/A", s.getTypeId());
    assertEquals(1, FlattenedDefinitions.split(s).size());
  }

  @Test
  void oversizedArraySize_doesNotEscapeAsNumberFormatError(@TempDir Path dir) throws Exception {
    String text = "int32[99999999999] xs\n";
    write(dir, "p", "Big", text.getBytes(StandardCharsets.UTF_8));

    SchemaIdentity s = inTree(dir).resolve("p/Big");

    assertEquals("p/Big", s.getTypeId());
    assertEquals(text, s.getDefinition());
  }

  @Test
  void nonUtf8Comment_isReadNotRejected(@TempDir Path dir) throws Exception {
    write(dir, "p", "Temp", "# temperature in \u00b0C\nfloat64 t\n".getBytes(StandardCharsets.ISO_8859_1));

    SchemaIdentity s = inTree(dir).resolve("p/Temp");

    assertEquals("p/Temp", s.getTypeId());
    assertTrue(s.getDefinition().startsWith("# temperature in "));
    assertTrue(s.getDefinition().endsWith("C\nfloat64 t\n"));
  }

  @Test
  void schemaFile_isUnderMsgDirectory() {
    Path p = resolver().schemaFile("geometry_msgs/Point");
    assertEquals(TestSchemas.shareDir().resolve("geometry_msgs/msg/Point.msg"), p);
  }

  private static DefinitionResolver inTree(Path root) {
    return new DefinitionResolver(new SearchPathPackageLocator(List.of(root)), new RegexLineMatcher(), TestSchemas.builtins());
  }

  private static void write(Path root, String pkg, String type, byte[] content) throws IOException {
    Path msg = Files.createDirectories(root.resolve(pkg).resolve("msg"));
    Files.write(msg.resolve(type + ".msg"), content);
  }

  private static List<String> markers(String root, String definition) {
    return new ArrayList<>(FlattenedDefinitions.split(root, definition).keySet());
  }

  private static int count(String haystack, String needle) {
    int n = 0;
    for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) n++;
    return n;
  }
}
