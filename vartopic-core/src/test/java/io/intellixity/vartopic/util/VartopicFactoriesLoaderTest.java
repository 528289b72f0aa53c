package io.intellixity.vartopic.util;

import io.intellixity.vartopic.types.DataTypeProvider;
import io.intellixity.vartopic.types.providers.BuiltinDataTypeProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class VartopicFactoriesLoaderTest {

  @Test
  void loadsRegisteredProviders() {
    List<DataTypeProvider> ps = VartopicFactoriesLoader.load(DataTypeProvider.class);
    assertTrue(ps.stream().anyMatch(p -> p instanceof BuiltinDataTypeProvider));
  }

  @Test
  void implementationNames_areTrimmedAndBlanksSkipped(@TempDir Path tmp) throws Exception {
    Path f = tmp.resolve("vartopic.factories");
    Files.writeString(f, "a.B= com.x.One , ,com.x.Two\nother=com.x.Three\n");

    assertEquals(List.of("com.x.One", "com.x.Two"), VartopicFactoriesLoader.implementationNames(f.toUri().toURL(), "a.B"));
    assertEquals(List.of(), VartopicFactoriesLoader.implementationNames(f.toUri().toURL(), "missing"));
  }

  @Test
  void duplicateRegistrations_instantiateOnce(@TempDir Path tmp) throws Exception {
    String line = DataTypeProvider.class.getName() + "=" + BuiltinDataTypeProvider.class.getName() + "\n";
    for (String dir : List.of("one", "two")) {
      Path meta = Files.createDirectories(tmp.resolve(dir).resolve("META-INF"));
      Files.writeString(meta.resolve("vartopic.factories"), line);
    }
    URL[] urls = {tmp.resolve("one").toUri().toURL(), tmp.resolve("two").toUri().toURL()};

    try (URLClassLoader cl = new URLClassLoader(urls, getClass().getClassLoader())) {
      List<DataTypeProvider> ps = VartopicFactoriesLoader.load(DataTypeProvider.class, cl);
      // the parent's own registration resolves to the same class name
      assertEquals(1, ps.size());
    }
  }

  @Test
  void nonImplementingClass_isRejected(@TempDir Path tmp) throws Exception {
    Path meta = Files.createDirectories(tmp.resolve("META-INF"));
    Files.writeString(meta.resolve("vartopic.factories"), DataTypeProvider.class.getName() + "=java.lang.String\n");

    try (URLClassLoader cl = new URLClassLoader(new URL[]{tmp.toUri().toURL()}, getClass().getClassLoader())) {
      assertThrows(IllegalArgumentException.class, () -> VartopicFactoriesLoader.load(DataTypeProvider.class, cl));
    }
  }
}
