package io.intellixity.vartopic.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.vartopic.error.VartopicException;
import io.intellixity.vartopic.pkg.PackagePathConfig;
import io.intellixity.vartopic.pkg.SearchPathPackageLocator;
import io.intellixity.vartopic.schema.SchemaIdentity;
import io.intellixity.vartopic.schema.SchemaIdentityLoader;
import io.intellixity.vartopic.types.DiscoveredDataTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI:
 *   DefinitionMain [--json] [--md5] [--path &lt;searchPath&gt;] &lt;typeId&gt;
 *
 * Prints the flattened definition of a schema. {@code --md5} prints the checksum first,
 * {@code --json} prints the whole identity as JSON. Without {@code --path} the package search
 * path comes from the environment.
 */
public final class DefinitionMain {
  private static final Logger log = LoggerFactory.getLogger(DefinitionMain.class);
  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  static final String USAGE = "Usage: DefinitionMain [--json] [--md5] [--path <searchPath>] <typeId>";

  private DefinitionMain() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Options opts = Options.parse(args);
    if (opts == null) {
      err.println(USAGE);
      return 2;
    }

    PackagePathConfig path = opts.path == null ? PackagePathConfig.fromEnvironment() : PackagePathConfig.parse(opts.path);
    SchemaIdentityLoader loader = SchemaIdentityLoader.create(new SearchPathPackageLocator(path), new DiscoveredDataTypeRegistry());

    SchemaIdentity identity;
    try {
      identity = loader.load(opts.typeId);
    } catch (VartopicException e) {
      log.debug("Resolution of {} failed", opts.typeId, e);
      err.println(e.getMessage());
      return 1;
    }
    if (!identity.isValid()) {
      err.println("Schema [" + opts.typeId + "] is empty");
      return 1;
    }

    if (opts.json) {
      try {
        out.println(JSON.writeValueAsString(identity));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Failed to JSON-encode " + identity, e);
      }
      return 0;
    }
    if (opts.md5) out.println(identity.getChecksum());
    out.print(identity.getDefinition());
    if (!identity.getDefinition().endsWith("\n")) out.println();
    return 0;
  }

  static final class Options {
    boolean json;
    boolean md5;
    String path;
    String typeId;

    /** Parsed options, or null on a usage error. */
    static Options parse(String[] args) {
      Options o = new Options();
      List<String> positional = new ArrayList<>();
      for (int i = 0; i < args.length; i++) {
        String a = args[i];
        switch (a) {
          case "--json" -> o.json = true;
          case "--md5" -> o.md5 = true;
          case "--path" -> {
            if (i + 1 >= args.length) return null;
            o.path = args[++i];
          }
          default -> {
            if (a.startsWith("--")) return null;
            positional.add(a);
          }
        }
      }
      if (positional.size() != 1) return null;
      o.typeId = positional.get(0);
      return o;
    }
  }
}
