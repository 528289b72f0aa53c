package io.intellixity.vartopic.schema;

import io.intellixity.vartopic.error.ChecksumMismatchException;
import io.intellixity.vartopic.pkg.PackageLocator;
import io.intellixity.vartopic.pkg.PackagePathConfig;
import io.intellixity.vartopic.pkg.SearchPathPackageLocator;
import io.intellixity.vartopic.schema.checksum.ChecksumCalculator;
import io.intellixity.vartopic.schema.checksum.Md5SumCalculator;
import io.intellixity.vartopic.schema.parse.LineMatcher;
import io.intellixity.vartopic.schema.parse.MessageDefinitionParser;
import io.intellixity.vartopic.schema.parse.RegexLineMatcher;
import io.intellixity.vartopic.types.DataTypeRegistry;
import io.intellixity.vartopic.types.DiscoveredDataTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves schemas and fills in their checksum.
 * <p>
 * An unresolved (empty) schema keeps the wildcard checksum.
 */
public final class SchemaIdentityLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaIdentityLoader.class);

  private final DefinitionResolver resolver;
  private final ChecksumCalculator checksums;

  public SchemaIdentityLoader(DefinitionResolver resolver, ChecksumCalculator checksums) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.checksums = Objects.requireNonNull(checksums, "checksums");
  }

  /** Loader over the configured package path, discovered data types and MD5 checksums. */
  public static SchemaIdentityLoader fromEnvironment() {
    return create(new SearchPathPackageLocator(PackagePathConfig.fromEnvironment()), new DiscoveredDataTypeRegistry());
  }

  public static SchemaIdentityLoader create(PackageLocator packages, DataTypeRegistry types) {
    LineMatcher matcher = new RegexLineMatcher();
    DefinitionResolver resolver = new DefinitionResolver(packages, matcher, types);
    Md5SumCalculator md5 = new Md5SumCalculator(new MessageDefinitionParser(matcher, types), types, resolver::read);
    return new SchemaIdentityLoader(resolver, md5);
  }

  public SchemaIdentity load(String typeId) {
    SchemaIdentity identity = resolver.resolve(typeId);
    if (!identity.getDefinition().isEmpty()) {
      identity.setChecksum(checksums.compute(identity));
    }
    return identity;
  }

  /**
   * Loads {@code typeId} and checks its checksum against {@code expectedChecksum};
   * the wildcard accepts any checksum.
   */
  public SchemaIdentity load(String typeId, String expectedChecksum) {
    SchemaIdentity identity = load(typeId);
    if (expectedChecksum != null && !SchemaIdentity.ANY_CHECKSUM.equals(expectedChecksum)
        && !expectedChecksum.equals(identity.getChecksum())) {
      log.warn("Checksum of {} is {}, expected {}", typeId, identity.getChecksum(), expectedChecksum);
      throw new ChecksumMismatchException(expectedChecksum, identity.getChecksum());
    }
    return identity;
  }

  public DefinitionResolver resolver() { return resolver; }
}
