package io.intellixity.vartopic.schema.parse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link LineMatcher}. Trailing {@code #} comments are ignored.
 * <p>
 * An array size that does not fit an {@code int} is not a field declaration.
 */
public final class RegexLineMatcher implements LineMatcher {
  static final String TYPE = "[a-zA-Z][a-zA-Z0-9_]*(?:/[a-zA-Z][a-zA-Z0-9_]*)?";
  static final String NAME = "[a-zA-Z][a-zA-Z0-9_]*";

  private static final Pattern ARRAY = Pattern.compile("^(" + TYPE + ")\\[(\\d*)\\]\\s+(" + NAME + ")$");
  private static final Pattern SCALAR = Pattern.compile("^(" + TYPE + ")\\s+(" + NAME + ")$");

  @Override
  public Optional<FieldMatch> match(String line) {
    if (line == null) return Optional.empty();
    String code = stripComment(line).trim();
    if (code.isEmpty()) return Optional.empty();

    Matcher m = ARRAY.matcher(code);
    if (m.matches()) {
      String size = m.group(2);
      if (size.isEmpty()) return Optional.of(FieldMatch.array(m.group(1), m.group(3), 0));
      try {
        return Optional.of(FieldMatch.array(m.group(1), m.group(3), Integer.parseInt(size)));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    m = SCALAR.matcher(code);
    if (m.matches()) return Optional.of(FieldMatch.scalar(m.group(1), m.group(2)));
    return Optional.empty();
  }

  static String stripComment(String line) {
    int hash = line.indexOf('#');
    return hash < 0 ? line : line.substring(0, hash);
  }
}
