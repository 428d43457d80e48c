package bytedfa.parser;

import bytedfa.util.IntRangeSet;
import java.util.Optional;

/**
 * Source of Unicode property data beyond what {@code java.lang.Character}
 * knows about.
 *
 * <p>Consulted by the parser before the built-in general category, script,
 * and block lookups for {@code \p{name}} and {@code \p{name=value}}.
 */
public interface PropertyResolver {

  /**
   * Code points with an enumerated property value, as in {@code \p{gcb=Extend}}.
   *
   * @param property property name or alias
   * @param value property value name or alias
   * @return code points, or empty if the property is unknown to this resolver
   * @throws IllegalArgumentException if the property is known but the value isn't
   */
  Optional<IntRangeSet> enumerated(String property, String value);

  /**
   * Code points with a binary property, as in {@code \p{Extended_Pictographic}}.
   *
   * @param property property name
   * @return code points, or empty if the property is unknown to this resolver
   */
  Optional<IntRangeSet> binary(String property);

  /**
   * Resolver that knows no properties.
   */
  PropertyResolver NONE = new PropertyResolver() {
    @Override
    public Optional<IntRangeSet> enumerated(String property, String value) {
      return Optional.empty();
    }

    @Override
    public Optional<IntRangeSet> binary(String property) {
      return Optional.empty();
    }
  };
}
