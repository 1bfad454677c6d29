package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.reflect.ComponentAdapter;
import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranked list of {@link WiringMatcher}s.
 *
 * <p>Matchers are tried in rank order. For each matcher the target's wireable fields are tried in order
 * (public, then {@code @Exposed}; declaration order within each group, subclass first), and the first hit wins.
 * An exact-type field therefore beats an earlier assignable field, and ties inside one matcher go to the field
 * declared first. Declaration order is what HotSpot reports through reflection; the JLS does not guarantee it.</p>
 */
public final class WiringStrategy {
  private final List<WiringMatcher> matchers;

  public WiringStrategy(List<WiringMatcher> matchers) {
    if (Objects.requireNonNull(matchers, "matchers").isEmpty()) {
      throw new IllegalArgumentException("at least one matcher is required");
    }
    this.matchers = List.copyOf(matchers);
  }

  /** Exact type, then assignable type, then field name. */
  public static WiringStrategy defaults() {
    return new WiringStrategy(List.of(
        new ExactTypeMatcher(), new AssignableTypeMatcher(), new FieldNameMatcher()));
  }

  public List<WiringMatcher> matchers() {
    return matchers;
  }

  /**
   * Selects the field of {@code target} that should receive {@code source}.
   *
   * @param target adapter of the target component
   * @param source source component
   * @param sourceOwner entity owning the source
   * @param sourceName source name as requested
   * @return chosen field and value, or empty
   */
  public Optional<FieldMatch> select(ComponentAdapter target, Object source, Entity sourceOwner, String sourceName) {
    List<MemberAccessor> candidates = target.wireableFields();
    for (WiringMatcher matcher : matchers) {
      for (MemberAccessor field : candidates) {
        if (matcher.matches(field, source, sourceName)) {
          Object value = field.valueType() == Entity.class ? sourceOwner : source;
          return Optional.of(new FieldMatch(field, value, matcher.name()));
        }
      }
    }
    return Optional.empty();
  }
}
