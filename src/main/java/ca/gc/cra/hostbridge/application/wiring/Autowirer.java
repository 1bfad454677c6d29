package ca.gc.cra.hostbridge.application.wiring;

import ca.gc.cra.hostbridge.application.exec.CancellationToken;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.application.reflect.ComponentAdapter;
import ca.gc.cra.hostbridge.application.reflect.ComponentTypeRegistry;
import ca.gc.cra.hostbridge.application.reflect.MemberAccessor;
import ca.gc.cra.hostbridge.application.reflect.PropertyBridge;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.HostEvent;
import ca.gc.cra.hostbridge.domain.scene.Scene;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Connects components in the active scene by assigning source components into
 * reference fields of target components.
 * <p><strong>Why:</strong> Workflow commands assemble whole scenes; wiring removes the per-field bookkeeping a
 * client would otherwise do through {@code SetComponentProperty}.</p>
 * <p><strong>Algorithm:</strong> every request is planned first (locate source and target, select a field via
 * the {@link WiringStrategy}), then applied. In {@link BatchMode#ATOMIC} a single planning failure aborts the
 * batch before any assignment, and an assignment failure rolls back the ones already made.</p>
 * <p><strong>Scope:</strong> sources and targets are searched across the whole active scene, or only across the
 * entities passed to the scoped overloads. Workflows scope to the entities they just built so an earlier
 * entity carrying the same component types is never rewired in their place.</p>
 * <p><strong>Thread-safety:</strong> Must run on the host loop thread.</p>
 * <p><strong>Observability:</strong> Increments {@code bridge.wiring.wired} and {@code bridge.wiring.failed}
 * once per pair.</p>
 *
 * @since 0.1.0
 */
public final class Autowirer {
  private static final Logger log = LoggerFactory.getLogger(Autowirer.class);
  static final String VIA_EVENT = "event";

  private final Supplier<Scene> activeScene;
  private final ComponentTypeRegistry types;
  private final PropertyBridge bridge;
  private final WiringStrategy strategy;
  private final MetricsPort metrics;

  public Autowirer(
      Supplier<Scene> activeScene,
      ComponentTypeRegistry types,
      PropertyBridge bridge,
      WiringStrategy strategy,
      MetricsPort metrics) {
    this.activeScene = Objects.requireNonNull(activeScene, "activeScene");
    this.types = Objects.requireNonNull(types, "types");
    this.bridge = Objects.requireNonNull(bridge, "bridge");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Wires a batch of requests.
   *
   * @param requests pairs to connect, in order
   * @param mode failure semantics
   * @param token polled between pairs
   * @return per-pair outcome
   */
  public WiringReport wire(List<WiringRequest> requests, BatchMode mode, CancellationToken token) {
    return wire(null, requests, mode, token);
  }

  /**
   * Wires a batch of requests, locating sources and targets only on {@code scope}.
   *
   * @param scope entities to search in order; {@code null} searches the active scene
   * @param requests pairs to connect, in order
   * @param mode failure semantics
   * @param token polled between pairs
   * @return per-pair outcome
   */
  public WiringReport wire(
      List<Entity> scope, List<WiringRequest> requests, BatchMode mode, CancellationToken token) {
    Objects.requireNonNull(requests, "requests");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(token, "token");

    List<Entity> candidates = candidates(scope);
    List<Plan> plans = new ArrayList<>();
    List<WiringReport.Failed> failed = new ArrayList<>();
    for (WiringRequest request : requests) {
      token.throwIfCancelled();
      try {
        plans.add(plan(request, candidates));
      } catch (BridgeException ex) {
        failed.add(new WiringReport.Failed(request.label(), ex.getMessage()));
      }
    }

    if (mode == BatchMode.ATOMIC && !failed.isEmpty()) {
      List<String> skipped = plans.stream().map(p -> p.request().label()).toList();
      return report(false, mode, List.of(), failed, skipped);
    }

    List<WiringReport.Wired> wired = new ArrayList<>();
    Deque<Applied> applied = new ArrayDeque<>();
    for (int i = 0; i < plans.size(); i++) {
      Plan plan = plans.get(i);
      token.throwIfCancelled();
      if (plan.match() == null) {
        wired.add(new WiringReport.Wired(plan.request().label(), plan.request().eventName(), VIA_EVENT));
        continue;
      }
      MemberAccessor field = plan.match().field();
      Object previous = field.get(plan.target());
      try {
        bridge.assign(plan.target(), field, plan.match().value());
        applied.push(new Applied(plan.target(), field, previous));
        wired.add(new WiringReport.Wired(plan.request().label(), field.name(), plan.match().matcher()));
      } catch (BridgeException ex) {
        failed.add(new WiringReport.Failed(plan.request().label(), ex.getMessage()));
        if (mode == BatchMode.ATOMIC) {
          rollback(applied);
          List<String> skipped = new ArrayList<>(wired.stream().map(WiringReport.Wired::pair).toList());
          plans.subList(i + 1, plans.size()).forEach(p -> skipped.add(p.request().label()));
          return report(false, mode, List.of(), failed, skipped);
        }
      }
    }
    return report(failed.isEmpty(), mode, wired, failed, List.of());
  }

  /**
   * Derives wiring requests from the components present in the active scene: every ordered pair of distinct
   * component types where the target declares a wireable field exactly typed as, or assignable from, the source.
   *
   * @param componentTypes candidate type names; empty means every component in the scene
   * @return inferred requests, in scene order
   */
  public List<WiringRequest> inferRequests(List<String> componentTypes) {
    return inferRequests(componentTypes, null);
  }

  /**
   * Derives wiring requests from the components attached to {@code scope}.
   *
   * @param componentTypes candidate type names; empty means every component on the scoped entities
   * @param scope entities to inspect; {@code null} inspects the active scene
   * @return inferred requests, in entity order
   */
  public List<WiringRequest> inferRequests(List<String> componentTypes, List<Entity> scope) {
    List<Object> components = new ArrayList<>();
    List<String> seen = new ArrayList<>();
    for (Entity entity : candidates(scope)) {
      for (Object component : entity.components()) {
        String name = component.getClass().getSimpleName();
        boolean wanted = componentTypes.isEmpty()
            || componentTypes.contains(name)
            || componentTypes.contains(component.getClass().getName());
        if (wanted && !seen.contains(name)) {
          seen.add(name);
          components.add(component);
        }
      }
    }
    List<WiringRequest> requests = new ArrayList<>();
    for (Object target : components) {
      ComponentAdapter adapter = types.adapterFor(target.getClass());
      for (Object source : components) {
        if (source == target) {
          continue;
        }
        boolean typed = adapter.wireableFields().stream()
            .anyMatch(f -> f.valueType() != Object.class && f.valueType().isAssignableFrom(source.getClass()));
        if (typed) {
          requests.add(WiringRequest.of(source.getClass().getSimpleName(), target.getClass().getSimpleName()));
        }
      }
    }
    return requests;
  }

  private List<Entity> candidates(List<Entity> scope) {
    return scope == null ? activeScene.get().walk() : List.copyOf(scope);
  }

  private Plan plan(WiringRequest request, List<Entity> candidates) {
    Located source = locate(candidates, request.source(), null)
        .orElseThrow(() -> notFound("Source", request.source()));
    Located target = locate(candidates, request.target(), source.component())
        .orElseThrow(() -> notFound("Target", request.target()));
    ComponentAdapter adapter = types.adapterFor(target.component().getClass());
    Optional<FieldMatch> match = strategy.select(adapter, source.component(), source.owner(), request.source());
    if (match.isPresent()) {
      return new Plan(request, target.component(), match.get());
    }
    if (request.eventName() != null && hasEvent(source.component(), request.eventName())) {
      return new Plan(request, target.component(), null);
    }
    throw BridgeException.invalidParams("No matching field found on " + request.target()
        + " for " + request.source());
  }

  private static BridgeException notFound(String role, String typeName) {
    return new BridgeException(ErrorKind.COMPONENT_NOT_FOUND, role + " component not found: " + typeName);
  }

  private boolean hasEvent(Object source, String eventName) {
    return types.adapterFor(source.getClass()).member(eventName)
        .filter(m -> HostEvent.class.isAssignableFrom(m.valueType()))
        .isPresent();
  }

  private static Optional<Located> locate(List<Entity> candidates, String typeName, Object exclude) {
    Located contains = null;
    for (Entity entity : candidates) {
      for (Object component : entity.components()) {
        if (component == exclude) {
          continue;
        }
        Class<?> type = component.getClass();
        if (type.getSimpleName().equals(typeName) || type.getName().equals(typeName)) {
          return Optional.of(new Located(component, entity));
        }
        if (contains == null && type.getSimpleName().contains(typeName)) {
          contains = new Located(component, entity);
        }
      }
    }
    return Optional.ofNullable(contains);
  }

  private void rollback(Deque<Applied> applied) {
    while (!applied.isEmpty()) {
      Applied entry = applied.pop();
      try {
        entry.field().set(entry.target(), entry.previous());
      } catch (RuntimeException ex) {
        log.warn("Rollback of {}.{} failed", entry.target().getClass().getSimpleName(), entry.field().name(), ex);
      }
    }
  }

  private WiringReport report(
      boolean success,
      BatchMode mode,
      List<WiringReport.Wired> wired,
      List<WiringReport.Failed> failed,
      List<String> skipped) {
    for (int i = 0; i < wired.size(); i++) {
      metrics.increment("bridge.wiring.wired");
    }
    for (int i = 0; i < failed.size(); i++) {
      metrics.increment("bridge.wiring.failed");
    }
    String message = "Wired " + wired.size() + " connections, " + failed.size() + " failed";
    if (!skipped.isEmpty()) {
      message += ", " + skipped.size() + " skipped";
    }
    log.info("{} ({})", message, mode);
    failed.forEach(f -> log.debug("Wiring {} failed: {}", f.pair(), f.reason()));
    return new WiringReport(success, mode, wired, failed, skipped, message);
  }

  private record Located(Object component, Entity owner) {}

  private record Plan(WiringRequest request, Object target, FieldMatch match) {}

  private record Applied(Object target, MemberAccessor field, Object previous) {}
}
