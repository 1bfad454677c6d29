package ca.gc.cra.hostbridge.config;

import ca.gc.cra.hostbridge.application.command.CommandDispatcher;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.application.commands.BuiltinCommands;
import ca.gc.cra.hostbridge.application.commands.HostServices;
import ca.gc.cra.hostbridge.application.exec.MainThreadExecutor;
import ca.gc.cra.hostbridge.application.port.AssetCatalog;
import ca.gc.cra.hostbridge.application.port.EnvelopeCodec;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.application.reflect.ComponentTypeRegistry;
import ca.gc.cra.hostbridge.application.reflect.PropertyBridge;
import ca.gc.cra.hostbridge.application.reflect.ReferenceResolver;
import ca.gc.cra.hostbridge.application.reflect.ValueCoercer;
import ca.gc.cra.hostbridge.application.wiring.Autowirer;
import ca.gc.cra.hostbridge.application.wiring.WiringStrategy;
import ca.gc.cra.hostbridge.domain.scene.World;
import ca.gc.cra.hostbridge.infrastructure.asset.InMemoryAssetCatalog;
import ca.gc.cra.hostbridge.infrastructure.codec.JsonEnvelopeCodec;
import ca.gc.cra.hostbridge.infrastructure.host.SingleThreadHostLoop;
import ca.gc.cra.hostbridge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.hostbridge.infrastructure.net.BridgeServer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the bridge's host model, command registry, executor
 * and socket listener.
 * <p><strong>Why:</strong> Provides a single place to translate {@link BridgeConfig} into a runnable bridge.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning host loop -> executor -> dispatcher -> listener.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the host-side object graph: world, component types, assets, property bridge, autowirer.</li>
 *   <li>Assemble the command registry from the built-in modules plus embedder-supplied modules.</li>
 *   <li>Start the host loop and listener as one {@link BridgeRuntime}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Configure and start on a single thread during startup. After start the host
 * graph belongs to the host loop thread.</p>
 * <p><strong>Observability:</strong> Supplies the metrics port to the executor, dispatcher, autowirer and sessions.</p>
 *
 * @since 0.1.0
 * @see BridgeRuntime
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final BridgeConfig config;
  private final MetricsPort metrics;
  private final ComponentTypeRegistry componentTypes;
  private final AssetCatalog assets;
  private final World world;
  private final List<CommandModule> extraModules = new ArrayList<>();

  /**
   * Creates a composition root backed by the OpenTelemetry metrics adapter.
   *
   * @param config validated bridge configuration
   */
  public CompositionRoot(BridgeConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter, typically a test double.
   *
   * @param config validated bridge configuration
   * @param metricsPort metrics sink shared by every component
   */
  public CompositionRoot(BridgeConfig config, MetricsPort metricsPort) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
    this.componentTypes = ComponentTypeRegistry.withBuiltins();
    this.assets = new InMemoryAssetCatalog();
    this.world = new World(config.sceneName());
  }

  public BridgeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Component registry; embedders register their own component classes here before {@link #start()}.
   *
   * @return mutable registry
   */
  public ComponentTypeRegistry componentTypes() {
    return componentTypes;
  }

  public AssetCatalog assets() {
    return assets;
  }

  public World world() {
    return world;
  }

  /**
   * Adds an embedder command module, installed after the built-ins.
   *
   * @param module module to install
   * @return this root
   */
  public CompositionRoot addModule(CommandModule module) {
    extraModules.add(Objects.requireNonNull(module, "module"));
    return this;
  }

  /**
   * Builds the host services shared by the command modules.
   *
   * @return services over this root's world, registry and assets
   */
  public HostServices hostServices() {
    ReferenceResolver references = new ReferenceResolver(world::activeScene, assets);
    PropertyBridge properties = new PropertyBridge(world::activeScene, componentTypes, new ValueCoercer(references));
    Autowirer autowirer =
        new Autowirer(world::activeScene, componentTypes, properties, WiringStrategy.defaults(), metrics);
    return new HostServices(world, componentTypes, properties, autowirer, assets, config.batchMode());
  }

  /**
   * Builds the immutable command registry.
   *
   * @return registry holding built-in and extra modules
   */
  public CommandRegistry commandRegistry() {
    return BuiltinCommands.registry(hostServices(), List.copyOf(extraModules));
  }

  public EnvelopeCodec codec() {
    return new JsonEnvelopeCodec();
  }

  /**
   * Starts the host loop and listener.
   *
   * @return running bridge; close it to stop
   * @throws java.io.UncheckedIOException when the listener cannot bind
   */
  public BridgeRuntime start() {
    CommandRegistry registry = commandRegistry();
    SingleThreadHostLoop hostLoop = new SingleThreadHostLoop().start();
    MainThreadExecutor executor = new MainThreadExecutor(hostLoop, config.invocationTimeout(), metrics);
    CommandDispatcher dispatcher = new CommandDispatcher(registry, executor, metrics);
    BridgeServer server = new BridgeServer(config.host(), config.port(), dispatcher, codec(), metrics);
    try {
      server.start();
    } catch (RuntimeException ex) {
      hostLoop.close();
      throw ex;
    }
    log.info(
        "Bridge ready with {} commands on port {} (timeout={}ms, batchMode={})",
        registry.names().size(),
        server.boundPort(),
        config.invocationTimeoutMillis(),
        config.batchMode());
    return new BridgeRuntime(hostLoop, dispatcher, server);
  }
}
