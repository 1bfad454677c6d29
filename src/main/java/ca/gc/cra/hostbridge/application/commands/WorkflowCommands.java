package ca.gc.cra.hostbridge.application.commands;

import ca.gc.cra.hostbridge.application.command.CommandContext;
import ca.gc.cra.hostbridge.application.command.CommandModule;
import ca.gc.cra.hostbridge.application.command.CommandParams;
import ca.gc.cra.hostbridge.application.command.CommandRegistry;
import ca.gc.cra.hostbridge.application.exec.CancellationToken;
import ca.gc.cra.hostbridge.application.wiring.BatchMode;
import ca.gc.cra.hostbridge.application.wiring.WiringReport;
import ca.gc.cra.hostbridge.application.wiring.WiringRequest;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.scene.Entity;
import ca.gc.cra.hostbridge.domain.scene.Renderer;
import ca.gc.cra.hostbridge.domain.scene.RigidBody;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Multi-step scene assembly commands built on the scene, component and wiring primitives.
 * <p><strong>Structure:</strong> generated content lives under five group roots ({@link #STRUCTURE}); the player
 * and enemies are saved as prefab assets under {@code Assets/Prefabs/}.</p>
 * <p><strong>Missing systems:</strong> system type names that are not registered are skipped and reported under
 * {@code missingSystems} instead of failing the workflow.</p>
 * <p><strong>Wiring:</strong> {@code WireSystems} takes explicit {@code connections} or, with
 * {@code infer=true}, derives them from attached components. {@code atomic} overrides the configured
 * {@link BatchMode} for one call.</p>
 *
 * @since 0.1.0
 */
public final class WorkflowCommands implements CommandModule {
  private static final Logger log = LoggerFactory.getLogger(WorkflowCommands.class);

  public static final String MANAGERS = "--- MANAGERS ---";
  public static final String PLAYER = "--- PLAYER ---";
  public static final String ENEMIES = "--- ENEMIES ---";
  public static final String ENVIRONMENT = "--- ENVIRONMENT ---";
  public static final String UI = "--- UI ---";
  public static final List<String> STRUCTURE = List.of(MANAGERS, PLAYER, ENEMIES, ENVIRONMENT, UI);

  static final String PLAYER_PREFAB = "Assets/Prefabs/Characters/Player.prefab";
  static final String ENEMY_PREFAB_DIR = "Assets/Prefabs/Enemies/";
  static final String SCENE_DIR = "Assets/Scenes/";

  private final HostServices services;
  private final EntityFactory entities;

  public WorkflowCommands(HostServices services) {
    this.services = Objects.requireNonNull(services, "services");
    this.entities = new EntityFactory(services);
  }

  @Override
  public void registerInto(CommandRegistry.Builder registry) {
    registry.register("WireSystems", this::wireSystems);
    registry.register("SetupSceneStructure", ctx -> setupStructure(ctx.params().stringList("structure")));
    registry.register("AssembleEntity", this::assemble);
    registry.register("SetupGameManager", ctx -> setupGameManager(ctx.params().stringList("systems")).result());
    registry.register("SetupPlayer", ctx -> setupPlayer(
        ctx.params().string("playerType", "3D"),
        ctx.params().stringList("systems"),
        ctx.params().bool("createModel", true)).result());
    registry.register("CreateEnemy", this::createEnemy);
    registry.register("GenerateGame", this::generateGame);
  }

  private Object wireSystems(CommandContext ctx) {
    CommandParams params = ctx.params();
    List<WiringRequest> requests = new ArrayList<>();
    for (CommandParams connection : params.objectList("connections")) {
      requests.add(new WiringRequest(
          connection.requireString("source"),
          connection.requireString("target"),
          connection.optString("eventName").orElse(null)));
    }
    if (params.bool("infer", false)) {
      requests.addAll(services.autowirer().inferRequests(params.stringList("components")));
    }
    if (requests.isEmpty()) {
      throw BridgeException.invalidParams("Missing required parameter: connections");
    }
    return services.autowirer().wire(requests, batchMode(params), ctx.cancellation());
  }

  private Map<String, Object> setupStructure(List<String> requested) {
    List<String> structure = requested.isEmpty() ? STRUCTURE : requested;
    List<String> created = new ArrayList<>();
    for (String name : structure) {
      if (services.scene().find(name).isEmpty()) {
        services.scene().createEntity(name);
        created.add(name);
      }
    }
    Map<String, Object> result = Results.success("created", created);
    result.put("message", "Scene structure created with " + created.size() + " root objects");
    return result;
  }

  private Object assemble(CommandContext ctx) {
    CommandParams params = ctx.params();
    Entity entity = Guards.valueOrInvalid(() -> entities.create(params));
    params.optString("tag").filter(tag -> !tag.isBlank())
        .ifPresent(tag -> Guards.invalidIfRejected(() -> entity.setTag(tag)));
    List<String> missing = new ArrayList<>();
    List<String> attached = entities.attach(entity, params.stringList("components"), missing);
    Map<String, Object> result = described(entity.name(), attached, missing);
    result.put("path", entity.path());
    if (params.bool("wire", true) && attached.size() > 1) {
      result.put("wiring", wireAttached(List.of(entity), attached, batchMode(params), ctx.cancellation()));
    }
    return result;
  }

  private Step setupGameManager(List<String> systems) {
    Entity parent = entities.findOrCreateRoot(MANAGERS);
    Entity manager = services.scene().createEntity("GameManager", parent);
    List<String> missing = new ArrayList<>();
    List<String> attached = entities.attach(manager, systems, missing);
    Map<String, Object> result = described("GameManager", attached, missing);
    result.put("message", "GameManager created with " + attached.size() + " systems");
    return new Step(manager, attached, missing, result);
  }

  private Step setupPlayer(String playerType, List<String> systems, boolean createModel) {
    Entity parent = entities.findOrCreateRoot(PLAYER);
    Entity player = services.scene().createEntity("Player", parent);
    if (createModel) {
      if ("2D".equals(playerType)) {
        Renderer sprite = player.addComponent(new Renderer("Sprite"));
        sprite.color = "green";
        player.addComponent(new RigidBody()).planar = true;
      } else {
        player.addComponent(new Renderer("Capsule"));
        player.addComponent(new RigidBody());
      }
    }
    player.setTag("Player");
    List<String> missing = new ArrayList<>();
    List<String> attached = entities.attach(player, systems, missing);
    services.assets().save(PLAYER_PREFAB, player);
    log.info("Player prefab saved to {}", PLAYER_PREFAB);
    Map<String, Object> result = described("Player", attached, missing);
    result.put("prefabPath", PLAYER_PREFAB);
    result.put("playerType", "2D".equals(playerType) ? "2D" : "3D");
    result.put("message", "Player created with " + attached.size() + " systems and saved as prefab");
    return new Step(player, attached, missing, result);
  }

  private Object createEnemy(CommandContext ctx) {
    CommandParams params = ctx.params();
    String enemyName = params.requireString("enemyName");
    Entity parent = entities.findOrCreateRoot(ENEMIES);
    Entity enemy = Guards.valueOrInvalid(() -> services.scene().createEntity(enemyName, parent));
    if (params.bool("createModel", true)) {
      enemy.addComponent(new Renderer("Capsule")).color = "red";
      enemy.addComponent(new RigidBody());
    }
    enemy.setTag("Enemy");
    List<String> missing = new ArrayList<>();
    List<String> attached = entities.attach(enemy, params.stringList("systems"), missing);
    String prefabPath = ENEMY_PREFAB_DIR + enemyName.replace(' ', '_') + ".prefab";
    services.assets().save(prefabPath, enemy);
    log.info("Enemy prefab saved to {}", prefabPath);
    Map<String, Object> result = described(enemyName, attached, missing);
    result.put("prefabPath", prefabPath);
    result.put("enemyType", params.string("enemyType", "Melee"));
    result.put("message",
        "Enemy '" + enemyName + "' created with " + attached.size() + " systems and saved as prefab");
    return result;
  }

  private Object generateGame(CommandContext ctx) {
    CommandParams params = ctx.params();
    String gameName = params.requireString("gameName");
    List<String> systems = params.stringList("systems");
    CancellationToken token = ctx.cancellation();
    List<String> created = new ArrayList<>();
    List<String> missing = new ArrayList<>();
    List<String> attached = new ArrayList<>();
    List<Entity> built = new ArrayList<>();

    setupStructure(List.of());
    created.add("Scene structure created");

    token.throwIfCancelled();
    List<String> managerSystems = SystemRoles.managerSystems(systems);
    if (!managerSystems.isEmpty()) {
      Step manager = setupGameManager(managerSystems);
      built.add(manager.entity());
      attached.addAll(manager.attached());
      missing.addAll(manager.missing());
      created.add("GameManager with " + managerSystems.size() + " systems");
    }

    token.throwIfCancelled();
    if (params.bool("createPlayer", true)) {
      List<String> playerSystems = SystemRoles.playerSystems(systems);
      String playerType = params.string("gameType", "").contains("2D") ? "2D" : "3D";
      Step player = setupPlayer(playerType, playerSystems, true);
      built.add(player.entity());
      attached.addAll(player.attached());
      missing.addAll(player.missing());
      created.add("Player with " + playerSystems.size() + " systems");
    }

    token.throwIfCancelled();
    Map<String, Object> result = Results.success("gameName", gameName);
    if (attached.size() > 1) {
      WiringReport wiring = wireAttached(built, attached, batchMode(params), token);
      result.put("wiring", wiring);
      created.add(wiring.message());
    }

    String scenePath = SCENE_DIR + gameName.replace(' ', '_') + ".scene";
    services.assets().save(scenePath, services.scene());
    result.put("scenePath", scenePath);
    result.put("created", created);
    result.put("missingSystems", missing);
    result.put("message", "Game '" + gameName + "' generated with " + created.size() + " components");
    return result;
  }

  private WiringReport wireAttached(
      List<Entity> scope, List<String> componentTypes, BatchMode mode, CancellationToken token) {
    List<WiringRequest> requests = services.autowirer().inferRequests(componentTypes, scope);
    return services.autowirer().wire(scope, requests, mode, token);
  }

  private BatchMode batchMode(CommandParams params) {
    return params.optBool("atomic")
        .map(atomic -> atomic ? BatchMode.ATOMIC : BatchMode.BEST_EFFORT)
        .orElse(services.batchMode());
  }

  private static Map<String, Object> described(String entityName, List<String> attached, List<String> missing) {
    Map<String, Object> result = new LinkedHashMap<>(Results.success("gameObject", entityName));
    result.put("attachedSystems", attached);
    result.put("missingSystems", missing);
    return result;
  }

  private record Step(Entity entity, List<String> attached, List<String> missing, Map<String, Object> result) {}
}
