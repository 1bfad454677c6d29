package ca.gc.cra.hostbridge.application.port;

import java.util.List;
import java.util.Optional;

/**
 * Persisted assets addressable by path, e.g. {@code Assets/Prefabs/Characters/Player.prefab}.
 *
 * <p>The property bridge uses the catalog for the second and third reference-resolution tiers; workflow
 * commands save assembled entities into it.</p>
 */
public interface AssetCatalog {

  /**
   * Stores or replaces an asset.
   *
   * @param path asset path
   * @param asset asset value
   */
  void save(String path, Object asset);

  /**
   * Loads the asset at {@code path} when it is an instance of {@code type}.
   *
   * @param path exact asset path
   * @param type required type
   * @param <T> required type
   * @return the asset, or empty
   */
  <T> Optional<T> load(String path, Class<T> type);

  /**
   * Lists paths of assets whose file name contains {@code query} (case-insensitive) and whose value is an
   * instance of {@code type}, in path order.
   *
   * @param query name fragment; blank matches everything
   * @param type required type; {@code Object.class} matches everything
   * @return matching paths
   */
  List<String> search(String query, Class<?> type);

  /**
   * Removes the asset at {@code path}.
   *
   * @param path asset path
   * @return whether an asset was removed
   */
  boolean remove(String path);

  /** Lists every asset path in path order. */
  List<String> list();
}
