package ca.gc.cra.hostbridge.infrastructure.asset;

import ca.gc.cra.hostbridge.application.port.AssetCatalog;
import ca.gc.cra.hostbridge.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Asset catalog held in memory, ordered by path. Nothing is written to disk.
 */
public final class InMemoryAssetCatalog implements AssetCatalog {
  private final Map<String, Object> assets = new ConcurrentSkipListMap<>();

  @Override
  public void save(String path, Object asset) {
    assets.put(Strings.requireNonBlank("path", path), Objects.requireNonNull(asset, "asset"));
  }

  @Override
  public <T> Optional<T> load(String path, Class<T> type) {
    Objects.requireNonNull(type, "type");
    if (path == null) {
      return Optional.empty();
    }
    Object asset = assets.get(path);
    return type.isInstance(asset) ? Optional.of(type.cast(asset)) : Optional.empty();
  }

  @Override
  public List<String> search(String query, Class<?> type) {
    Objects.requireNonNull(type, "type");
    String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    List<String> matches = new ArrayList<>();
    for (Map.Entry<String, Object> entry : assets.entrySet()) {
      if (type.isInstance(entry.getValue()) && fileName(entry.getKey()).contains(needle)) {
        matches.add(entry.getKey());
      }
    }
    return matches;
  }

  @Override
  public boolean remove(String path) {
    return path != null && assets.remove(path) != null;
  }

  @Override
  public List<String> list() {
    return List.copyOf(assets.keySet());
  }

  private static String fileName(String path) {
    int slash = path.lastIndexOf('/');
    return (slash < 0 ? path : path.substring(slash + 1)).toLowerCase(Locale.ROOT);
  }
}
