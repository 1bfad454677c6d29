package ca.gc.cra.hostbridge.domain.scene;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event-like component member that other components subscribe to at runtime.
 *
 * <p>Autowiring treats a source component exposing a {@code HostEvent} field as wireable even when the target
 * has no field to receive a reference, since the subscription happens once the host runs the graph.</p>
 *
 * @param <T> payload type
 */
public final class HostEvent<T> {
  private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

  public void subscribe(Consumer<? super T> listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public boolean unsubscribe(Consumer<? super T> listener) {
    return listeners.remove(listener);
  }

  /**
   * Delivers the payload to every subscriber in subscription order.
   *
   * @param payload event payload
   */
  public void fire(T payload) {
    for (Consumer<? super T> listener : listeners) {
      listener.accept(payload);
    }
  }

  public int listenerCount() {
    return listeners.size();
  }

  @Override
  public String toString() {
    return "HostEvent[listeners=" + listeners.size() + "]";
  }
}
