package ca.gc.cra.hostbridge.domain.scene;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class HostEventTest {

  @Test
  void fireNotifiesSubscribersInOrder() {
    HostEvent<Integer> event = new HostEvent<>();
    List<String> calls = new ArrayList<>();
    event.subscribe(value -> calls.add("a" + value));
    event.subscribe(value -> calls.add("b" + value));

    event.fire(5);

    assertEquals(List.of("a5", "b5"), calls);
  }

  @Test
  void unsubscribeStopsDelivery() {
    HostEvent<String> event = new HostEvent<>();
    List<String> calls = new ArrayList<>();
    Consumer<String> listener = calls::add;
    event.subscribe(listener);

    assertTrue(event.unsubscribe(listener));
    event.fire("ignored");

    assertEquals(0, event.listenerCount());
    assertTrue(calls.isEmpty());
  }
}
