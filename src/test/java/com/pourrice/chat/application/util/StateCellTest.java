package com.pourrice.chat.application.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StateCellTest {

  @Test
  void notifiesOnlyOnChange() {
    StateCell<String> cell = new StateCell<>("state", "idle");
    List<String> seen = new ArrayList<>();
    cell.subscribe(seen::add);

    assertTrue(cell.set("busy"));
    assertFalse(cell.set("busy"));
    assertTrue(cell.set("idle"));

    assertEquals(List.of("busy", "idle"), seen);
    assertEquals("state=idle", cell.toString());
  }

  @Test
  void closedSubscriptionStopsNotifications() {
    StateCell<Integer> cell = new StateCell<>("count", 0);
    List<Integer> seen = new ArrayList<>();
    ObservableValue.Subscription subscription = cell.subscribe(seen::add);

    cell.set(1);
    subscription.close();
    cell.set(2);

    assertEquals(List.of(1), seen);
  }

  @Test
  void failingSubscriberDoesNotStopOthers() {
    StateCell<Integer> cell = new StateCell<>("count", 0);
    List<Integer> seen = new ArrayList<>();
    cell.subscribe(value -> {
      throw new IllegalStateException("boom");
    });
    cell.subscribe(seen::add);

    cell.set(5);

    assertEquals(List.of(5), seen);
    assertEquals(Integer.valueOf(5), cell.get());
  }
}
