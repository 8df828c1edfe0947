package ca.gc.cra.meshgate.domain.mesh;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConnectionStateTest {

  @Test
  void startsDisconnectedWithZeroCounters() {
    ConnectionState state = ConnectionState.initial();

    assertEquals(ConnectionPhase.DISCONNECTED, state.phase());
    assertFalse(state.connected());
    assertNull(state.localNodeNum());
    assertEquals(0, state.connectionAttempts());
    assertEquals(0, state.failedAttempts());
  }

  @Test
  void onlySuccessfulConnectionsAdvanceAttempts() {
    ConnectionState state = ConnectionState.initial()
        .transition(ConnectionPhase.CONNECTING)
        .connectFailed()
        .transition(ConnectionPhase.CONNECTING)
        .connectedTo(77L, 5_000L);

    assertTrue(state.connected());
    assertEquals(1, state.connectionAttempts());
    assertEquals(1, state.failedAttempts());
    assertEquals(77L, state.localNodeNum());
    assertEquals(5_000L, state.lastConnectedAtMillis());
  }

  @Test
  void disconnectKeepsLastConnectionDetails() {
    ConnectionState state = ConnectionState.initial()
        .connectedTo(77L, 5_000L)
        .transition(ConnectionPhase.DISCONNECTED);

    assertFalse(state.connected());
    assertEquals(77L, state.localNodeNum());
    assertEquals(5_000L, state.lastConnectedAtMillis());
  }

  @Test
  void rejectsNullPhase() {
    assertThrows(NullPointerException.class, () -> ConnectionState.initial().transition(null));
  }
}
