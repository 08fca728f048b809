package com.codeheadsystems.coffer.client.store;

import com.codeheadsystems.coffer.client.model.Connection;
import com.codeheadsystems.coffer.client.model.TokenSlot;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the main connection, the additional rotation connections and the rotation cursor.
 * <p>
 * Not thread-safe on its own: every read-decide-write sequence is performed by
 * {@code TokenLifecycleManager} under a single lock, so the cursor and the connection list can
 * never be observed out of step.
 */
public class CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

  private final List<Connection> connections = new ArrayList<>();
  private int cursor;

  /**
   * Replaces the whole content of the store.
   *
   * @param main       the main connection
   * @param additional the additional rotation connections, may be empty
   */
  public void initialize(final Connection main, final List<Connection> additional) {
    log.debug("initialize(additional={})", additional.size());
    clear();
    connections.add(main);
    connections.addAll(additional);
  }

  public boolean isEmpty() {
    return connections.isEmpty();
  }

  public int size() {
    return connections.size();
  }

  public TokenSlot currentSlot() {
    return new TokenSlot(cursor);
  }

  public Connection main() {
    return get(TokenSlot.MAIN);
  }

  /**
   * Returns the connection in a slot.
   *
   * @param slot the slot
   * @return the connection
   * @throws IllegalStateException if the store is empty
   */
  public Connection get(final TokenSlot slot) {
    if (connections.isEmpty()) {
      throw new IllegalStateException("No connection available, the client is disconnected");
    }
    return connections.get(slot.index());
  }

  public List<Connection> all() {
    return List.copyOf(connections);
  }

  /**
   * Replaces the connection in a slot and erases the old one.
   *
   * @param slot       the slot
   * @param connection the new connection
   */
  public void replace(final TokenSlot slot, final Connection connection) {
    Connection old = connections.set(slot.index(), connection);
    if (old != null && old != connection) {
      old.close();
    }
  }

  /**
   * Moves the cursor to the next slot: Main, Additional[0] .. Additional[N-2], Main.
   */
  public void advance() {
    if (!connections.isEmpty()) {
      cursor = (cursor + 1) % connections.size();
    }
  }

  /**
   * Erases every connection and resets the cursor.
   */
  public void clear() {
    connections.forEach(Connection::close);
    connections.clear();
    cursor = 0;
  }
}
