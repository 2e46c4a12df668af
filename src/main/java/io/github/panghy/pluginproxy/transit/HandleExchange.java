package io.github.panghy.pluginproxy.transit;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import static io.github.panghy.pluginproxy.util.LoggingUtil.debug;
import static io.github.panghy.pluginproxy.util.LoggingUtil.warn;

/**
 * Holding area for handles that have been duplicated for the peer but not yet claimed.
 *
 * <p>This plays the role the kernel plays when a descriptor is passed over a socket:
 * the sender parks a duplicate and writes the slot id into its message; the receiver
 * claims the duplicate by id when it decodes the message. A slot can be claimed or
 * revoked once. Whatever is still parked when the channel goes away is closed by
 * {@link #closeAll()}, so nothing leaks when a message carrying a token is lost.</p>
 *
 * <p>Like the rest of the channel state, an exchange is only touched from the
 * channel's own thread.</p>
 */
public class HandleExchange {

  private static final Logger LOGGER = Logger.getLogger(HandleExchange.class.getName());

  private final Map<Long, TransitHandle> parked = new HashMap<>();
  private long nextTransitId = 1;

  /**
   * Parks a handle for the peer.
   *
   * @param handle The duplicate to hand over; the exchange owns it from now on
   * @return The slot id to put in the token
   */
  public long park(TransitHandle handle) {
    long id = nextTransitId++;
    parked.put(id, handle);
    debug(LOGGER, "Parked " + handle + " as transit id " + id);
    return id;
  }

  /**
   * Claims a parked handle.
   *
   * @param transitId The slot id
   * @return The handle, now owned by the caller, or null if the slot is empty
   */
  public TransitHandle claim(long transitId) {
    return parked.remove(transitId);
  }

  /**
   * Removes a parked handle and closes it.
   *
   * @param transitId The slot id
   * @return true if a handle was parked under the id
   */
  public boolean revoke(long transitId) {
    TransitHandle handle = parked.remove(transitId);
    if (handle == null) {
      return false;
    }
    HandleTransit.closeQuietly(handle);
    return true;
  }

  /**
   * Closes every handle still parked.
   */
  public void closeAll() {
    if (!parked.isEmpty()) {
      warn(LOGGER, "Closing " + parked.size() + " unclaimed transit handle(s)");
    }
    for (TransitHandle handle : parked.values()) {
      HandleTransit.closeQuietly(handle);
    }
    parked.clear();
  }

  /**
   * Gets the number of handles waiting to be claimed.
   *
   * @return The parked handle count
   */
  public int parkedCount() {
    return parked.size();
  }
}
