package io.github.panghy.pluginproxy.message;

/**
 * The capability groups that can be addressed over a channel.
 *
 * <p>Every wire message names exactly one group; the dispatcher uses the group id
 * purely for routing to the matching capability proxy. Ids are part of the wire
 * protocol and must never be renumbered. Id {@code 0} is never assigned so that a
 * zeroed header cannot route anywhere.</p>
 */
public enum ApiGroup {
  CORE(1),
  INSTANCE(2),
  URL_LOADER(3),
  URL_RESPONSE_INFO(4),
  GRAPHICS_2D(5),
  FILE_CHOOSER(6),
  AUDIO(7);

  private static final ApiGroup[] BY_ID;

  static {
    int max = 0;
    for (ApiGroup group : values()) {
      max = Math.max(max, group.id);
    }
    BY_ID = new ApiGroup[max + 1];
    for (ApiGroup group : values()) {
      BY_ID[group.id] = group;
    }
  }

  private final int id;

  ApiGroup(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /**
   * Looks up a group by its wire id.
   *
   * @param id The wire id
   * @return The group, or null if the id is outside the known enumeration
   */
  public static ApiGroup forId(int id) {
    if (id <= 0 || id >= BY_ID.length) {
      return null;
    }
    return BY_ID[id];
  }
}
