package dev.meshquiz.perms;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Authorization for privileged game commands against a fixed allow-list of node ids. */
public final class AdminGate {
  private static final char NODE_MARKER = '!';

  private final Set<String> admins;

  public AdminGate(Collection<String> adminIds) {
    Set<String> normalized = new LinkedHashSet<>();
    if (adminIds != null) {
      for (String id : adminIds) {
        String clean = normalize(id);
        if (!clean.isEmpty()) {
          normalized.add(clean);
        }
      }
    }
    this.admins = Set.copyOf(normalized);
  }

  public boolean isAdmin(String nodeId) {
    String clean = normalize(nodeId);
    return !clean.isEmpty() && admins.contains(clean);
  }

  public Set<String> admins() { return admins; }

  public boolean configured() { return !admins.isEmpty(); }

  /**
   * Canonical form of a mesh node id: trimmed, leading {@code !} markers removed, lower case.
   * {@code "!A1B2"}, {@code "a1b2"} and {@code " !!a1b2 "} all map to {@code "a1b2"}.
   */
  public static String normalize(String nodeId) {
    if (nodeId == null) {
      return "";
    }
    String trimmed = nodeId.trim();
    int start = 0;
    while (start < trimmed.length() && trimmed.charAt(start) == NODE_MARKER) {
      start++;
    }
    return trimmed.substring(start).toLowerCase(Locale.ROOT);
  }

  /** Display form of a node id, with the leading marker the mesh uses. */
  public static String display(String nodeId) {
    String clean = normalize(nodeId);
    return clean.isEmpty() ? clean : NODE_MARKER + clean;
  }
}
