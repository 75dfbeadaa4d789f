package dev.meshquiz.game;

import dev.meshquiz.perms.AdminGate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Node ids excluded from submitting. Checked at submission time only. */
public final class BanList {
  private final Set<String> banned = ConcurrentHashMap.newKeySet();

  /** Returns true if the node was not already banned. */
  public boolean ban(String nodeId) {
    String clean = AdminGate.normalize(nodeId);
    return !clean.isEmpty() && banned.add(clean);
  }

  public boolean unban(String nodeId) {
    return banned.remove(AdminGate.normalize(nodeId));
  }

  public boolean isBanned(String nodeId) {
    return banned.contains(AdminGate.normalize(nodeId));
  }

  public List<String> snapshot() { return List.copyOf(new TreeSet<>(banned)); }
}
