package dev.meshquiz.core;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Console stand-in for a radio: every payload is written to the log. */
public final class LoggingMeshTransport implements MeshTransport {
  private static final Logger LOGGER = LogManager.getLogger("MeshQuiz/Radio");

  private final List<String> channels;

  /** @param channels channel names in index order; index 0 is the primary channel */
  public LoggingMeshTransport(List<String> channels) {
    this.channels = List.copyOf(channels);
  }

  @Override
  public TransportResponse sendText(String text, Target target) {
    LOGGER.info("TX {} [{} chars]: {}", target, text.length(), text);
    return TransportResponse.ok();
  }

  @Override
  public OptionalInt findChannel(String name) {
    String wanted = name.toLowerCase(Locale.ROOT);
    for (int i = 0; i < channels.size(); i++) {
      if (channels.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
        return OptionalInt.of(i);
      }
    }
    return OptionalInt.empty();
  }
}
