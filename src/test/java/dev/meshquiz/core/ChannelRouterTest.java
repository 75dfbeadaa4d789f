package dev.meshquiz.core;

import static org.junit.jupiter.api.Assertions.*;

import dev.meshquiz.api.Destination;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ChannelRouterTest {
  @Test
  void namedChannelResolvesAndIsCached() {
    CountingTransport transport = new CountingTransport(List.of("primary", "jeopardy"));
    ChannelRouter router = new ChannelRouter(transport, true);

    ChannelRouter.Resolution first = router.resolve(Destination.channel("Jeopardy"));
    ChannelRouter.Resolution second = router.resolve(Destination.channel("jeopardy"));

    assertEquals(ChannelRouter.Status.OK, first.status());
    assertEquals(MeshTransport.Target.channel(1), first.target());
    assertEquals(first.target(), second.target());
    assertEquals(1, transport.lookups);
  }

  @Test
  void missingChannelFallsBackToPrimary() {
    CountingTransport transport = new CountingTransport(List.of("primary"));
    ChannelRouter router = new ChannelRouter(transport, true);

    ChannelRouter.Resolution resolution = router.resolve(Destination.channel("jeopardy"));

    assertEquals(ChannelRouter.Status.FALLBACK, resolution.status());
    assertTrue(resolution.ok());
    assertEquals(MeshTransport.Target.channel(0), resolution.target());
    router.resolve(Destination.channel("jeopardy"));
    assertEquals(2, transport.lookups);
  }

  @Test
  void missingChannelWithoutFallbackHasNoRoute() {
    ChannelRouter router = new ChannelRouter(new CountingTransport(List.of("primary")), false);

    ChannelRouter.Resolution resolution = router.resolve(Destination.channel("jeopardy"));

    assertFalse(resolution.ok());
    assertNull(resolution.target());
  }

  @Test
  void failingLookupIsTreatedAsMissing() {
    CountingTransport transport = new CountingTransport(List.of());
    transport.broken = true;

    ChannelRouter.Resolution resolution =
        new ChannelRouter(transport, true).resolve(Destination.channel("jeopardy"));

    assertEquals(ChannelRouter.Status.FALLBACK, resolution.status());
  }

  @Test
  void nodeDestinationsNeedNoLookup() {
    CountingTransport transport = new CountingTransport(List.of());
    ChannelRouter router = new ChannelRouter(transport, false);

    assertEquals(
        MeshTransport.Target.node("!a1b2"), router.resolve(Destination.node(" !a1b2 ")).target());
    assertEquals(ChannelRouter.Status.NO_ROUTE, router.resolve(Destination.node(" ")).status());
    assertEquals(0, transport.lookups);
  }

  private static final class CountingTransport implements MeshTransport {
    private final List<String> channels;
    int lookups;
    boolean broken;

    CountingTransport(List<String> channels) {
      this.channels = channels;
    }

    @Override
    public TransportResponse sendText(String text, Target target) {
      return TransportResponse.ok();
    }

    @Override
    public OptionalInt findChannel(String name) {
      lookups++;
      if (broken) {
        throw new IllegalStateException("radio not connected");
      }
      int index = channels.indexOf(name);
      return index >= 0 ? OptionalInt.of(index) : OptionalInt.empty();
    }
  }
}
