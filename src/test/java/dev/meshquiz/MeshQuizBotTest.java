package dev.meshquiz;

import static org.junit.jupiter.api.Assertions.*;

import dev.meshquiz.api.InboundMessage;
import org.junit.jupiter.api.Test;

class MeshQuizBotTest {
  @Test
  void plainLineIsADirectMessage() {
    InboundMessage message = MeshQuizBot.parseLine("!a1b2 what is  22 ", 1).orElseThrow();

    assertTrue(message.directMessage());
    assertEquals("!a1b2", message.senderId());
    assertEquals("what is  22", message.text());
  }

  @Test
  void atLineIsAChannelMessage() {
    InboundMessage message = MeshQuizBot.parseLine("@!a1b2 !hj status", 1).orElseThrow();

    assertFalse(message.directMessage());
    assertEquals(1, message.channel());
    assertEquals("!a1b2", message.senderId());
  }

  @Test
  void linesWithoutTextAreIgnored() {
    assertTrue(MeshQuizBot.parseLine("!a1b2", 1).isEmpty());
    assertTrue(MeshQuizBot.parseLine("@ hello", 1).isEmpty());
    assertTrue(MeshQuizBot.parseLine("   ", 1).isEmpty());
  }
}
