package me.golemcore.runtime.adapter.outbound.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleChannelAdapterTest {

    private ByteArrayOutputStream buffer;
    private ConsoleChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        adapter = new ConsoleChannelAdapter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldReportCliChannelType() {
        assertEquals("cli", adapter.getChannelType());
    }

    @Test
    void shouldPrintMessagePrefixedWithRecipient() {
        assertTrue(adapter.sendMessage("alice", "ping").isDone());
        assertTrue(adapter.sendMessage("bob", "pong").isDone());

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertEquals("[alice] ping" + System.lineSeparator() + "[bob] pong" + System.lineSeparator(), printed);
    }
}
