package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.ToolCallRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolSafetyPolicyTest {

    private final ToolSafetyPolicy policy = new ToolSafetyPolicy();

    @ParameterizedTest
    @ValueSource(strings = {
            "rm -rf /",
            "rm -r build",
            "cd /tmp && rm -f important.db",
            "del /s C:\\data",
            "kill -9 1",
            "pkill java",
            "mkfs.ext4 /dev/sda1",
            "dd if=/dev/zero of=/dev/sda",
            "echo x > /dev/sda",
            "sudo shutdown -h now",
            ":(){ :|:& };:"
    })
    void refusesDestructiveCommands(String command) {
        assertTrue(policy.findHazard(exec(command)).isPresent(), command);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "ls -la",
            "rm notes.txt",
            "grep -r TODO src",
            "echo skill > skills.md",
            "git status"
    })
    void allowsOrdinaryCommands(String command) {
        assertTrue(policy.findHazard(exec(command)).isEmpty(), command);
    }

    @Test
    void ignoresOtherTools() {
        assertTrue(policy.findHazard(ToolCallRequest.of("1", "write_file", Map.of("command", "rm -rf /")))
                .isEmpty());
    }

    private static ToolCallRequest exec(String command) {
        return ToolCallRequest.of("1", "exec", Map.of("command", command));
    }
}
