package com.anonrelay.test;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(TempLogExtension.class)
class TempLogExtensionTest {

    @Test
    void shouldInjectFreshLogPath(Path eventLog) throws Exception {
        assertEquals(TempLogExtension.LOG_FILE_NAME, eventLog.getFileName().toString());
        assertFalse(Files.exists(eventLog));
        assertTrue(Files.isDirectory(eventLog.getParent()));

        Files.writeString(eventLog, "{}\n");
        assertTrue(Files.exists(eventLog));
    }

    @Test
    void shouldGiveEachTestItsOwnDirectory(Path eventLog) {
        assertFalse(Files.exists(eventLog));
    }
}
