package com.testbridge.test;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(ModuleWorkspaceExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ModuleWorkspaceExtensionTest {

    private static Path previousRoot;

    @Test
    @Order(1)
    void testWorkspaceIsAFreshDirectory(ModuleWorkspace workspace) throws Exception {
        assertTrue(Files.isDirectory(workspace.root()));
        assertTrue(workspace.root().getFileName().toString().startsWith("testbridge-ModuleWorkspaceExtensionTest-"));

        Path nested = workspace.writeFile("a/b/notes.txt", "hello");
        Path directory = workspace.newDirectory("modules");

        assertEquals("hello", Files.readString(nested));
        assertTrue(Files.isDirectory(directory));
        previousRoot = workspace.root();
    }

    @Test
    @Order(2)
    void testPreviousWorkspaceWasDeleted(ModuleWorkspace workspace) {
        assertNotNull(previousRoot);
        assertFalse(Files.exists(previousRoot));
        assertNotEquals(previousRoot, workspace.root());
    }

    @AfterAll
    static void reset() {
        previousRoot = null;
    }
}
