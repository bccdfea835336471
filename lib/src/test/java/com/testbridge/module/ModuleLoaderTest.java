package com.testbridge.module;

import com.testbridge.ModuleLoadException;
import com.testbridge.PathResolutionException;
import com.testbridge.config.DriverConfig;
import com.testbridge.fixture.ModuleFixtures;
import com.testbridge.framework.api.FrameworkController;
import com.testbridge.test.ModuleWorkspace;
import com.testbridge.test.ModuleWorkspaceExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(ModuleWorkspaceExtension.class)
class ModuleLoaderTest {

    private final ModuleLoader loader = new ModuleLoader(new DriverConfig());

    @Test
    void testLoadLocatesBothModules(ModuleWorkspace workspace) throws Exception {
        Path target = ModuleFixtures.testModule(workspace.root(), "first");

        LoadedModules modules = loader.load(target.toString());

        assertEquals(target.toAbsolutePath().normalize(), modules.target().path());
        assertEquals(workspace.root().resolve(DriverConfig.DEFAULT_FRAMEWORK_MODULE_NAME).toAbsolutePath().normalize(),
                modules.framework().path());
        assertEquals(ModuleFixtures.TEST_MODULE_NAME, modules.target().fileName());
        assertEquals(2, modules.urls().length);
    }

    @Test
    void testLoadAcceptsFileUri(ModuleWorkspace workspace) throws Exception {
        Path target = ModuleFixtures.testModule(workspace.root(), "first");

        LoadedModules modules = loader.load(target.toUri().toString());

        assertEquals(target.toAbsolutePath().normalize(), modules.target().path());
    }

    @Test
    void testMissingTestModule(ModuleWorkspace workspace) {
        String location = workspace.root().resolve("missing.jar").toString();

        ModuleLoadException e = assertThrows(ModuleLoadException.class, () -> loader.load(location));
        assertTrue(e.getMessage().startsWith("Test module not found"));
    }

    @Test
    void testMissingFrameworkModule(ModuleWorkspace workspace) throws Exception {
        Path target = ModuleFixtures.testModuleWithoutFramework(workspace.root(), "first");

        ModuleLoadException e = assertThrows(ModuleLoadException.class, () -> loader.load(target.toString()));
        assertTrue(e.getMessage().startsWith("Framework module not found"));
    }

    @Test
    void testTestModuleThatIsNotAJar(ModuleWorkspace workspace) throws Exception {
        Path target = workspace.writeFile("notes.jar", "not a jar");

        assertThrows(ModuleLoadException.class, () -> loader.load(target.toString()));
    }

    @Test
    void testDirectoryIsNotAModule(ModuleWorkspace workspace) throws Exception {
        Path directory = workspace.newDirectory("classes");

        assertThrows(ModuleLoadException.class, () -> loader.load(directory.toString()));
    }

    @Test
    void testCustomFrameworkModuleName(ModuleWorkspace workspace) {
        ModuleLoader custom = new ModuleLoader(new FileUriPathResolver(), "other-framework.jar");
        Path target = workspace.root().resolve("sample.jar");

        assertEquals(workspace.root().resolve("other-framework.jar"), custom.frameworkPathFor(target));
        assertEquals("other-framework.jar", custom.getFrameworkModuleName());
    }

    @Test
    void testEmptyUriIsRejected() {
        assertThrows(PathResolutionException.class, () -> loader.load("file://"));
    }

    @Test
    void testContainsType(ModuleWorkspace workspace) throws Exception {
        ModuleFixtures.testModule(workspace.root(), "first");
        ModuleHandle framework = ModuleHandle.open(
                workspace.root().resolve(DriverConfig.DEFAULT_FRAMEWORK_MODULE_NAME), "Framework module");

        assertTrue(framework.containsType(FrameworkController.class.getName()));
        assertTrue(framework.containsType(FrameworkController.RunTestsAction.class.getName()));
        assertFalse(framework.containsType("com.testbridge.framework.api.Missing"));
    }
}
