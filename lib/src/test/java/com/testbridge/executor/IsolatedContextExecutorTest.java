package com.testbridge.executor;

import com.testbridge.DriverException;
import com.testbridge.FrameworkIncompatibleException;
import com.testbridge.config.DriverConfig;
import com.testbridge.dispatcher.ProgressDispatcher;
import com.testbridge.fixture.LocalSetting;
import com.testbridge.fixture.ModuleFixtures;
import com.testbridge.framework.api.FrameworkController;
import com.testbridge.handler.CallbackHandler;
import com.testbridge.handler.RunTestsCallbackHandler;
import com.testbridge.module.ModuleLoader;
import com.testbridge.test.ModuleJarBuilder;
import com.testbridge.test.ModuleWorkspace;
import com.testbridge.test.ModuleWorkspaceExtension;
import com.testbridge.test.TestEventCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(ModuleWorkspaceExtension.class)
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class IsolatedContextExecutorTest {

    private static final Logger logger = LoggerFactory.getLogger(IsolatedContextExecutorTest.class);

    private final DriverConfig config = new DriverConfig();
    private final IsolatedContextExecutor executor = new IsolatedContextExecutor(config, logger);
    private ExecutionContext context;

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    private ExecutionContext contextFor(Path target) {
        context = executor.createContext(new ModuleLoader(config).load(target.toString()));
        return context;
    }

    @Test
    void testControllerLivesInIsolatedLoader(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first"));

        ControllerHandle handle = executor.createController(ctx, "", Map.of());

        assertSame(ctx.getClassLoader(), handle.controller().getClass().getClassLoader());
        assertNotSame(FrameworkController.class, handle.controller().getClass());
        assertNull(ctx.getClassLoader().getParent().getParent());
    }

    @Test
    void testLoadAndCountThroughActionObjects(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first", "second"));
        ControllerHandle handle = executor.createController(ctx, "7-", Map.of("WorkDirectory", "/tmp"));

        CallbackHandler load = new CallbackHandler();
        executor.dispatch(FrameworkAction.load(), handle, load);
        CallbackHandler count = new CallbackHandler();
        executor.dispatch(FrameworkAction.count(null), handle, count);

        assertTrue(load.getResult().startsWith("<test-suite type=\"Assembly\" id=\"7-0\""));
        assertTrue(load.getResult().contains("settings=\"1\""));
        assertEquals("2", count.getResult());
    }

    @Test
    void testContextClassLoaderIsRestored(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first"));
        ControllerHandle handle = executor.createController(ctx, "", Map.of());
        ClassLoader before = Thread.currentThread().getContextClassLoader();

        executor.dispatch(FrameworkAction.explore(null), handle, new CallbackHandler());

        assertSame(before, Thread.currentThread().getContextClassLoader());
    }

    @Test
    void testRunReportsProgressThroughHandler(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first", "failing"));
        ControllerHandle handle = executor.createController(ctx, "", Map.of());
        ProgressDispatcher dispatcher = ProgressDispatcher.cachedThreadDispatcher("isolated-test");
        try {
            TestEventCapture capture = TestEventCapture.create();
            RunTestsCallbackHandler handler = new RunTestsCallbackHandler(capture, config, dispatcher, logger);

            executor.dispatch(FrameworkAction.run(null), handle, handler);

            String result = handler.getResult();
            assertTrue(result.startsWith("<test-run"));
            assertTrue(result.contains("result=\"Failed\""));
            assertEquals(result, capture.last());
            assertEquals(2, capture.elements("test-case").size());
        } finally {
            dispatcher.shutdown();
        }
    }

    @Test
    void testMissingControllerType(ModuleWorkspace workspace) throws Exception {
        Path target = ModuleFixtures.testModuleWithFramework(workspace.root(),
                ModuleJarBuilder.create().addResource("README", "no controller here"), "first");
        ExecutionContext ctx = contextFor(target);

        FrameworkIncompatibleException e = assertThrows(FrameworkIncompatibleException.class,
                () -> executor.createController(ctx, "", Map.of()));
        assertEquals(AbstractFrameworkExecutor.INVALID_FRAMEWORK_MESSAGE, e.getMessage());
    }

    @Test
    void testControllerWithoutActions(ModuleWorkspace workspace) throws Exception {
        DriverConfig partialConfig = new DriverConfig()
                .setControllerTypeName(com.testbridge.framework.partial.FrameworkController.class.getName());
        IsolatedContextExecutor partialExecutor = new IsolatedContextExecutor(partialConfig, logger);
        Path target = ModuleFixtures.testModuleWithFramework(workspace.root(),
                ModuleJarBuilder.create().addClass(com.testbridge.framework.partial.FrameworkController.class), "first");
        context = partialExecutor.createContext(new ModuleLoader(partialConfig).load(target.toString()));

        FrameworkIncompatibleException e = assertThrows(FrameworkIncompatibleException.class,
                () -> partialExecutor.createController(context, "", Map.of()));
        assertEquals(AbstractFrameworkExecutor.INVALID_FRAMEWORK_MESSAGE, e.getMessage());
    }

    @Test
    void testSettingTypeUnknownToFramework(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first"));

        FrameworkIncompatibleException e = assertThrows(FrameworkIncompatibleException.class,
                () -> executor.createController(ctx, "", Map.of("Local", new LocalSetting("value"))));
        assertEquals(AbstractFrameworkExecutor.UNSUPPORTED_MODULE_MESSAGE, e.getMessage());
        assertInstanceOf(ClassNotFoundException.class, e.getCause());
    }

    @Test
    void testControllerFailureIsNotAnIncompatibility(ModuleWorkspace workspace) throws Exception {
        ExecutionContext ctx = contextFor(ModuleFixtures.testModule(workspace.root(), "first"));

        DriverException e = assertThrows(DriverException.class, () -> executor.createController(ctx, "",
                Map.of(FrameworkController.FAIL_CONSTRUCTION_SETTING, true)));
        assertFalse(e instanceof FrameworkIncompatibleException);
        assertEquals(IllegalStateException.class.getName(), e.getCause().getClass().getName());
    }
}
