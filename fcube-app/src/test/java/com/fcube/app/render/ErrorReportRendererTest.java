package com.fcube.app.render;

import com.fcube.plugin.errors.MissingDependencyException;
import com.fcube.plugin.errors.PartialWriteException;
import com.fcube.plugin.errors.PluginErrorKind;
import com.fcube.plugin.errors.PluginException;
import com.fcube.plugin.errors.PluginNotFoundException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReportRendererTest {

    private static final Path ROOT = Path.of("/work/shop").toAbsolutePath();

    @Test
    void missingDependencies_getOneRemedyEach() {
        String out = ErrorReportRenderer.render(
                new MissingDependencyException("shop", List.of("user", "billing")), ROOT);

        assertTrue(out.startsWith("MissingDependencyError: plugin 'shop' requires missing module(s): user, billing\n"));
        assertTrue(out.contains("   fcube adduser --auth-type email\n"));
        assertTrue(out.contains("   fcube startmodule billing\n"));
    }

    @Test
    void notFound_listsKnownPlugins() {
        String out = ErrorReportRenderer.render(
                new PluginNotFoundException("payments", List.of(), List.of("deploy_vps", "referral")), ROOT);

        assertTrue(out.startsWith("PluginNotFoundError: unknown plugin 'payments'\n"));
        assertTrue(out.contains("Available plugins: deploy_vps, referral"));
    }

    @Test
    void partialWrite_listsWrittenFilesRelativeToRoot() {
        String out = ErrorReportRenderer.render(new PartialWriteException("referral",
                List.of(ROOT.resolve("app/referral/__init__.py")), ROOT.resolve("app/referral/models.py"),
                new IOException("disk full")), ROOT);

        assertTrue(out.startsWith("PartialWriteError: "));
        assertTrue(out.contains("disk full"));
        assertTrue(out.contains("  app/referral/__init__.py\n"));
    }

    @Test
    void otherKinds_printLabelAndMessage() {
        String out = ErrorReportRenderer.render(
                new PluginException(PluginErrorKind.GENERATOR_FAILED, "boom"), ROOT);
        assertEquals("GeneratorFailedError: boom\n", out);
    }
}
