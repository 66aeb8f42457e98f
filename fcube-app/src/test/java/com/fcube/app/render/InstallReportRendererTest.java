package com.fcube.app.render;

import com.fcube.plugin.install.InstallMode;
import com.fcube.plugin.install.InstallOutcome;
import com.fcube.plugin.plan.FileAction;
import com.fcube.plugin.plan.FilePlanEntry;
import com.fcube.plugin.plan.InstallPlan;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstallReportRendererTest {

    private static final Path ROOT = Path.of("/work/shop").toAbsolutePath();

    private static FilePlanEntry entry(String relative, FileAction action) {
        return new FilePlanEntry(ROOT.resolve(relative), relative, "", 0, action == FileAction.OVERWRITE, action);
    }

    @Test
    void render_reportsFilesTreeSummaryAndNotes() {
        List<FilePlanEntry> entries = List.of(
                entry("app/referral/__init__.py", FileAction.CREATE),
                entry("app/referral/models.py", FileAction.OVERWRITE),
                entry("app/referral/crud/__init__.py", FileAction.CREATE));
        InstallPlan plan = new InstallPlan("referral", "1.0.0", "Run migrations.", ROOT, ROOT.resolve("app"),
                entries, List.of());
        InstallOutcome outcome = new InstallOutcome("referral", "1.0.0", InstallMode.APPLY, plan,
                entries.stream().map(FilePlanEntry::path).toList(), "Run migrations.", true, List.of("user"));

        String out = InstallReportRenderer.render(outcome);

        assertTrue(out.contains("  Created:   app/referral/__init__.py\n"));
        assertTrue(out.contains("  Overwrote: app/referral/models.py\n"));
        assertTrue(out.contains("""
                └── app/
                    └── referral/
                        ├── crud/
                        │   └── __init__.py
                        ├── __init__.py
                        └── models.py
                """));
        assertTrue(out.matches("(?s).*Location:\\s+app/referral\n.*"));
        assertTrue(out.matches("(?s).*Files written:\\s+3 \\(1 overwritten\\)\n.*"));
        assertTrue(out.matches("(?s).*Dependencies:\\s+user\n.*"));
        assertTrue(out.matches("(?s).*Config required:\\s+yes\n.*"));
        assertTrue(out.contains("Next steps:\n  Run migrations.\n"));
        assertTrue(out.endsWith("Plugin 'referral' added successfully!\n"));
    }

    @Test
    void commonDirectory_ofSiblingTrees() {
        assertEquals("deploy-vps", InstallReportRenderer.commonDirectory(List.of(
                entry("deploy-vps/README.md", FileAction.CREATE),
                entry("deploy-vps/scripts/setup.sh", FileAction.CREATE))));
        assertEquals(".", InstallReportRenderer.commonDirectory(List.of(
                entry("a/x.txt", FileAction.CREATE),
                entry("b/y.txt", FileAction.CREATE))));
    }
}
