package com.fcube.app.plugins.referral;

import com.fcube.plugin.GeneratedFile;
import com.fcube.plugin.PluginMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code referral}: user referral system with per-user-type completion
 * strategies and milestone tracking. Installs into {@code <app>/referral}.
 */
public final class ReferralPlugin {

    public static final String NAME = "referral";
    public static final String VERSION = "1.0.0";

    private static final String POST_INSTALL_NOTES = """
            1. Add a referral_code field to the User model:
               referral_code: Mapped[Optional[str]] = mapped_column(String(20), unique=True, nullable=True)

            2. Create a UserReferralIntegration service in app/user/services/

            3. Update alembic_models_import.py:
               from app.referral.models import Referral, ReferralEvent, ReferralSettings

            4. Create a strategy for your user types in app/referral/strategies.py

            5. Trigger referral events from your modules:
               await referral_service.process_event(session, "booking_completed", user_id, {"booking_id": ...})
            """;

    private ReferralPlugin() {
    }

    public static PluginMetadata metadata() {
        return PluginMetadata.builder()
                .name(NAME)
                .description("User referral system with configurable completion strategies and milestone tracking")
                .version(VERSION)
                .dependencies(List.of("user"))
                .filesGenerated(List.of(
                        "app/referral/__init__.py",
                        "app/referral/models.py",
                        "app/referral/config.py",
                        "app/referral/strategies.py",
                        "app/referral/exceptions.py",
                        "app/referral/dependencies.py",
                        "app/referral/tasks.py",
                        "app/referral/schemas/__init__.py",
                        "app/referral/schemas/referral_schemas.py",
                        "app/referral/crud/__init__.py",
                        "app/referral/crud/referral_crud.py",
                        "app/referral/services/__init__.py",
                        "app/referral/services/referral_service.py",
                        "app/referral/routes/__init__.py",
                        "app/referral/routes/referral_routes.py",
                        "app/referral/routes/referral_admin_routes.py"))
                .configRequired(true)
                .postInstallNotes(POST_INSTALL_NOTES)
                .contentGenerator(ReferralPlugin::generate)
                .build();
    }

    static List<GeneratedFile> generate(Path appDir) {
        Path dir = appDir.resolve(NAME);
        return List.of(
                GeneratedFile.of(dir.resolve("__init__.py"), ReferralTemplates.packageInit()),
                GeneratedFile.of(dir.resolve("models.py"), ReferralTemplates.models()),
                GeneratedFile.of(dir.resolve("config.py"), ReferralTemplates.config()),
                GeneratedFile.of(dir.resolve("strategies.py"), ReferralTemplates.strategies()),
                GeneratedFile.of(dir.resolve("exceptions.py"), ReferralTemplates.exceptions()),
                GeneratedFile.of(dir.resolve("dependencies.py"), ReferralTemplates.dependencies()),
                GeneratedFile.of(dir.resolve("tasks.py"), ReferralTemplates.tasks()),
                GeneratedFile.of(dir.resolve("schemas/__init__.py"), ReferralTemplates.schemasInit()),
                GeneratedFile.of(dir.resolve("schemas/referral_schemas.py"), ReferralTemplates.schemas()),
                GeneratedFile.of(dir.resolve("crud/__init__.py"), ReferralTemplates.crudInit()),
                GeneratedFile.of(dir.resolve("crud/referral_crud.py"), ReferralTemplates.crud()),
                GeneratedFile.of(dir.resolve("services/__init__.py"), ReferralTemplates.servicesInit()),
                GeneratedFile.of(dir.resolve("services/referral_service.py"), ReferralTemplates.service()),
                GeneratedFile.of(dir.resolve("routes/__init__.py"), ReferralTemplates.routesInit()),
                GeneratedFile.of(dir.resolve("routes/referral_routes.py"), ReferralTemplates.routes()),
                GeneratedFile.of(dir.resolve("routes/referral_admin_routes.py"), ReferralTemplates.adminRoutes()));
    }
}
