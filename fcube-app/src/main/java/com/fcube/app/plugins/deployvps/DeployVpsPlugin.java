package com.fcube.app.plugins.deployvps;

import com.fcube.plugin.GeneratedFile;
import com.fcube.plugin.PluginMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code deploy_vps}: Docker Compose, Nginx, SSL, Redis and Celery deployment
 * kit. Installs into {@code deploy-vps/} next to the app directory rather
 * than inside it.
 */
public final class DeployVpsPlugin {

    public static final String NAME = "deploy_vps";
    public static final String VERSION = "1.0.0";
    public static final String DEPLOY_DIR = "deploy-vps";

    private static final String POST_INSTALL_NOTES = """
            1. Navigate to the deploy-vps directory:
               cd deploy-vps

            2. Copy and configure the environment file:
               cp config.env.example config.env

            3. Make scripts executable (on Linux/macOS):
               chmod +x scripts/*.sh scripts/optional/*.sh scripts/common/*.sh

            4. Run the setup wizard:
               ./scripts/setup.sh

            5. Validate configuration:
               ./scripts/validate.sh --env production

            6. Deploy:
               ./scripts/deploy.sh init --env production

            7. Setup SSL:
               ./scripts/ssl.sh setup --env production

            For detailed instructions, see deploy-vps/QUICK_START.md
            """;

    private DeployVpsPlugin() {
    }

    public static PluginMetadata metadata() {
        return PluginMetadata.builder()
                .name(NAME)
                .description("Complete VPS deployment system with Docker, Nginx, SSL, Redis, Celery, and Flower")
                .version(VERSION)
                .filesGenerated(List.of(
                        "deploy-vps/.gitignore",
                        "deploy-vps/config.env.example",
                        "deploy-vps/README.md",
                        "deploy-vps/QUICK_START.md",
                        "deploy-vps/generated/.gitkeep",
                        "deploy-vps/templates/env/production.env.template",
                        "deploy-vps/templates/env/staging.env.template",
                        "deploy-vps/templates/docker/production.compose.yml.template",
                        "deploy-vps/templates/docker/staging.compose.yml.template",
                        "deploy-vps/templates/nginx/nginx.conf.template",
                        "deploy-vps/templates/nginx/api.conf.template",
                        "deploy-vps/templates/nginx/flower.conf.template",
                        "deploy-vps/templates/redis/redis.conf.template",
                        "deploy-vps/templates/redis/redis-password.conf.template",
                        "deploy-vps/scripts/common/common.sh",
                        "deploy-vps/scripts/common/template-engine.sh",
                        "deploy-vps/scripts/common/validation.sh",
                        "deploy-vps/scripts/setup.sh",
                        "deploy-vps/scripts/validate.sh",
                        "deploy-vps/scripts/deploy.sh",
                        "deploy-vps/scripts/ssl.sh",
                        "deploy-vps/scripts/optional/backup.sh",
                        "deploy-vps/scripts/optional/security-setup.sh"))
                .configRequired(true)
                .postInstallNotes(POST_INSTALL_NOTES)
                .contentGenerator(DeployVpsPlugin::generate)
                .build();
    }

    static List<GeneratedFile> generate(Path appDir) {
        Path parent = appDir.toAbsolutePath().normalize().getParent();
        Path dir = (parent != null ? parent : appDir).resolve(DEPLOY_DIR);
        Path templates = dir.resolve("templates");
        Path scripts = dir.resolve("scripts");
        return List.of(
                GeneratedFile.of(dir.resolve(".gitignore"), DeployVpsTemplates.gitignore()),
                GeneratedFile.of(dir.resolve("config.env.example"), DeployVpsTemplates.configEnvExample()),
                GeneratedFile.of(dir.resolve("README.md"), DeployVpsTemplates.readme()),
                GeneratedFile.of(dir.resolve("QUICK_START.md"), DeployVpsTemplates.quickStart()),
                GeneratedFile.of(dir.resolve("generated/.gitkeep"), ""),
                GeneratedFile.of(templates.resolve("env/production.env.template"),
                        DeployVpsTemplates.envTemplate("production")),
                GeneratedFile.of(templates.resolve("env/staging.env.template"),
                        DeployVpsTemplates.envTemplate("staging")),
                GeneratedFile.of(templates.resolve("docker/production.compose.yml.template"),
                        DeployVpsTemplates.composeTemplate("production")),
                GeneratedFile.of(templates.resolve("docker/staging.compose.yml.template"),
                        DeployVpsTemplates.composeTemplate("staging")),
                GeneratedFile.of(templates.resolve("nginx/nginx.conf.template"), DeployVpsTemplates.nginxConf()),
                GeneratedFile.of(templates.resolve("nginx/api.conf.template"), DeployVpsTemplates.apiConf()),
                GeneratedFile.of(templates.resolve("nginx/flower.conf.template"), DeployVpsTemplates.flowerConf()),
                GeneratedFile.of(templates.resolve("redis/redis.conf.template"), DeployVpsTemplates.redisConf()),
                GeneratedFile.of(templates.resolve("redis/redis-password.conf.template"),
                        DeployVpsTemplates.redisPasswordConf()),
                GeneratedFile.of(scripts.resolve("common/common.sh"), DeployVpsScripts.common()),
                GeneratedFile.of(scripts.resolve("common/template-engine.sh"), DeployVpsScripts.templateEngine()),
                GeneratedFile.of(scripts.resolve("common/validation.sh"), DeployVpsScripts.validation()),
                GeneratedFile.of(scripts.resolve("setup.sh"), DeployVpsScripts.setup()),
                GeneratedFile.of(scripts.resolve("validate.sh"), DeployVpsScripts.validate()),
                GeneratedFile.of(scripts.resolve("deploy.sh"), DeployVpsScripts.deploy()),
                GeneratedFile.of(scripts.resolve("ssl.sh"), DeployVpsScripts.ssl()),
                GeneratedFile.of(scripts.resolve("optional/backup.sh"), DeployVpsScripts.backup()),
                GeneratedFile.of(scripts.resolve("optional/security-setup.sh"), DeployVpsScripts.securitySetup()));
    }
}
