package com.fcube.app;

import com.fcube.app.commands.AddPluginCommand;
import com.fcube.app.commands.CommandResult;
import com.fcube.app.plugins.BuiltinPlugins;
import com.fcube.common.config.ConfigService;
import com.fcube.common.config.FcubeConfig;
import com.fcube.common.infra.ErrorUtils;
import com.fcube.plugin.loader.PluginDiscovery;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * FCube CLI entry point. The project root is the working directory.
 */
@Slf4j
public class FcubeApplication {

    public static final String ADDPLUGIN = "addplugin";

    static final String USAGE = """
            Usage: fcube <command> [options]

            Commands:
              addplugin    Install a plugin into the current project

            Run 'fcube addplugin --help' for command options.
            """;

    public static void main(String[] args) {
        int exitCode = run(Arrays.asList(args), Path.of("").toAbsolutePath(), System.getenv(),
                System.out, System.err);
        System.exit(exitCode);
    }

    static int run(List<String> args, Path projectRoot, Map<String, String> env,
            PrintStream out, PrintStream err) {
        CommandResult result;
        try {
            result = dispatch(args, projectRoot, env);
        } catch (RuntimeException e) {
            log.error("Unexpected failure: {}", e.getMessage(), e);
            result = CommandResult.failure("InternalError: " + ErrorUtils.formatErrorMessage(e) + "\n");
        }
        if (!result.stdout().isEmpty()) {
            out.print(result.stdout());
            out.flush();
        }
        if (!result.stderr().isEmpty()) {
            err.print(result.stderr());
            err.flush();
        }
        return result.exitCode();
    }

    static CommandResult dispatch(List<String> args, Path projectRoot, Map<String, String> env) {
        if (args.isEmpty()) {
            return CommandResult.usage(USAGE);
        }
        String command = args.get(0);
        if ("-h".equals(command) || "--help".equals(command)) {
            return CommandResult.ok(USAGE);
        }
        if (!ADDPLUGIN.equals(command)) {
            return CommandResult.usage("error: unknown command: " + command + "\n\n" + USAGE);
        }

        FcubeConfig config = ConfigService.forProject(projectRoot, env).loadConfig();
        PluginDiscovery.DiscoveryResult discovery = PluginDiscovery.initializeRegistry(BuiltinPlugins.sources());
        return new AddPluginCommand(discovery.registry(), config, projectRoot)
                .execute(args.subList(1, args.size()));
    }
}
