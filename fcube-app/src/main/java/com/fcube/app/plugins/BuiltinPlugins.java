package com.fcube.app.plugins;

import com.fcube.app.plugins.deployvps.DeployVpsPlugin;
import com.fcube.app.plugins.referral.ReferralPlugin;
import com.fcube.plugin.PluginSource;

import java.util.List;

/**
 * Compile-time table of the plugins shipped with the CLI. New plugins are
 * added here.
 */
public final class BuiltinPlugins {

    private BuiltinPlugins() {
    }

    public static List<PluginSource> sources() {
        return List.of(
                ReferralPlugin::metadata,
                DeployVpsPlugin::metadata);
    }
}
