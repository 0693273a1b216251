package org.briltext.cli.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code bril} configuration block.
 *
 * @param moduleDirectory Directory imported modules are loaded from.
 * @param moduleExtension File extension of module files, including the dot.
 * @param emitSignatures Whether the printer writes parameters and return types.
 * @param prettyPrint Whether JSON output is indented.
 */
public record BrilSettings(String moduleDirectory, String moduleExtension, boolean emitSignatures, boolean prettyPrint) {

    /**
     * Reads the settings from a resolved configuration that includes {@code reference.conf}.
     *
     * @param config The configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static BrilSettings from(Config config) {
        Config bril = config.getConfig("bril");
        return new BrilSettings(
                bril.getString("modules.directory"),
                bril.getString("modules.extension"),
                bril.getBoolean("printer.emit-signatures"),
                bril.getBoolean("interchange.pretty-print"));
    }
}
