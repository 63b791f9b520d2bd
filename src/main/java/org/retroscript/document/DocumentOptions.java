package org.retroscript.document;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Settings of a {@link ScriptDocument}, read from the {@code retroscript} configuration tree.
 *
 * @param partialInputDetection whether to skip parsing while the text looks incomplete
 * @param debounce              quiet period used by {@link DocumentSyncManager}
 * @param defaultFlowName       name of the flow created by {@link ScriptDocument#newDocument()}
 * @param startKey              default start hotkey of a new document
 * @param stopKey               default stop hotkey of a new document
 * @param pauseKey              default pause hotkey of a new document
 */
public record DocumentOptions(boolean partialInputDetection, Duration debounce, String defaultFlowName,
                              String startKey, String stopKey, String pauseKey) {

    /**
     * @return the options defined by the bundled {@code reference.conf}.
     */
    public static DocumentOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    public static DocumentOptions fromConfig(Config config) {
        Config document = config.getConfig("retroscript.document");
        Config hotkeys = config.getConfig("retroscript.ir.default-hotkeys");
        return new DocumentOptions(
                document.getBoolean("partial-input-detection"),
                document.getDuration("debounce"),
                document.getString("default-flow-name"),
                hotkeys.getString("start"),
                hotkeys.getString("stop"),
                hotkeys.getString("pause"));
    }
}
