package org.retroscript.compiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The structured, GUI-facing view of a script. Holds no references into the AST.
 * Instances are mutable and not thread-safe; hand {@link #deepCopy()} snapshots to other threads.
 */
public class ScriptIR {

    private String name = "Untitled";
    private String version = "1.0";
    private String author = "";
    private HotkeysIR hotkeys;
    private final List<ConstantIR> constants = new ArrayList<>();
    private final List<AssetIR> assets = new ArrayList<>();
    private final List<FlowIR> flows = new ArrayList<>();
    private final List<InterruptIR> interrupts = new ArrayList<>();
    private boolean valid = true;
    private final List<String> parseErrors = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    /**
     * @return the hotkeys, or null when the script declares none.
     */
    public HotkeysIR getHotkeys() {
        return hotkeys;
    }

    public void setHotkeys(HotkeysIR hotkeys) {
        this.hotkeys = hotkeys;
    }

    public List<ConstantIR> getConstants() {
        return constants;
    }

    public List<AssetIR> getAssets() {
        return assets;
    }

    public List<FlowIR> getFlows() {
        return flows;
    }

    public List<InterruptIR> getInterrupts() {
        return interrupts;
    }

    public boolean isValid() {
        return valid;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    public List<String> getParseErrors() {
        return parseErrors;
    }

    public Optional<FlowIR> getFlow(String flowName) {
        return flows.stream().filter(f -> f.getName().equals(flowName)).findFirst();
    }

    public Optional<AssetIR> getAsset(String assetId) {
        return assets.stream().filter(a -> a.getId().equals(assetId)).findFirst();
    }

    /**
     * Adds an asset, replacing an existing asset with the same id.
     */
    public void addAsset(AssetIR asset) {
        assets.removeIf(a -> a.getId().equals(asset.getId()));
        assets.add(asset);
    }

    public boolean removeAsset(String assetId) {
        return assets.removeIf(a -> a.getId().equals(assetId));
    }

    public List<String> getAssetIds() {
        return assets.stream().map(AssetIR::getId).toList();
    }

    /**
     * @return an independent copy sharing no mutable state with this instance.
     */
    public ScriptIR deepCopy() {
        ScriptIR copy = new ScriptIR();
        copy.name = name;
        copy.version = version;
        copy.author = author;
        copy.hotkeys = hotkeys == null ? null : hotkeys.deepCopy();
        copy.constants.addAll(constants);
        assets.forEach(a -> copy.assets.add(a.deepCopy()));
        flows.forEach(f -> copy.flows.add(f.deepCopy()));
        interrupts.forEach(i -> copy.interrupts.add(i.deepCopy()));
        copy.valid = valid;
        copy.parseErrors.addAll(parseErrors);
        return copy;
    }
}
