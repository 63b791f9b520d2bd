package org.retroscript.compiler.ir;

import java.util.Objects;

/**
 * An image asset managed outside the script text.
 */
public class AssetIR {

    public static final double DEFAULT_THRESHOLD = 0.8;

    /** Region of interest in screen pixels. */
    public record Roi(int x, int y, int width, int height) {
    }

    private final String id;
    private String path;
    private double threshold;
    private Roi roi;

    public AssetIR(String id, String path) {
        this(id, path, DEFAULT_THRESHOLD, null);
    }

    public AssetIR(String id, String path, double threshold, Roi roi) {
        this.id = Objects.requireNonNull(id, "id");
        this.path = path;
        this.threshold = threshold;
        this.roi = roi;
    }

    public String getId() {
        return id;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be between 0 and 1: " + threshold);
        }
        this.threshold = threshold;
    }

    public Roi getRoi() {
        return roi;
    }

    public void setRoi(Roi roi) {
        this.roi = roi;
    }

    public AssetIR deepCopy() {
        return new AssetIR(id, path, threshold, roi);
    }
}
