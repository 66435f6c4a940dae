package org.gts3.atlantis.distance.utils;

public enum LogLabel {
    LOG_WARN("CRS-JAVA-WARN-distance "),
    LOG_ERROR("CRS-JAVA-ERR-distance ");

    private final String label;

    LogLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
