package io.stelli.core.criteria;

/** Kind of filter criterion. The available pool holds at most one template per type. */
public enum FilterType {
    RATING("rating", "Rating", "star"),
    DATE("date", "Date Range", "calendar");

    private final String wireName;
    private final String defaultLabel;
    private final String defaultIcon;

    FilterType(String wireName, String defaultLabel, String defaultIcon) {
        this.wireName = wireName;
        this.defaultLabel = defaultLabel;
        this.defaultIcon = defaultIcon;
    }

    public String wireName() {
        return wireName;
    }

    public String defaultLabel() {
        return defaultLabel;
    }

    public String defaultIcon() {
        return defaultIcon;
    }
}
