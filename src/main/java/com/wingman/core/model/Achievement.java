package com.wingman.core.model;

public enum Achievement {
    FIRST_VICTORY("First victory", "Scored a first aerial victory."),
    ACE("Campaign ace", "Reached five aerial victories."),
    VETERAN("Veteran of fifty missions", "Flew fifty sorties.");

    private final String title;
    private final String description;

    Achievement(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }
}
