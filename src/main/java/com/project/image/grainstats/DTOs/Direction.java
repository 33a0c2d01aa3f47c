package com.project.image.grainstats.DTOs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.project.image.grainstats.exceptions.GrainStatsException;

import java.util.Locale;

/** Which side of the height threshold a set of grains was segmented from. */
public enum Direction {
    ABOVE, BELOW;

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Direction fromTag(String value) {
        if (value != null) {
            for (Direction d : values()) {
                if (d.tag().equalsIgnoreCase(value.trim())) return d;
            }
        }
        throw new GrainStatsException("Unknown direction: " + value + ". Supported: above, below");
    }

    @Override
    public String toString() {
        return tag();
    }
}
