package com.gdiff.maven.diff;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What a diff run produces.
 */
public enum DiffMode {
    /** Forward diff, reverse diff and a recolored reference copy of each input. */
    MATRIX("matrix"),
    /** A single merged document holding the nodes of both inputs. */
    UNION("union");

    private final String key;

    DiffMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static DiffMode parse(String value) {
        if (value != null) {
            for (DiffMode mode : values()) {
                if (mode.key.equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        throw new InvalidModeException(value);
    }

    static List<String> keys() {
        return Arrays.stream(values()).map(DiffMode::key).collect(Collectors.toList());
    }
}
