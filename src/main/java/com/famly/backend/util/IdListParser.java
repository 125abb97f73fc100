package com.famly.backend.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parses the comma-joined id lists accepted by the thread routes.
 */
public final class IdListParser {

    private IdListParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Split, trim and validate. Blank input gives an empty list; repeated ids keep their
     * first position.
     *
     * @throws com.famly.backend.exception.InvalidKeyException if any entry is not a UUID
     */
    public static List<String> parse(String joined, String type) {
        if (joined == null || joined.isBlank()) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (String part : joined.split(",")) {
            String id = part.trim();
            if (id.isEmpty()) {
                continue;
            }
            FamlyKeyFactory.validateId(id, type);
            ids.add(id);
        }
        return new ArrayList<>(ids);
    }
}
