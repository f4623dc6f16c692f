package com.codesurvey.core.util;

import com.codesurvey.core.exception.SurveyConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers for validating the names that namespace persisted survey results.
 */
public final class Names {

    private Names() {
        // Utility class
    }

    /**
     * Returns the values that occur more than once, each listed once, in order of
     * their second occurrence.
     *
     * @param names names to check
     * @return duplicated names (empty if all are unique)
     */
    public static List<String> duplicates(Collection<String> names) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (String name : names) {
            if (!seen.add(name) && !duplicates.contains(name)) {
                duplicates.add(name);
            }
        }
        return duplicates;
    }

    /**
     * Checks that a name is usable as a persisted identifier.
     *
     * @param name candidate name
     * @param what description used in the error message (e.g. "source")
     * @return the name
     * @throws SurveyConfigurationException if the name is null or blank
     */
    public static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new SurveyConfigurationException(what + " name must not be blank");
        }
        return name;
    }
}
