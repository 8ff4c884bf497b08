package com.catalogsync.compare;

import java.util.List;

/**
 * Outcome of comparing the Alma record list with the institution's WorldCat holdings.
 *
 * @param toSet          in Alma but not held in WorldCat
 * @param toUnset        held in WorldCat but no longer in Alma
 * @param noActionNeeded in both lists
 */
public record ComparisonResult(List<String> toSet, List<String> toUnset, List<String> noActionNeeded) {

    public ComparisonResult {
        toSet = List.copyOf(toSet);
        toUnset = List.copyOf(toUnset);
        noActionNeeded = List.copyOf(noActionNeeded);
    }

    public String describe() {
        return "Compared Alma and WorldCat holdings:"
                + System.lineSeparator() + "- " + toSet.size() + " record(s) to set in WorldCat"
                + System.lineSeparator() + "- " + toUnset.size() + " record(s) to unset in WorldCat"
                + System.lineSeparator() + "- " + noActionNeeded.size() + " record(s) with no action needed";
    }
}
