package lkml.watch.app.model;

import lombok.Value;

import java.util.List;

@Value
public class FilterDecision {
    boolean allowed;
    List<String> matchedFilters;

    public static FilterDecision allow(List<String> matchedFilters) {
        return new FilterDecision(true, List.copyOf(matchedFilters));
    }

    public static FilterDecision reject() {
        return new FilterDecision(false, List.of());
    }

    public boolean hasMatches() {
        return !matchedFilters.isEmpty();
    }
}
