package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.response.ComparisonReport;
import com.NutriCare.diet_backend.enums.NutrientStatus;
import com.NutriCare.diet_backend.model.RdaProfile;
import com.NutriCare.diet_backend.util.Constants;
import com.NutriCare.diet_backend.util.NutrientKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares menu totals with an RDA profile. The difference is {@code total - target}; it is
 * null, and the nutrient Not Determinable, when either side is unknown.
 */
@Component
@RequiredArgsConstructor
public class RdaComparator {

    private final CatalogService catalogService;

    public ComparisonReport compare(Map<String, Double> totals, String profileName) {
        return compare(totals, catalogService.findProfile(profileName));
    }

    public ComparisonReport compare(Map<String, Double> totals, RdaProfile profile) {
        Set<String> nutrients = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        nutrients.addAll(profile.getTargets().keySet());
        if (totals != null) {
            nutrients.addAll(totals.keySet());
        }

        Map<String, Double> targets = NutrientKeys.newNutrientMap();
        targets.putAll(profile.getTargets());
        Map<String, Double> comparison = NutrientKeys.newNutrientMap();
        Map<String, NutrientStatus> statuses = NutrientKeys.newNutrientMap();

        for (String nutrient : nutrients) {
            Double total = NutrientKeys.lookup(totals, nutrient);
            Double target = NutrientKeys.lookup(targets, nutrient);
            Double difference = total == null || target == null ? null : total - target;
            comparison.put(nutrient, difference);
            statuses.put(nutrient, classify(difference));
        }

        int deficit = count(statuses, NutrientStatus.DEFICIT);
        int excess = count(statuses, NutrientStatus.EXCESS);
        int meets = count(statuses, NutrientStatus.MEETS_TARGET);
        int unknown = count(statuses, NutrientStatus.NOT_DETERMINABLE);

        return ComparisonReport.builder()
                .profileName(profile.getName())
                .targets(targets)
                .comparison(comparison)
                .statuses(statuses)
                .deficitCount(deficit)
                .excessCount(excess)
                .meetsTargetCount(meets)
                .notDeterminableCount(unknown)
                .summary(summarize(profile.getName(), comparison, statuses, deficit, excess, meets, unknown))
                .build();
    }

    static NutrientStatus classify(Double difference) {
        if (difference == null) {
            return NutrientStatus.NOT_DETERMINABLE;
        }
        if (Math.abs(difference) <= Constants.COMPARISON_TOLERANCE) {
            return NutrientStatus.MEETS_TARGET;
        }
        return difference < 0 ? NutrientStatus.DEFICIT : NutrientStatus.EXCESS;
    }

    /**
     * Counts first, then the magnitude of every deficit and excess, then the nutrients that
     * could not be compared. Same input, same text.
     */
    private String summarize(String profileName, Map<String, Double> comparison, Map<String, NutrientStatus> statuses,
                             int deficit, int excess, int meets, int unknown) {
        if (statuses.isEmpty()) {
            return "Compared to " + profileName + ": no nutrients to compare.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Compared to ").append(profileName).append(": ")
                .append(deficit).append(" deficient, ")
                .append(excess).append(" in excess, ")
                .append(meets).append(" meeting target, ")
                .append(unknown).append(" not determinable.");

        appendMagnitudes(sb, "Deficit", NutrientStatus.DEFICIT, comparison, statuses);
        appendMagnitudes(sb, "Excess", NutrientStatus.EXCESS, comparison, statuses);

        List<String> undetermined = namesWith(statuses, NutrientStatus.NOT_DETERMINABLE);
        if (!undetermined.isEmpty()) {
            sb.append(" Not determinable: ").append(String.join(", ", undetermined)).append('.');
        }
        return sb.toString();
    }

    private void appendMagnitudes(StringBuilder sb, String heading, NutrientStatus status,
                                  Map<String, Double> comparison, Map<String, NutrientStatus> statuses) {
        List<String> parts = new ArrayList<>();
        for (String nutrient : namesWith(statuses, status)) {
            parts.add(nutrient + " " + String.format(Locale.ROOT, "%.1f", Math.abs(comparison.get(nutrient))));
        }
        if (!parts.isEmpty()) {
            sb.append(' ').append(heading).append(": ").append(String.join(", ", parts)).append('.');
        }
    }

    private List<String> namesWith(Map<String, NutrientStatus> statuses, NutrientStatus status) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, NutrientStatus> entry : statuses.entrySet()) {
            if (entry.getValue() == status) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    private int count(Map<String, NutrientStatus> statuses, NutrientStatus status) {
        int count = 0;
        for (NutrientStatus value : statuses.values()) {
            if (value == status) {
                count++;
            }
        }
        return count;
    }
}
