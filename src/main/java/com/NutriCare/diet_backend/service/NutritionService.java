package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.AiFeedbackRequest;
import com.NutriCare.diet_backend.dto.request.CalculateNutritionRequest;
import com.NutriCare.diet_backend.dto.response.ComparisonReport;
import com.NutriCare.diet_backend.dto.response.FeedbackResponse;
import com.NutriCare.diet_backend.dto.response.MenuAggregate;
import com.NutriCare.diet_backend.dto.response.NutritionReportResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class NutritionService {

    private final NutritionAggregator nutritionAggregator;
    private final RdaComparator rdaComparator;
    private final NutritionFeedbackClient feedbackClient;

    /**
     * Aggregates the menu and compares it with the profile against one catalog snapshot,
     * so a concurrent upload cannot show up halfway through the report.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public NutritionReportResponse calculate(CalculateNutritionRequest request) {
        MenuAggregate aggregate = nutritionAggregator.aggregate(request.getSelectedFoods());
        ComparisonReport report = rdaComparator.compare(aggregate.getTotals(), request.getRdaProfileName());

        log.info("Nutrition report for {} menu lines against '{}': {} deficit, {} excess, {} not determinable",
                aggregate.getResolvedItems().size(), report.getProfileName(),
                report.getDeficitCount(), report.getExcessCount(), report.getNotDeterminableCount());

        return NutritionReportResponse.builder()
                .selectedMenu(aggregate.getResolvedItems())
                .totalNutrients(aggregate.getTotals())
                .rdaProfileName(report.getProfileName())
                .rdaTargets(report.getTargets())
                .nutrientComparison(report.getComparison())
                .nutrientStatus(report.getStatuses())
                .finalSummary(report.getSummary())
                .build();
    }

    public FeedbackResponse requestFeedback(AiFeedbackRequest request) {
        String feedback = feedbackClient.requestFeedback(request);
        log.info("AI feedback received ({} characters)", feedback.length());
        return new FeedbackResponse(feedback);
    }
}
