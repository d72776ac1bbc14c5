package com.whatshouldido.service.suggestion;

import com.whatshouldido.dto.request.CreateSuggestionsRequest;
import com.whatshouldido.model.BudgetLevel;
import com.whatshouldido.model.SuggestionIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 요청 형태 검증 (필수값, 목록 크기, 문자열 길이). 위반 사항을 모두 모아서 반환한다.
 */
@Component
public class CreateSuggestionsRequestValidator {

    static final int MAX_CATEGORY_FILTERS = 10;
    static final int MAX_DIETARY_RESTRICTIONS = 5;
    static final int MAX_AREA_NAME_LENGTH = 100;

    public List<String> validate(CreateSuggestionsRequest request) {
        List<String> errors = new ArrayList<>();

        if (request.getIntent() == null || request.getIntent().isBlank()) {
            errors.add("Intent is required");
        } else if (SuggestionIntent.parse(request.getIntent()).isEmpty()) {
            errors.add("Intent must be one of QUICK, FOOD_ONLY, ACTIVITY_ONLY, ROUTE_PLANNING, TRY_SOMETHING_NEW");
        }
        if (request.getLatitude() == null) {
            errors.add("Latitude is required");
        }
        if (request.getLongitude() == null) {
            errors.add("Longitude is required");
        }
        if (request.getBudgetLevel() != null && BudgetLevel.parse(request.getBudgetLevel()).isEmpty()) {
            errors.add("Budget level must be one of FREE, INEXPENSIVE, MODERATE, EXPENSIVE, VERY_EXPENSIVE");
        }
        if (request.getIncludeCategories() != null && request.getIncludeCategories().size() > MAX_CATEGORY_FILTERS) {
            errors.add("Maximum 10 include categories allowed");
        }
        if (request.getExcludeCategories() != null && request.getExcludeCategories().size() > MAX_CATEGORY_FILTERS) {
            errors.add("Maximum 10 exclude categories allowed");
        }
        if (request.getDietaryRestrictions() != null
                && request.getDietaryRestrictions().size() > MAX_DIETARY_RESTRICTIONS) {
            errors.add("Maximum 5 dietary restrictions allowed");
        }
        if (request.getAreaName() != null && request.getAreaName().length() > MAX_AREA_NAME_LENGTH) {
            errors.add("Area name cannot exceed 100 characters");
        }
        return errors;
    }
}
