package com.whatshouldido.controller;

import com.whatshouldido.dto.request.CreateSuggestionsRequest;
import com.whatshouldido.dto.response.SuggestionsResponse;
import com.whatshouldido.service.quota.QuotaService;
import com.whatshouldido.service.suggestion.SuggestionOrchestrator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 의도 기반 추천 API
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = {"http://localhost:3000"})
public class SuggestionsController {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String QUOTA_REMAINING_HEADER = "X-Quota-Remaining";
    public static final String QUOTA_LIMIT_HEADER = "X-Quota-Limit";

    @Autowired
    private SuggestionOrchestrator suggestionOrchestrator;

    @Autowired
    private QuotaService quotaService;

    /**
     * 추천 생성
     * POST /api/suggestions
     * 로그인 사용자(무료)는 요청당 쿼터 1 차감, 응답 헤더로 남은 쿼터 전달
     */
    @PostMapping("/suggestions")
    public ResponseEntity<SuggestionsResponse> createSuggestions(
            @RequestBody CreateSuggestionsRequest request,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userId
    ) {
        SuggestionsResponse response = suggestionOrchestrator.createSuggestions(request, userId);

        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        if (userId != null && !userId.isBlank() && !quotaService.isPremium(userId)) {
            builder.header(QUOTA_REMAINING_HEADER, String.valueOf(quotaService.getRemaining(userId)))
                    .header(QUOTA_LIMIT_HEADER, String.valueOf(quotaService.getDefaultQuota()));
        }
        return builder.body(response);
    }
}
