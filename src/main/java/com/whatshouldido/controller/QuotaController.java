package com.whatshouldido.controller;

import com.whatshouldido.dto.response.QuotaResponse;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.service.quota.QuotaService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = {"http://localhost:3000"})
public class QuotaController {

    @Autowired
    private QuotaService quotaService;

    /**
     * 남은 쿼터 조회
     * GET /api/quota
     */
    @GetMapping("/quota")
    public ResponseEntity<QuotaResponse> getQuota(
            @RequestHeader(value = SuggestionsController.USER_ID_HEADER, required = false) String userId
    ) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(List.of("X-User-Id header is required"));
        }

        boolean premium = quotaService.isPremium(userId);
        if (!premium) {
            quotaService.initializeIfNeeded(userId);
        }

        QuotaResponse response = QuotaResponse.builder()
                .userId(userId)
                .premium(premium)
                .remaining(premium ? Integer.MAX_VALUE : quotaService.getRemaining(userId))
                .limit(premium ? Integer.MAX_VALUE : quotaService.getDefaultQuota())
                .build();
        return ResponseEntity.ok(response);
    }
}
