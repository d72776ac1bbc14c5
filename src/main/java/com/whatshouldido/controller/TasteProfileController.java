package com.whatshouldido.controller;

import com.whatshouldido.dto.request.TasteProfileRequest;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.service.profile.TasteProfileService;
import com.whatshouldido.service.scoring.TasteProfile;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 취향 퀴즈 결과 저장 / 피드백
 */
@RestController
@RequestMapping("/api/taste-profile")
@CrossOrigin(origins = {"http://localhost:3000"})
public class TasteProfileController {

    @Autowired
    private TasteProfileService tasteProfileService;

    @PutMapping
    public ResponseEntity<TasteProfile> saveProfile(
            @RequestBody TasteProfileRequest request,
            @RequestHeader(value = SuggestionsController.USER_ID_HEADER, required = false) String userId
    ) {
        requireUser(userId);
        return ResponseEntity.ok(tasteProfileService.save(userId, request.getWeights(), request.getNoveltyTolerance()));
    }

    @PostMapping("/feedback")
    public ResponseEntity<TasteProfile> applyFeedback(
            @RequestBody TasteProfileRequest request,
            @RequestHeader(value = SuggestionsController.USER_ID_HEADER, required = false) String userId
    ) {
        requireUser(userId);
        return ResponseEntity.ok(tasteProfileService.applyFeedback(userId, request.getWeights()));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(List.of("X-User-Id header is required"));
        }
    }
}
