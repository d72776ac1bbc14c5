package com.whatshouldido.controller;

import com.whatshouldido.dto.request.ExclusionRequest;
import com.whatshouldido.entity.UserExclusion;
import com.whatshouldido.exception.ValidationException;
import com.whatshouldido.service.history.UserHistoryService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * "다시 보지 않기" 장소 관리
 */
@RestController
@RequestMapping("/api/exclusions")
@CrossOrigin(origins = {"http://localhost:3000"})
public class ExclusionController {

    private static final int MAX_EXCLUSION_DAYS = 3650;

    @Autowired
    private UserHistoryService userHistoryService;

    @PostMapping
    public ResponseEntity<UserExclusion> addExclusion(
            @RequestBody ExclusionRequest request,
            @RequestHeader(value = SuggestionsController.USER_ID_HEADER, required = false) String userId
    ) {
        List<String> errors = new ArrayList<>();
        if (userId == null || userId.isBlank()) {
            errors.add("X-User-Id header is required");
        }
        if (request.getPlaceId() == null || request.getPlaceId().isBlank()) {
            errors.add("Place id is required");
        }
        if (request.getDays() != null && (request.getDays() < 1 || request.getDays() > MAX_EXCLUSION_DAYS)) {
            errors.add("Days must be between 1 and 3650");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        UserExclusion saved = userHistoryService.addExclusion(userId, request.getPlaceId(),
                request.getPlaceName(), request.getReason(), request.getDays());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @DeleteMapping("/{placeId}")
    public ResponseEntity<Void> removeExclusion(
            @PathVariable String placeId,
            @RequestHeader(value = SuggestionsController.USER_ID_HEADER, required = false) String userId
    ) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(List.of("X-User-Id header is required"));
        }
        boolean removed = userHistoryService.removeExclusion(userId, placeId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
