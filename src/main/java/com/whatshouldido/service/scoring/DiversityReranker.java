package com.whatshouldido.service.scoring;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 스코어링 이후 같은 카테고리가 연달아 나오지 않도록 재정렬한다.
 * 실효 점수 = score - diversityFactor * 0.1 * (이미 선택된 같은 주 카테고리 수).
 * 점수만 사용하며 (novelty는 스코어링 단계의 신호), 동점은 입력 순서를 따른다.
 */
@Component
public class DiversityReranker {

    static final double CATEGORY_REPEAT_PENALTY = 0.1;

    public List<ScoredPlace> rerank(List<ScoredPlace> ranked, double diversityFactor) {
        if (ranked.size() < 2 || diversityFactor <= 0) {
            return new ArrayList<>(ranked);
        }

        List<ScoredPlace> remaining = new ArrayList<>(ranked);
        List<ScoredPlace> result = new ArrayList<>(ranked.size());
        Map<String, Integer> selectedPerCategory = new HashMap<>();

        while (!remaining.isEmpty()) {
            int bestIndex = 0;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                ScoredPlace candidate = remaining.get(i);
                int repeats = selectedPerCategory.getOrDefault(candidate.getPlace().primaryCategory(), 0);
                double effective = candidate.getScore() - diversityFactor * CATEGORY_REPEAT_PENALTY * repeats;
                if (effective > bestScore) {
                    bestScore = effective;
                    bestIndex = i;
                }
            }

            ScoredPlace chosen = remaining.remove(bestIndex);
            selectedPerCategory.merge(chosen.getPlace().primaryCategory(), 1, Integer::sum);
            result.add(chosen);
        }
        return result;
    }
}
