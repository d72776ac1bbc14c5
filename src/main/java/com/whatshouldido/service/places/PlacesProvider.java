package com.whatshouldido.service.places;

import com.whatshouldido.model.Place;

import java.util.List;

/**
 * 주변 장소 검색 provider
 * 일부 타입 검색이 실패해도 나머지 결과를 반환하며, 빈 리스트도 정상 결과다.
 * 결과를 전혀 만들 수 없을 때만 예외를 던진다.
 */
public interface PlacesProvider {

    List<Place> search(double latitude, double longitude, int radiusMeters, PlaceSearchFilters filters);
}
