package com.whatshouldido.repository;

import com.whatshouldido.entity.UserTasteProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserTasteProfileRepository extends JpaRepository<UserTasteProfile, String> {
}
