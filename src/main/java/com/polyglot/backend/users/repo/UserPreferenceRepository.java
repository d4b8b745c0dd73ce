package com.polyglot.backend.users.repo;

import com.polyglot.backend.users.entity.UserPreferenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserPreferenceRepository extends JpaRepository<UserPreferenceEntity, Long> {

    /** upsert 用：不管 active 與否都要找得到，避免撞 unique key */
    Optional<UserPreferenceEntity> findByUserEmailAndPreferenceKey(String userEmail, String preferenceKey);

    Optional<UserPreferenceEntity> findByUserEmailAndPreferenceKeyAndActiveTrue(String userEmail, String preferenceKey);

    List<UserPreferenceEntity> findByUserEmailAndActiveTrueOrderByPreferenceKeyAsc(String userEmail);
}
