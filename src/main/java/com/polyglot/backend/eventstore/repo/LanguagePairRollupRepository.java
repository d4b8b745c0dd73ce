package com.polyglot.backend.eventstore.repo;

import com.polyglot.backend.eventstore.entity.LanguagePairRollupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LanguagePairRollupRepository extends JpaRepository<LanguagePairRollupEntity, Long> {

    Optional<LanguagePairRollupEntity> findByUserEmailAndSourceLanguageAndTargetLanguage(
            String userEmail, String sourceLanguage, String targetLanguage);

    List<LanguagePairRollupEntity> findByUserEmail(String userEmail);

    @Modifying
    @Query("delete from LanguagePairRollupEntity r where r.userEmail = :email")
    int deleteAllByUserEmail(@Param("email") String email);
}
