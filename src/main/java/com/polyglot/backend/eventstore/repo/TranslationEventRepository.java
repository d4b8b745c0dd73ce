package com.polyglot.backend.eventstore.repo;

import com.polyglot.backend.eventstore.entity.TranslationEventEntity;
import com.polyglot.backend.eventstore.model.EventSlice;
import com.polyglot.backend.eventstore.model.TranslationType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TranslationEventRepository extends JpaRepository<TranslationEventEntity, Long> {

    Optional<TranslationEventEntity> findByIdAndUserEmail(Long id, String userEmail);

    long countByUserEmail(String userEmail);

    /** 新到舊；Slice 會多抓一筆來判斷 hasNext */
    @Query("""
        select e from TranslationEventEntity e
        where e.userEmail = :email
        order by e.createdAt desc, e.id desc
        """)
    Slice<TranslationEventEntity> sliceByUser(@Param("email") String email, Pageable pageable);

    @Query("""
        select e from TranslationEventEntity e
        where e.userEmail = :email
          and e.translationType = :type
        order by e.createdAt desc, e.id desc
        """)
    Slice<TranslationEventEntity> sliceByUserAndType(@Param("email") String email,
                                                     @Param("type") TranslationType type,
                                                     Pageable pageable);

    /**
     * 統計用投影：只取數字欄位，時間區間 [from, to)。
     */
    @Query("""
        select new com.polyglot.backend.eventstore.model.EventSlice(
            e.id, e.sourceLanguage, e.targetLanguage, e.translationType,
            e.characterCount, e.translationTimeMs, e.confidenceScore, e.createdAt)
        from TranslationEventEntity e
        where e.userEmail = :email
          and e.createdAt >= :from
          and e.createdAt < :to
        order by e.createdAt asc, e.id asc
        """)
    List<EventSlice> findSlices(@Param("email") String email,
                                @Param("from") Instant from,
                                @Param("to") Instant to);

    /**
     * 搜尋：pattern 已經轉小寫並跳脫 ! % _（escape 字元為 !），needle 是轉小寫後的原始查詢字串。
     * 相關度：原文命中 2、譯文命中 1、任一邊完全相同再 +3；同分新的在前。筆數上限由 pageable 控制。
     */
    @Query("""
        select e from TranslationEventEntity e
        where e.userEmail = :email
          and (lower(e.originalText) like :pattern escape '!'
               or lower(e.translatedText) like :pattern escape '!')
        order by
          (case when lower(e.originalText) = :needle or lower(e.translatedText) = :needle then 3 else 0 end
           + case when lower(e.originalText) like :pattern escape '!' then 2 else 0 end
           + case when lower(e.translatedText) like :pattern escape '!' then 1 else 0 end) desc,
          e.createdAt desc, e.id desc
        """)
    List<TranslationEventEntity> searchRanked(@Param("email") String email,
                                              @Param("needle") String needle,
                                              @Param("pattern") String pattern,
                                              Pageable pageable);

    @Modifying
    @Query("delete from TranslationEventEntity e where e.userEmail = :email")
    int deleteAllByUserEmail(@Param("email") String email);
}
