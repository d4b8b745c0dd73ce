package com.polyglot.backend.users.repo;

import com.polyglot.backend.users.entity.UserAccountEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserAccountRepository extends JpaRepository<UserAccountEntity, String> {

    /** 同一個使用者的寫入靠這把 row lock 串行化；不同使用者互不影響 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from UserAccountEntity u where u.email = :email")
    Optional<UserAccountEntity> findByEmailForUpdate(@Param("email") String email);
}
