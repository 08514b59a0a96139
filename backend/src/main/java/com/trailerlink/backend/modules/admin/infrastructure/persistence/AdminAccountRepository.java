package com.trailerlink.backend.modules.admin.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.trailerlink.backend.modules.admin.domain.AdminAccount;

public interface AdminAccountRepository extends JpaRepository<AdminAccount, String> {

    List<AdminAccount> findAllByOrderByCreatedAtDescUsernameAsc();

    /**
     * Inserts the account unless the username is taken.
     *
     * @return 1 when a row was created, 0 when the username already existed
     */
    @Modifying
    @Query(value = """
            INSERT INTO admin_account (username, password_hash, role, created_at)
            VALUES (:username, :passwordHash, :role, :createdAt)
            ON CONFLICT (username) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("username") String username,
                       @Param("passwordHash") String passwordHash,
                       @Param("role") String role,
                       @Param("createdAt") OffsetDateTime createdAt);
}
