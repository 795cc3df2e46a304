package com.librarycatalog.repo;

import com.librarycatalog.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    // Provider id match first, then email; a null argument never matches
    @Query("""
           SELECT u FROM User u
           WHERE u.googleId = :googleId OR u.email = :email
           ORDER BY CASE WHEN u.googleId = :googleId THEN 0 ELSE 1 END, u.id ASC
           """)
    List<User> findByGoogleIdOrEmail(@Param("googleId") String googleId,
                                     @Param("email") String email);
}
