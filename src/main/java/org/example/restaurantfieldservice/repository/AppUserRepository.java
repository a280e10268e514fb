package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.enums.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    Optional<AppUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    List<AppUser> findByRoleOrderByNameAsc(UserRole role);

    List<AppUser> findByRoleIn(Collection<UserRole> roles);
}
