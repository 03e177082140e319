package com.vendinghive.repository;

import com.vendinghive.entity.UserLocationPreference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserLocationPreferenceRepository extends JpaRepository<UserLocationPreference, Long> {

    Optional<UserLocationPreference> findByOperatorId(String operatorId);
}
