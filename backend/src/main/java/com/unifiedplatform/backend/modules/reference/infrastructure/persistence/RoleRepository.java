package com.unifiedplatform.backend.modules.reference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.reference.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    List<Role> findAllByOrderByCreatedAtAscIdAsc();
}
