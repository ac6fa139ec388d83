package com.serge.community.repo;

import com.serge.community.domain.Role;
import com.serge.community.domain.RoleName;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface RoleRepository extends JpaRepository<Role, Long> {
    List<Role> findByNameIn(Collection<RoleName> names);
}
