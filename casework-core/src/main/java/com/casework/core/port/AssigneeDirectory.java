package com.casework.core.port;

import com.casework.core.model.DepartmentProfile;
import com.casework.core.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of departments and users, owned by another service.
 */
public interface AssigneeDirectory {

    List<DepartmentProfile> departments();

    Optional<DepartmentProfile> findDepartment(String departmentId);

    Optional<UserProfile> findUser(String userId);

    /**
     * Active users holding the given role.
     */
    List<UserProfile> usersWithRole(String role);
}
