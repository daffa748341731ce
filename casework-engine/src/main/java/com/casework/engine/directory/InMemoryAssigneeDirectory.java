package com.casework.engine.directory;

import com.casework.core.model.DepartmentProfile;
import com.casework.core.model.UserProfile;
import com.casework.core.port.AssigneeDirectory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory held in memory. Populated at startup or by tests.
 */
public class InMemoryAssigneeDirectory implements AssigneeDirectory {

    private final Map<String, DepartmentProfile> departments = new ConcurrentHashMap<>();
    private final Map<String, UserProfile> users = new ConcurrentHashMap<>();

    public InMemoryAssigneeDirectory addDepartment(DepartmentProfile department) {
        departments.put(department.id(), department);
        return this;
    }

    public InMemoryAssigneeDirectory addUser(UserProfile user) {
        users.put(user.id(), user);
        return this;
    }

    @Override
    public List<DepartmentProfile> departments() {
        return departments.values().stream()
            .sorted(Comparator.comparing(DepartmentProfile::id))
            .toList();
    }

    @Override
    public Optional<DepartmentProfile> findDepartment(String departmentId) {
        return Optional.ofNullable(departments.get(departmentId));
    }

    @Override
    public Optional<UserProfile> findUser(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public List<UserProfile> usersWithRole(String role) {
        return users.values().stream()
            .filter(UserProfile::active)
            .filter(u -> u.roles().contains(role))
            .sorted(Comparator.comparing(UserProfile::id))
            .toList();
    }
}
