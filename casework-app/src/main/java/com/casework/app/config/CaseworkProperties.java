package com.casework.app.config;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.Actor;
import com.casework.core.model.DepartmentProfile;
import com.casework.core.model.UserProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings under the {@code casework} prefix.
 */
@ConfigurationProperties("casework")
public class CaseworkProperties {

    public enum Persistence {
        MEMORY,
        JDBC
    }

    private Persistence persistence = Persistence.JDBC;

    /**
     * Role that grants super-admin when present on a caller.
     */
    private String superAdminRole = "super_admin";

    private final Sla sla = new Sla();
    private final Revisions revisions = new Revisions();
    private final Notifications notifications = new Notifications();
    private final Directory directory = new Directory();

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public String getSuperAdminRole() {
        return superAdminRole;
    }

    public void setSuperAdminRole(String superAdminRole) {
        this.superAdminRole = superAdminRole;
    }

    public Sla getSla() {
        return sla;
    }

    public Revisions getRevisions() {
        return revisions;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Directory getDirectory() {
        return directory;
    }

    /**
     * Build the identity of an authenticated caller, granting super-admin through the configured role.
     */
    public Actor actor(String id, Set<String> roles) {
        return new Actor(id, roles, roles != null && roles.contains(superAdminRole));
    }

    public static class Sla {

        private boolean enabled = true;
        private Duration scanInterval = Duration.ofMinutes(5);
        private int batchSize = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Revisions {

        /**
         * How long revisions are kept. Unset keeps them forever.
         */
        private Duration retention;
        private Duration retentionCheckInterval = Duration.ofHours(6);

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public Duration getRetentionCheckInterval() {
            return retentionCheckInterval;
        }

        public void setRetentionCheckInterval(Duration retentionCheckInterval) {
            this.retentionCheckInterval = retentionCheckInterval;
        }
    }

    public static class Notifications {

        private int threads = 2;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    /**
     * Users and departments available to assignment actions and auto-detection.
     */
    public static class Directory {

        private List<Department> departments = new ArrayList<>();
        private List<User> users = new ArrayList<>();

        public List<Department> getDepartments() {
            return departments;
        }

        public void setDepartments(List<Department> departments) {
            this.departments = departments;
        }

        public List<User> getUsers() {
            return users;
        }

        public void setUsers(List<User> users) {
            this.users = users;
        }
    }

    public static class Department {

        private String id;
        private String name;
        private Map<MatchDimension, Set<String>> constraints = new EnumMap<>(MatchDimension.class);

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Map<MatchDimension, Set<String>> getConstraints() {
            return constraints;
        }

        public void setConstraints(Map<MatchDimension, Set<String>> constraints) {
            this.constraints = constraints;
        }

        public DepartmentProfile toProfile() {
            return new DepartmentProfile(id, name == null ? id : name, new MatchConstraints(constraints));
        }
    }

    public static class User {

        private String id;
        private String displayName;
        private Set<String> roles = new HashSet<>();
        private boolean active = true;
        private Map<MatchDimension, Set<String>> constraints = new EnumMap<>(MatchDimension.class);

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public Set<String> getRoles() {
            return roles;
        }

        public void setRoles(Set<String> roles) {
            this.roles = roles;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public Map<MatchDimension, Set<String>> getConstraints() {
            return constraints;
        }

        public void setConstraints(Map<MatchDimension, Set<String>> constraints) {
            this.constraints = constraints;
        }

        public UserProfile toProfile() {
            return new UserProfile(id, displayName == null ? id : displayName, roles, active,
                new MatchConstraints(constraints));
        }
    }
}
