package com.numaansystems.portal.service;

import com.numaansystems.portal.config.PortalProperties;
import com.numaansystems.portal.model.Department;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only department table: department name, required group, router role and dashboard.
 *
 * <p>Built once from {@link PortalProperties} at startup and never mutated afterwards, so
 * concurrent readers need no synchronization. Roles are compared lower-cased.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class DepartmentDirectory {

    private static final Logger logger = LoggerFactory.getLogger(DepartmentDirectory.class);

    private final Map<String, Department> byName;
    private final Map<String, Department> byRole;
    private final Map<String, Department> byGroup;

    @Autowired
    public DepartmentDirectory(PortalProperties properties) {
        this(toDepartments(properties.getDepartments()));
    }

    public DepartmentDirectory(Collection<Department> departments) {
        Map<String, Department> names = new LinkedHashMap<>();
        Map<String, Department> roles = new LinkedHashMap<>();
        Map<String, Department> groups = new LinkedHashMap<>();

        for (Department department : departments) {
            if (names.putIfAbsent(department.getName(), department) != null) {
                throw new IllegalStateException("Duplicate department: " + department.getName());
            }
            roles.putIfAbsent(department.getRole().toLowerCase(Locale.ROOT), department);
            groups.putIfAbsent(department.getRequiredGroup(), department);
        }

        this.byName = Collections.unmodifiableMap(names);
        this.byRole = Collections.unmodifiableMap(roles);
        this.byGroup = Collections.unmodifiableMap(groups);

        logger.info("Department table loaded with {} departments: {}", byName.size(), byName.keySet());
    }

    public Optional<Department> findByName(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    public Optional<Department> findByRole(String role) {
        return role == null ? Optional.empty() : Optional.ofNullable(byRole.get(role.toLowerCase(Locale.ROOT)));
    }

    /**
     * Translates a directory group into the role the router knows it by.
     * Groups outside the table are returned unchanged.
     */
    public String roleForGroup(String group) {
        Department department = byGroup.get(group);
        return department != null ? department.getRole() : group;
    }

    public List<String> departmentNames() {
        return new ArrayList<>(byName.keySet());
    }

    public Collection<Department> all() {
        return byName.values();
    }

    private static List<Department> toDepartments(List<PortalProperties.DepartmentProperties> rows) {
        List<Department> departments = new ArrayList<>();
        for (PortalProperties.DepartmentProperties row : rows) {
            departments.add(new Department(row.getName(), row.getGroup(), row.getRole(),
                    row.getDashboardPath(), row.getBackendUrl(), row.getHealthPath()));
        }
        return departments;
    }
}
