/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.stratum.broker.structure;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.apache.stratum.broker.StratumServiceException.ScopeNotFoundException;
import org.apache.stratum.broker.StratumServiceException.ValidationException;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.naming.ScopeType;
import org.apache.stratum.common.policies.data.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The <code>StructureRegistry</code> holds the tenant hierarchy: customers, their project groups and projects,
 * and the resources of every project.
 * <p>
 * Structural changes are rare and serialized on the registry. Lookups are lock-free. Creating a scope creates
 * its quota records; deleting it zeroes and removes them.
 */
public class StructureRegistry {

    private final QuotaLedger ledger;

    private final ConcurrentHashMap<String, Customer> customers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ProjectGroup> projectGroups = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Project> projects = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Resource> resources = new ConcurrentHashMap<>();

    private final List<MembershipListener> membershipListeners = new CopyOnWriteArrayList<>();

    public StructureRegistry(QuotaLedger ledger) {
        this.ledger = ledger;
    }

    public void addMembershipListener(MembershipListener listener) {
        membershipListeners.add(listener);
    }

    public synchronized Customer createCustomer(String uuid, String name, long createdAt) throws ValidationException {
        checkNewUuid(ScopeType.Customer, uuid);
        Customer customer = new Customer(uuid, name, createdAt);
        ledger.createScope(customer.getScopeName());
        customers.put(uuid, customer);
        log.info("Created {}", customer);
        return customer;
    }

    public synchronized ProjectGroup createProjectGroup(String uuid, String name, String customerUuid,
                                                        long createdAt) throws ValidationException {
        checkNewUuid(ScopeType.ProjectGroup, uuid);
        getCustomer(customerUuid);
        ProjectGroup group = new ProjectGroup(uuid, name, customerUuid, createdAt);
        ledger.createScope(group.getScopeName());
        projectGroups.put(uuid, group);
        log.info("Created {} of customer {}", group, customerUuid);
        return group;
    }

    public synchronized Project createProject(String uuid, String name, String customerUuid, long createdAt)
            throws ValidationException {
        checkNewUuid(ScopeType.Project, uuid);
        getCustomer(customerUuid);
        Project project = new Project(uuid, name, customerUuid, createdAt);
        ledger.createScope(project.getScopeName());
        projects.put(uuid, project);
        log.info("Created {} of customer {}", project, customerUuid);
        return project;
    }

    /**
     * Add a project to a project group of the same customer and refresh the ancestor lists of its resources.
     * Listeners are notified so that the group's usage can be reconciled.
     */
    public void addProjectToGroup(String projectUuid, String groupUuid) throws ValidationException {
        Project project;
        ProjectGroup group;
        synchronized (this) {
            project = getProject(projectUuid);
            group = getProjectGroup(groupUuid);
            if (!project.getCustomerUuid().equals(group.getCustomerUuid())) {
                throw new ValidationException("Project " + projectUuid + " and project group " + groupUuid
                        + " belong to different customers");
            }
            if (!project.addProjectGroup(groupUuid)) {
                return;
            }
            refreshAncestors(project);
        }
        log.info("Added {} to {}", project, group);
        notifyMembershipChanged(group.getScopeName(), project.getScopeName());
    }

    public void removeProjectFromGroup(String projectUuid, String groupUuid) throws ValidationException {
        Project project;
        ProjectGroup group;
        synchronized (this) {
            project = getProject(projectUuid);
            group = getProjectGroup(groupUuid);
            if (!project.removeProjectGroup(groupUuid)) {
                return;
            }
            refreshAncestors(project);
        }
        log.info("Removed {} from {}", project, group);
        notifyMembershipChanged(group.getScopeName(), project.getScopeName());
    }

    /**
     * Delete a project. Refused while it has live resources; its released resources are forgotten.
     */
    public synchronized void deleteProject(String uuid) throws ValidationException {
        Project project = getProject(uuid);
        List<Resource> owned = resourcesOf(uuid);
        long live = owned.stream().filter(Resource::isLive).count();
        if (live > 0) {
            throw new ValidationException("Project " + uuid + " still has " + live + " live resources");
        }
        for (Resource resource : owned) {
            resources.remove(resource.getUuid());
        }
        projects.remove(uuid);
        ledger.removeScope(project.getScopeName());
        log.info("Deleted {}", project);
    }

    /**
     * Delete a project group. Refused while projects are members of it.
     */
    public synchronized void deleteProjectGroup(String uuid) throws ValidationException {
        ProjectGroup group = getProjectGroup(uuid);
        if (!projectsOfGroup(uuid).isEmpty()) {
            throw new ValidationException("Project group " + uuid + " still has member projects");
        }
        projectGroups.remove(uuid);
        ledger.removeScope(group.getScopeName());
        log.info("Deleted {}", group);
    }

    /**
     * Delete a customer. Refused while it owns projects or project groups.
     */
    public synchronized void deleteCustomer(String uuid) throws ValidationException {
        Customer customer = getCustomer(uuid);
        boolean hasChildren = projects.values().stream().anyMatch(p -> p.getCustomerUuid().equals(uuid))
                || projectGroups.values().stream().anyMatch(g -> g.getCustomerUuid().equals(uuid));
        if (hasChildren) {
            throw new ValidationException("Customer " + uuid + " still owns projects or project groups");
        }
        customers.remove(uuid);
        ledger.removeScope(customer.getScopeName());
        log.info("Deleted {}", customer);
    }

    public Customer getCustomer(String uuid) throws ScopeNotFoundException {
        return checkFound(customers.get(uuid), ScopeType.Customer, uuid);
    }

    public ProjectGroup getProjectGroup(String uuid) throws ScopeNotFoundException {
        return checkFound(projectGroups.get(uuid), ScopeType.ProjectGroup, uuid);
    }

    public Project getProject(String uuid) throws ScopeNotFoundException {
        return checkFound(projects.get(uuid), ScopeType.Project, uuid);
    }

    public HierarchyNode getNode(ScopeName scope) throws ScopeNotFoundException {
        switch (scope.getType()) {
            case Customer:
                return getCustomer(scope.getUuid());
            case ProjectGroup:
                return getProjectGroup(scope.getUuid());
            case Project:
                return getProject(scope.getUuid());
            default:
                throw new IllegalStateException("Unknown scope type " + scope.getType());
        }
    }

    public boolean exists(ScopeName scope) {
        return nodesMap(scope.getType()).containsKey(scope.getUuid());
    }

    public List<HierarchyNode> getNodes(ScopeType type) {
        return ImmutableList.copyOf(nodesMap(type).values());
    }

    /**
     * All nodes of a scope type, or the single node with the given uuid when one is given.
     */
    public List<HierarchyNode> getNodes(ScopeType type, String uuid) throws ScopeNotFoundException {
        if (StringUtils.isNotBlank(uuid)) {
            return ImmutableList.of(getNode(ScopeName.get(type, uuid)));
        }
        return getNodes(type);
    }

    public Collection<Customer> getCustomers() {
        return ImmutableList.copyOf(customers.values());
    }

    /**
     * Projects whose usage counts toward the scope.
     */
    public List<Project> projectsUnder(ScopeName scope) {
        switch (scope.getType()) {
            case Customer:
                return projects.values().stream()
                        .filter(p -> p.getCustomerUuid().equals(scope.getUuid()))
                        .collect(Collectors.toList());
            case ProjectGroup:
                return projectsOfGroup(scope.getUuid());
            case Project:
                Project project = projects.get(scope.getUuid());
                return project == null ? ImmutableList.of() : ImmutableList.of(project);
            default:
                throw new IllegalStateException("Unknown scope type " + scope.getType());
        }
    }

    public List<ProjectGroup> projectGroupsOf(String customerUuid) {
        return projectGroups.values().stream()
                .filter(g -> g.getCustomerUuid().equals(customerUuid))
                .collect(Collectors.toList());
    }

    /**
     * Resources whose usage counts toward the scope, live or not.
     */
    public List<Resource> resourcesUnder(ScopeName scope) {
        List<Resource> result = new ArrayList<>();
        for (Project project : projectsUnder(scope)) {
            result.addAll(resourcesOf(project.getUuid()));
        }
        return result;
    }

    /**
     * A scope followed by the scopes above it: for a project its customer and every group it is a member of, for
     * a project group its customer.
     */
    public List<ScopeName> scopeWithAncestors(ScopeName scope) throws ScopeNotFoundException {
        switch (scope.getType()) {
            case Customer:
                getCustomer(scope.getUuid());
                return ImmutableList.of(scope);
            case ProjectGroup:
                return ImmutableList.of(scope,
                        ScopeName.customer(getProjectGroup(scope.getUuid()).getCustomerUuid()));
            case Project:
                return ancestorsOf(getProject(scope.getUuid()));
            default:
                throw new IllegalStateException("Unknown scope type " + scope.getType());
        }
    }

    /**
     * Register a resource of a project, caching the project's ancestor list on it. Returns the already
     * registered resource when there is one.
     */
    public Resource registerResource(String uuid, String projectUuid, ResourceKind kind, String backendRef,
                                     long createdAt) throws ScopeNotFoundException {
        Resource existing = resources.get(uuid);
        if (existing != null) {
            return existing;
        }
        synchronized (this) {
            Project project = getProject(projectUuid);
            return resources.computeIfAbsent(uuid,
                    id -> new Resource(id, projectUuid, kind, backendRef, createdAt, ancestorsOf(project)));
        }
    }

    public Resource getResource(String uuid) {
        return resources.get(uuid);
    }

    public Collection<Resource> getResources() {
        return ImmutableList.copyOf(resources.values());
    }

    private List<ScopeName> ancestorsOf(Project project) {
        List<ScopeName> ancestors = new ArrayList<>();
        ancestors.add(project.getScopeName());
        ancestors.add(ScopeName.customer(project.getCustomerUuid()));
        for (String groupUuid : project.getProjectGroupUuids()) {
            ancestors.add(ScopeName.projectGroup(groupUuid));
        }
        return ancestors;
    }

    private void refreshAncestors(Project project) {
        List<ScopeName> ancestors = ancestorsOf(project);
        for (Resource resource : resourcesOf(project.getUuid())) {
            resource.setAncestors(ancestors);
        }
    }

    private List<Resource> resourcesOf(String projectUuid) {
        return resources.values().stream()
                .filter(r -> r.getProjectUuid().equals(projectUuid))
                .collect(Collectors.toList());
    }

    private List<Project> projectsOfGroup(String groupUuid) {
        return projects.values().stream()
                .filter(p -> p.getProjectGroupUuids().contains(groupUuid))
                .collect(Collectors.toList());
    }

    private void notifyMembershipChanged(ScopeName group, ScopeName project) {
        for (MembershipListener listener : membershipListeners) {
            try {
                listener.onMembershipChanged(group, project);
            } catch (Exception e) {
                log.error("Membership listener {} failed on {} / {}", listener, group, project, e);
            }
        }
    }

    private Map<String, ? extends HierarchyNode> nodesMap(ScopeType type) {
        switch (type) {
            case Customer:
                return customers;
            case ProjectGroup:
                return projectGroups;
            case Project:
                return projects;
            default:
                throw new IllegalStateException("Unknown scope type " + type);
        }
    }

    private void checkNewUuid(ScopeType type, String uuid) throws ValidationException {
        if (StringUtils.isBlank(uuid)) {
            throw new ValidationException("Missing " + type + " uuid");
        }
        if (nodesMap(type).containsKey(uuid)) {
            throw new ValidationException(type + " " + uuid + " already exists");
        }
    }

    private static <T extends HierarchyNode> T checkFound(T node, ScopeType type, String uuid)
            throws ScopeNotFoundException {
        if (node == null) {
            throw new ScopeNotFoundException(type + " " + uuid + " does not exist");
        }
        return node;
    }

    private static final Logger log = LoggerFactory.getLogger(StructureRegistry.class);
}
