package com.platform.gatewayctl.reconcile;

import com.platform.gatewayctl.client.ControlPlaneClient;
import com.platform.gatewayctl.error.ResourceAlreadyExistsException;
import com.platform.gatewayctl.error.ResourceConflictException;
import com.platform.gatewayctl.error.ResourceNotFoundException;
import com.platform.gatewayctl.model.GatewayResource;
import com.platform.gatewayctl.model.PathSegment;
import com.platform.gatewayctl.model.PathTemplate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a path template onto the resource tree of an API, creating missing nodes.
 * <p>
 * Children match a segment only when both kind and text agree. Resolution is idempotent
 * and never deletes anything.
 */
@Slf4j
public class ResourceTreeResolver {

    private final ControlPlaneClient client;

    public ResourceTreeResolver(ControlPlaneClient client) {
        this.client = client;
    }

    /**
     * Result of a resolution: the leaf id and the nodes created on the way, root first.
     */
    public record ResolvedPath(String leafId, List<GatewayResource> created) {

        public ResolvedPath {
            created = List.copyOf(created);
        }

        public boolean createdAny() {
            return !created.isEmpty();
        }
    }

    /**
     * Resolve the template to a leaf resource id, creating any missing segment.
     *
     * @throws ResourceNotFoundException if the API or its root does not exist
     * @throws ResourceConflictException if two children match the same segment
     */
    public ResolvedPath resolve(String apiId, PathTemplate template) {
        List<GatewayResource> resources = new ArrayList<>(client.getResources(apiId));
        GatewayResource current = findRoot(apiId, resources);
        List<GatewayResource> created = new ArrayList<>();

        for (PathSegment segment : template.segments()) {
            Optional<GatewayResource> child = findChild(resources, current, segment);
            if (child.isPresent()) {
                current = child.get();
                continue;
            }
            GatewayResource node = createChild(apiId, current, segment, resources);
            if (!resources.contains(node)) {
                resources.add(node);
                created.add(node);
            }
            current = node;
        }

        if (!created.isEmpty()) {
            log.debug("Created {} resource(s) for {}", created.size(), template);
        }
        return new ResolvedPath(current.id(), created);
    }

    /**
     * Leaf id of the template if every segment already exists. Creates nothing.
     */
    public Optional<String> findExisting(String apiId, PathTemplate template) {
        List<GatewayResource> resources = client.getResources(apiId);
        GatewayResource current = findRoot(apiId, resources);
        for (PathSegment segment : template.segments()) {
            Optional<GatewayResource> child = findChild(resources, current, segment);
            if (child.isEmpty()) {
                return Optional.empty();
            }
            current = child.get();
        }
        return Optional.of(current.id());
    }

    /**
     * The resource without a parent.
     */
    public GatewayResource findRoot(String apiId, List<GatewayResource> resources) {
        return resources.stream()
            .filter(GatewayResource::isRoot)
            .findFirst()
            .orElseThrow(() -> ResourceNotFoundException.rootResource(apiId));
    }

    private GatewayResource createChild(String apiId, GatewayResource parent, PathSegment segment,
                                        List<GatewayResource> known) {
        try {
            return client.createResource(apiId, parent.id(), segment.text());
        } catch (ResourceAlreadyExistsException e) {
            // created since the listing was taken
            log.debug("{} appeared under {} concurrently, re-reading the tree", segment, parent.path());
            List<GatewayResource> fresh = client.getResources(apiId);
            known.clear();
            known.addAll(fresh);
            return findChild(fresh, parent, segment).orElseThrow(() -> e);
        }
    }

    private static Optional<GatewayResource> findChild(List<GatewayResource> resources, GatewayResource parent,
                                                       PathSegment segment) {
        List<GatewayResource> matches = resources.stream()
            .filter(r -> r.isChildOf(parent.id()))
            .filter(r -> segment.matchesPathPart(r.pathPart()))
            .toList();
        if (matches.size() > 1) {
            String path = parent.isRoot() ? "/" + segment.text() : parent.path() + "/" + segment.text();
            throw ResourceConflictException.ambiguous("Resource", path, matches.size());
        }
        return matches.stream().findFirst();
    }
}
