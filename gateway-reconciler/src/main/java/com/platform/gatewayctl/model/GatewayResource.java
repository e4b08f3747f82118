package com.platform.gatewayctl.model;

/**
 * A node of an API's resource tree.
 *
 * @param id       control-plane identifier
 * @param parentId parent node id, {@code null} for the root
 * @param pathPart the node's own segment as the control plane stores it, {@code null} for the root
 * @param path     full path from the root, unique within an API
 */
public record GatewayResource(
    String id,
    String parentId,
    String pathPart,
    String path
) {
    
    public boolean isRoot() {
        return parentId == null;
    }
    
    public boolean isChildOf(String candidateParentId) {
        return parentId != null && parentId.equals(candidateParentId);
    }
}
