package com.baskettecase.sqlgate.store;

/**
 * A workspace joined with its query and the owner's username.
 */
public record WorkspaceDetails(WorkspaceRecord workspace, QueryRecord query, String ownerName) {

    public long workspaceId() {
        return workspace.id();
    }

    public long ownerId() {
        return workspace.userId();
    }
}
