package com.apicatalog.collectionsync.service.remote;

import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import com.apicatalog.collectionsync.dto.tree.TreeNode;

/**
 * Remote API collection holding folders and saved requests.
 *
 * Implementations throw {@link com.apicatalog.collectionsync.exception.TransientRemoteException} for
 * failures worth retrying and {@link com.apicatalog.collectionsync.exception.RemoteApplyException}
 * for rejections.
 */
public interface CollectionStoreClient {

    /**
     * Current remote tree. The root's remote id is the collection id.
     */
    TreeNode fetchTree();

    /**
     * @param parentFolderId containing folder, or null for the collection root
     * @return id assigned to the new folder
     */
    String createFolder(String parentFolderId, String name);

    /**
     * @param parentFolderId containing folder, or null for the collection root
     * @return id assigned to the new request
     */
    String createRequest(String parentFolderId, EndpointDescriptor descriptor);

    void updateRequest(String requestId, EndpointDescriptor descriptor);

    void deleteFolder(String folderId);

    void deleteRequest(String requestId);

    /**
     * Creates an environment defining the variable the request URLs are prefixed with.
     *
     * @return id assigned to the new environment
     */
    String createEnvironment();

    /**
     * True when the configured collection is reachable with the configured credentials.
     */
    boolean testConnection();
}
