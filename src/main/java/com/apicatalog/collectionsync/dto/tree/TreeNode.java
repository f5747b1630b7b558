package com.apicatalog.collectionsync.dto.tree;

import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Node of a descriptor tree, canonical or remote.
 *
 * A folder has children and no descriptor; a leaf has exactly one descriptor and no children.
 * {@code remoteId} is set only on nodes that exist in the remote store. Instances are immutable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TreeNode {
    String name;
    NodeKind kind;
    List<TreeNode> children;
    EndpointDescriptor descriptor;
    String remoteId;
    String contentHash;

    public static TreeNode folder(String name, List<TreeNode> children) {
        return new TreeNode(requireName(name), NodeKind.FOLDER, List.copyOf(children), null, null, null);
    }

    public static TreeNode leaf(EndpointDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("A leaf needs a descriptor");
        }
        return new TreeNode(requireName(descriptor.getName()), NodeKind.LEAF, Collections.emptyList(),
                descriptor, null, descriptor.getContentHash());
    }

    public static TreeNode remoteFolder(String name, String remoteId, List<TreeNode> children) {
        return new TreeNode(requireName(name), NodeKind.FOLDER, List.copyOf(children), null, remoteId, null);
    }

    /**
     * @param descriptor request content read back from the store, may be null when unreadable
     * @param contentHash hash recomputed from that content, or stored by the remote
     */
    public static TreeNode remoteLeaf(String name, String remoteId, EndpointDescriptor descriptor, String contentHash) {
        return new TreeNode(requireName(name), NodeKind.LEAF, Collections.emptyList(), descriptor, remoteId, contentHash);
    }

    public boolean isFolder() {
        return kind == NodeKind.FOLDER;
    }

    public boolean isLeaf() {
        return kind == NodeKind.LEAF;
    }

    public Optional<String> pathTemplate() {
        return Optional.ofNullable(descriptor).map(EndpointDescriptor::getPathTemplate);
    }

    /**
     * Number of nodes in this subtree, this node included.
     */
    public int size() {
        int size = 1;
        for (TreeNode child : children) {
            size += child.size();
        }
        return size;
    }

    private static String requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tree node name must not be empty");
        }
        return name;
    }
}
