package com.apicatalog.collectionsync.service.tree;

import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import com.apicatalog.collectionsync.dto.OwnerDescriptors;
import com.apicatalog.collectionsync.dto.tree.Grouping;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Arranges per-owner descriptor lists into the canonical collection tree.
 *
 * Folders and leaves are sorted by name, so the same input in any order yields the same tree.
 */
@Component
@Slf4j
public class DescriptorTreeAssembler {

    public static final String ROOT_NAME = "collection";
    public static final String NO_MODULE_FOLDER = "Other";

    private static final Comparator<TreeNode> BY_NAME = Comparator.comparing(TreeNode::getName);

    public TreeNode assemble(List<OwnerDescriptors> owners, Grouping grouping) {
        TreeNode root;
        switch (grouping) {
            case FLAT_BY_TYPE:
                root = TreeNode.folder(ROOT_NAME, ownerFolders(owners));
                break;
            case BY_MODULE:
                root = TreeNode.folder(ROOT_NAME, moduleFolders(owners));
                break;
            default:
                throw new IllegalArgumentException("Unsupported grouping: " + grouping);
        }
        log.debug("Assembled canonical tree with {} nodes ({} grouping)", root.size(), grouping);
        return root;
    }

    private List<TreeNode> moduleFolders(List<OwnerDescriptors> owners) {
        Map<String, List<OwnerDescriptors>> byModule = new TreeMap<>();
        for (OwnerDescriptors owner : owners) {
            String module = owner.getModuleName() != null ? owner.getModuleName() : NO_MODULE_FOLDER;
            byModule.computeIfAbsent(module, k -> new ArrayList<>()).add(owner);
        }

        List<TreeNode> folders = new ArrayList<>();
        byModule.forEach((module, moduleOwners) -> folders.add(TreeNode.folder(module, ownerFolders(moduleOwners))));
        return folders;
    }

    private List<TreeNode> ownerFolders(List<OwnerDescriptors> owners) {
        Set<String> seen = new HashSet<>();
        List<TreeNode> folders = new ArrayList<>();
        for (OwnerDescriptors owner : owners) {
            if (!seen.add(owner.getOwnerType())) {
                throw new IllegalStateException("Owner type assembled twice: " + owner.getOwnerType());
            }
            folders.add(TreeNode.folder(owner.getOwnerType(), leaves(owner)));
        }
        folders.sort(BY_NAME);
        return folders;
    }

    private List<TreeNode> leaves(OwnerDescriptors owner) {
        Set<String> names = new HashSet<>();
        List<TreeNode> leaves = new ArrayList<>();
        for (EndpointDescriptor descriptor : owner.getDescriptors()) {
            if (!names.add(descriptor.getName())) {
                throw new IllegalStateException("Duplicate leaf " + descriptor.getName() + " in " + owner.getOwnerType());
            }
            leaves.add(TreeNode.leaf(descriptor));
        }
        leaves.sort(BY_NAME);
        return leaves;
    }
}
