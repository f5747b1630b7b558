package com.apicatalog.collectionsync.service.sync;

import com.apicatalog.collectionsync.dto.EndpointDescriptor;
import com.apicatalog.collectionsync.dto.sync.DiffOp;
import com.apicatalog.collectionsync.dto.sync.DiffOpType;
import com.apicatalog.collectionsync.dto.sync.EditScript;
import com.apicatalog.collectionsync.dto.tree.TreeNode;
import com.apicatalog.collectionsync.service.descriptor.DescriptorPathGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Computes the edit script between a canonical descriptor tree and the tree read from the remote store.
 *
 * Children are matched by name at every level. Matched leaves compare by content hash. Remote-only
 * leaves are deleted only when their path follows the generator's convention for a known owner type;
 * anything else on the remote side is reported as IGNORED and left alone. A remote-only folder is
 * deleted only when every descendant is deleted with it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CollectionDiffService {

    private final DescriptorPathGenerator pathGenerator;

    /**
     * Diff with owner types taken from the canonical tree only.
     */
    public EditScript diff(TreeNode canonicalRoot, TreeNode remoteRoot) {
        return diff(canonicalRoot, remoteRoot, Collections.emptySet());
    }

    /**
     * @param knownOwnerTypes owner types whose conventional requests may be deleted, in addition to
     *                        those present in the canonical tree
     */
    public EditScript diff(TreeNode canonicalRoot, TreeNode remoteRoot, Set<String> knownOwnerTypes) {
        Objects.requireNonNull(canonicalRoot, "canonicalRoot");
        Objects.requireNonNull(remoteRoot, "remoteRoot");

        Set<String> owners = new HashSet<>(knownOwnerTypes);
        collectOwnerTypes(canonicalRoot, owners);

        List<DiffOp> ops = new ArrayList<>();
        diffChildren(List.of(), remoteRoot.getRemoteId(), canonicalRoot.getChildren(), remoteRoot.getChildren(),
                owners, ops);

        EditScript script = new EditScript(ops);
        log.info("Diff complete: {}", script.countByType());
        return script;
    }

    // ========================= MATCHING =========================

    private void diffChildren(List<String> parentPath, String parentRemoteId,
                              List<TreeNode> canonicalChildren, List<TreeNode> remoteChildren,
                              Set<String> owners, List<DiffOp> ops) {
        // First remote node per name is the match; later duplicates count as remote-only
        Map<String, TreeNode> remoteByName = new LinkedHashMap<>();
        List<TreeNode> unmatched = new ArrayList<>();
        for (TreeNode remote : remoteChildren) {
            if (remoteByName.putIfAbsent(remote.getName(), remote) != null) {
                unmatched.add(remote);
            }
        }

        for (TreeNode canonical : canonicalChildren) {
            List<String> path = append(parentPath, canonical.getName());
            TreeNode remote = remoteByName.remove(canonical.getName());

            if (remote == null) {
                emitCreate(path, parentRemoteId, canonical, ops);
            } else if (remote.getKind() != canonical.getKind()) {
                log.warn("Kind mismatch at '{}': canonical {} vs remote {}", String.join("/", path),
                        canonical.getKind(), remote.getKind());
                ops.add(DiffOp.builder()
                        .type(DiffOpType.CONFLICT)
                        .path(path)
                        .node(remote)
                        .remoteId(remote.getRemoteId())
                        .parentRemoteId(parentRemoteId)
                        .detail("canonical " + canonical.getKind() + " but remote " + remote.getKind())
                        .build());
            } else if (canonical.isFolder()) {
                diffChildren(path, remote.getRemoteId(), canonical.getChildren(), remote.getChildren(), owners, ops);
            } else {
                boolean same = Objects.equals(canonical.getContentHash(), remote.getContentHash());
                ops.add(DiffOp.builder()
                        .type(same ? DiffOpType.KEEP : DiffOpType.UPDATE)
                        .path(path)
                        .node(same ? remote : canonical)
                        .remoteId(remote.getRemoteId())
                        .parentRemoteId(parentRemoteId)
                        .build());
            }
        }

        unmatched.addAll(0, remoteByName.values());
        for (TreeNode remote : unmatched) {
            emitRemoteOnly(append(parentPath, remote.getName()), parentRemoteId, remote, owners, ops);
        }
    }

    /**
     * Pre-order, so a folder is created before anything placed in it.
     */
    private void emitCreate(List<String> path, String parentRemoteId, TreeNode node, List<DiffOp> ops) {
        ops.add(DiffOp.builder()
                .type(DiffOpType.CREATE)
                .path(path)
                .node(node)
                .parentRemoteId(parentRemoteId)
                .build());
        for (TreeNode child : node.getChildren()) {
            emitCreate(append(path, child.getName()), null, child, ops);
        }
    }

    /**
     * Post-order, so a folder is deleted only after its contents.
     *
     * @return true when the node and everything under it is deleted
     */
    private boolean emitRemoteOnly(List<String> path, String parentRemoteId, TreeNode node,
                                   Set<String> owners, List<DiffOp> ops) {
        if (node.isLeaf()) {
            boolean ours = isGenerated(node, owners);
            ops.add(DiffOp.builder()
                    .type(ours ? DiffOpType.DELETE : DiffOpType.IGNORED)
                    .path(path)
                    .node(node)
                    .remoteId(node.getRemoteId())
                    .parentRemoteId(parentRemoteId)
                    .detail(ours ? null : "not a generated request")
                    .build());
            return ours;
        }

        boolean allDeleted = true;
        for (TreeNode child : node.getChildren()) {
            allDeleted &= emitRemoteOnly(append(path, child.getName()), node.getRemoteId(), child, owners, ops);
        }
        if (allDeleted) {
            ops.add(DiffOp.builder()
                    .type(DiffOpType.DELETE)
                    .path(path)
                    .node(node)
                    .remoteId(node.getRemoteId())
                    .parentRemoteId(parentRemoteId)
                    .build());
        } else {
            log.debug("Keeping remote folder '{}': it holds requests that are not generated", String.join("/", path));
        }
        return allDeleted;
    }

    private boolean isGenerated(TreeNode leaf, Set<String> owners) {
        return leaf.pathTemplate()
                .flatMap(pathGenerator::ownerTypeOf)
                .map(owners::contains)
                .orElse(false);
    }

    // ========================= HELPERS =========================

    private static void collectOwnerTypes(TreeNode node, Set<String> owners) {
        EndpointDescriptor descriptor = node.getDescriptor();
        if (descriptor != null && descriptor.getOwnerType() != null) {
            owners.add(descriptor.getOwnerType());
        }
        for (TreeNode child : node.getChildren()) {
            collectOwnerTypes(child, owners);
        }
    }

    private static List<String> append(List<String> path, String name) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(name);
        return Collections.unmodifiableList(extended);
    }
}
