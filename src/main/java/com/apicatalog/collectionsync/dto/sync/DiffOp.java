package com.apicatalog.collectionsync.dto.sync;

import com.apicatalog.collectionsync.dto.tree.TreeNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of an edit script.
 *
 * {@code path} lists node names from below the root down to the node. For CREATE and UPDATE
 * {@code node} is the canonical node; for DELETE, KEEP and IGNORED it is the remote node.
 * A CREATE whose parent is created by an earlier op of the same script has no
 * {@code parentRemoteId}; the applier resolves it from {@link #parentPath()}.
 */
@Value
@Builder
public class DiffOp {
    DiffOpType type;
    List<String> path;
    TreeNode node;
    String remoteId;
    String parentRemoteId;
    String detail;

    public String pathString() {
        return String.join("/", path);
    }

    public List<String> parentPath() {
        return path.subList(0, path.size() - 1);
    }

    public String topLevelName() {
        return path.get(0);
    }

    public boolean isFolderOp() {
        return node != null && node.isFolder();
    }
}
