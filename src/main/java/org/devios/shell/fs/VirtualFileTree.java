package org.devios.shell.fs;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 内存中的虚拟文件系统树。
 * <p>
 * 树在启动时一次性构建，之后不会再改变形状：{@code mkdir/touch/chmod/chown} 只做校验并回显结果，
 * 不修改任何节点。
 */
public class VirtualFileTree {

    /**
     * 根目录名（同时是路径的第一个逻辑段）。
     */
    public static final String ROOT = "~";

    private final DirectoryNode root;

    public VirtualFileTree(DirectoryNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public DirectoryNode root() {
        return root;
    }

    /**
     * 按规范路径查找节点（{@code ~} 或 {@code ~/a/b}）。路径中不允许出现 {@code ..}。
     */
    public Optional<Node> lookup(String canonicalPath) {
        if (canonicalPath == null || canonicalPath.isBlank()) {
            return Optional.empty();
        }
        String[] parts = canonicalPath.split("/");
        if (!ROOT.equals(parts[0])) {
            return Optional.empty();
        }
        Node current = root;
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                continue;
            }
            if (!(current instanceof DirectoryNode dir)) {
                return Optional.empty();
            }
            current = dir.child(parts[i]);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public Map<String, Node> listChildren(DirectoryNode directory) {
        return directory.children();
    }
}
