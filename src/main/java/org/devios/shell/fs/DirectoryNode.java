package org.devios.shell.fs;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 目录节点。children 在构造时复制为不可变视图，名称必须非空且不含 {@code /}。
 *
 * @param children    子节点（名称 -> 节点）
 * @param permissions rwx 权限
 * @param owner       所有者
 * @param group       所属组
 * @param modifiedAt  最后修改时间
 */
public record DirectoryNode(
        Map<String, Node> children,
        Permissions permissions,
        String owner,
        String group,
        Instant modifiedAt
) implements Node {

    public DirectoryNode {
        Objects.requireNonNull(children, "children");
        for (String name : children.keySet()) {
            validateName(name);
        }
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(modifiedAt, "modifiedAt");
    }

    public Node child(String name) {
        return children.get(name);
    }

    static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("节点名称不能为空");
        }
        if (name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("节点名称不能包含路径分隔符：" + name);
        }
        if (name.equals(".") || name.equals("..") || name.equals(VirtualFileTree.ROOT)) {
            throw new IllegalArgumentException("节点名称是保留字：" + name);
        }
    }
}
