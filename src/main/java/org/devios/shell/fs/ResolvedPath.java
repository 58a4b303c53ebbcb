package org.devios.shell.fs;

import java.util.List;

/**
 * 路径解析结果。
 *
 * @param path     规范路径（{@code ~} 或 {@code ~/a/b}）
 * @param segments 根目录之下的各段名称（根目录为空列表）
 * @param node     目标节点
 */
public record ResolvedPath(String path, List<String> segments, Node node) {

    public ResolvedPath {
        segments = List.copyOf(segments);
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public String name() {
        return isRoot() ? VirtualFileTree.ROOT : segments.get(segments.size() - 1);
    }

    static String toPath(List<String> segments) {
        if (segments.isEmpty()) {
            return VirtualFileTree.ROOT;
        }
        return VirtualFileTree.ROOT + "/" + String.join("/", segments);
    }
}
