package org.devios.shell.fs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 路径解析器：把用户输入的路径表达式结合当前目录解析成树中的节点。
 * <p>
 * 规则：
 * <ul>
 *   <li>以 {@code /} 开头、或以 {@code ~} 开头的路径从根目录开始；其余相对当前目录。</li>
 *   <li>按 {@code /} 拆分并丢弃空段（兼容连续分隔符）；{@code .} 为当前目录。</li>
 *   <li>{@code ..} 弹出一级，在根目录时不做任何事。</li>
 *   <li>中间段必须是目录；文件只允许出现在最后一段。</li>
 * </ul>
 * <p>
 * 可以传入根目录子项的过滤条件：走进被拒绝的子项时立即视为不存在，即使后面的 {@code ..} 会退回来。
 * <p>
 * {@code cd -} 由调用方处理，这里不认识 {@code -}。解析是纯函数：不会修改任何会话状态，
 * 步数以路径段数为上限。
 */
public class PathResolver {

    private final VirtualFileTree tree;

    public PathResolver(VirtualFileTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public Optional<ResolvedPath> resolve(String pathExpr, String cwd) {
        return resolve(pathExpr, cwd, name -> false);
    }

    /**
     * @param hiddenRootChild 根目录下哪些子项不可进入
     */
    public Optional<ResolvedPath> resolve(String pathExpr, String cwd, Predicate<String> hiddenRootChild) {
        List<String> raw = new ArrayList<>();
        String expr = (pathExpr == null) ? "" : pathExpr.trim();
        boolean fromRoot = expr.startsWith("/") || expr.equals(VirtualFileTree.ROOT) || expr.startsWith(VirtualFileTree.ROOT + "/");
        if (!fromRoot) {
            raw.addAll(split(cwd == null ? VirtualFileTree.ROOT : cwd));
        }
        raw.addAll(split(expr));

        Deque<String> names = new ArrayDeque<>();
        Deque<DirectoryNode> dirs = new ArrayDeque<>();
        DirectoryNode current = tree.root();
        Node target = current;

        for (String segment : raw) {
            if (!(target instanceof DirectoryNode)) {
                // 上一段匹配到的是文件，但后面还有内容
                return Optional.empty();
            }
            if (segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!names.isEmpty()) {
                    names.removeLast();
                    current = dirs.removeLast();
                    target = current;
                }
                continue;
            }
            Node child = current.child(segment);
            if (child == null || (names.isEmpty() && hiddenRootChild.test(segment))) {
                return Optional.empty();
            }
            names.addLast(segment);
            dirs.addLast(current);
            if (child instanceof DirectoryNode dir) {
                current = dir;
            }
            target = child;
        }

        List<String> segments = new ArrayList<>(names);
        return Optional.of(new ResolvedPath(ResolvedPath.toPath(segments), segments, target));
    }

    private static List<String> split(String path) {
        List<String> result = new ArrayList<>();
        boolean first = true;
        for (String part : path.split("/")) {
            if (part.isEmpty()) {
                continue;
            }
            // ~ 只在第一个逻辑段表示根目录
            if (first && part.equals(VirtualFileTree.ROOT)) {
                first = false;
                continue;
            }
            first = false;
            result.add(part);
        }
        return result;
    }
}
