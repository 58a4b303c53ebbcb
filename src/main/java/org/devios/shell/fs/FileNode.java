package org.devios.shell.fs;

import org.devios.shell.session.Language;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 文件节点。
 *
 * @param lines       各语言版本的内容行（至少一种语言）
 * @param binary      是否按“二进制文件”处理（cat 时走下载流程而不是直接输出）
 * @param permissions rwx 权限
 * @param owner       所有者
 * @param group       所属组
 * @param modifiedAt  最后修改时间
 */
public record FileNode(
        Map<Language, List<String>> lines,
        boolean binary,
        Permissions permissions,
        String owner,
        String group,
        Instant modifiedAt
) implements Node {

    public FileNode {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("文件至少需要一种语言的内容");
        }
        EnumMap<Language, List<String>> copy = new EnumMap<>(Language.class);
        lines.forEach((language, content) -> copy.put(language, List.copyOf(content)));
        lines = Collections.unmodifiableMap(copy);
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(modifiedAt, "modifiedAt");
    }

    /**
     * 返回指定语言的内容；缺失时回退到 {@link Language#PRIMARY}，再回退到任意已有版本。
     */
    public List<String> linesFor(Language language) {
        List<String> content = lines.get(language);
        if (content != null) {
            return content;
        }
        content = lines.get(Language.PRIMARY);
        if (content != null) {
            return content;
        }
        return lines.values().iterator().next();
    }
}
