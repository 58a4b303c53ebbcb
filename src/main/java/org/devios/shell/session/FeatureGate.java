package org.devios.shell.session;

import org.devios.shell.fs.ResolvedPath;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 受限模式下的展示门禁：隐藏一组顶层目录和部分命令。
 * <p>
 * 与权限模型无关，命中时由调用方按“不存在”上报，错误信息与真正不存在完全一致。
 */
public class FeatureGate {

    private final Set<String> gatedNames;
    private final Set<String> basicCommands;

    public FeatureGate(Set<String> gatedNames, Set<String> basicCommands) {
        this.gatedNames = Set.copyOf(gatedNames);
        Set<String> lower = new HashSet<>();
        for (String command : basicCommands) {
            lower.add(command.toLowerCase(Locale.ROOT));
        }
        this.basicCommands = Set.copyOf(lower);
    }

    /**
     * 根目录下的某个子项是否被隐藏；路径解析时途经它即视为不存在。
     */
    public boolean isRootChildHidden(ShellSession session, String childName) {
        return !session.isFullFeatured() && gatedNames.contains(childName);
    }

    /**
     * 列目录时是否隐藏某个子项（只对根目录的直接子项生效）。
     */
    public boolean isChildHidden(ShellSession session, ResolvedPath directory, String childName) {
        return directory.isRoot() && isRootChildHidden(session, childName);
    }

    public boolean isCommandAvailable(ShellSession session, String commandName) {
        return session.isFullFeatured() || basicCommands.contains(commandName.toLowerCase(Locale.ROOT));
    }
}
