package org.devios.shell.command;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * 按空白拆分后的命令行。不支持引号；管道与重定向在分发前已被拒绝。
 *
 * @param raw  原始输入（已去除首尾空白）
 * @param name 命令名（保留原始大小写，用于回显）
 * @param args 参数
 */
public record CommandLine(String raw, String name, List<String> args) {

    public CommandLine {
        args = List.copyOf(args);
    }

    public static CommandLine parse(String line) {
        String trimmed = (line == null) ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return new CommandLine("", "", List.of());
        }
        String[] tokens = trimmed.split("\\s+");
        return new CommandLine(trimmed, tokens[0], Arrays.asList(tokens).subList(1, tokens.length));
    }

    public String normalizedName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    public String arg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    public boolean hasFlag(String flag) {
        return args.contains(flag);
    }

    /**
     * 是否存在以 {@code -} 开头的参数。
     */
    public boolean hasOptionToken() {
        for (String arg : args) {
            if (arg.startsWith("-")) {
                return true;
            }
        }
        return false;
    }

    /**
     * 操作数（非 {@code -} 开头的参数）。
     */
    public List<String> operands() {
        return args.stream().filter(arg -> !arg.startsWith("-")).toList();
    }

    public String argsJoined() {
        return String.join(" ", args);
    }

    /**
     * 是否是递归强制删除（{@code rm -rf}、{@code rm -r -f}、{@code rm -Rf}、{@code rm --recursive --force} 等）。
     */
    public boolean isRecursiveForceDelete() {
        if (!"rm".equals(normalizedName())) {
            return false;
        }
        boolean recursive = false;
        boolean force = false;
        for (String arg : args) {
            if (arg.equals("--recursive")) {
                recursive = true;
            } else if (arg.equals("--force")) {
                force = true;
            } else if (arg.startsWith("-") && !arg.startsWith("--")) {
                recursive |= arg.indexOf('r') > 0 || arg.indexOf('R') > 0;
                force |= arg.indexOf('f') > 0;
            }
        }
        return recursive && force;
    }
}
