package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.dto.DirectoryListing;
import org.devios.shell.dto.ListingEntry;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.fs.AccessKind;
import org.devios.shell.fs.DirectoryNode;
import org.devios.shell.fs.Node;
import org.devios.shell.fs.ResolvedPath;
import org.devios.shell.fs.VirtualFileTree;
import org.devios.shell.session.ShellSession;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * ls / cd / pwd。
 */
public class NavigationCommands implements CommandModule {

    private static final Comparator<ListingEntry> DIRECTORIES_FIRST =
            Comparator.comparing((ListingEntry entry) -> !entry.directory())
                    .thenComparing(ListingEntry::name);

    private final ManualPages manualPages;

    public NavigationCommands(ManualPages manualPages) {
        this.manualPages = manualPages;
    }

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.LS, this::list);
        registry.put(CommandName.CD, this::changeDirectory);
        registry.put(CommandName.PWD, this::printWorkingDirectory);
    }

    /**
     * 支持 {@code -a}（显示 . 开头的项）、{@code -l}（长格式）及其组合，{@code --all}、{@code --help}；
     * 可选一个路径操作数。目录在前，同类按名称排序。
     */
    CommandOutcome list(CommandContext ctx) {
        CommandLine line = ctx.line();
        if (line.hasFlag("--help")) {
            return CommandOutcome.of(manualPages.render(ctx, "ls"));
        }
        boolean showHidden = false;
        boolean longFormat = false;
        for (String arg : line.args()) {
            if (arg.equals("--all")) {
                showHidden = true;
            } else if (arg.startsWith("--")) {
                throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "ls.invalidLongOption", arg);
            } else if (arg.startsWith("-") && arg.length() > 1) {
                for (char flag : arg.substring(1).toCharArray()) {
                    if (flag == 'a') {
                        showHidden = true;
                    } else if (flag == 'l') {
                        longFormat = true;
                    } else {
                        throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "ls.invalidOption", String.valueOf(flag));
                    }
                }
            }
        }

        List<String> operands = line.operands();
        String target = operands.isEmpty() ? "." : operands.get(0);
        ResolvedPath resolved = ctx.resolveVisible(target)
                .orElseThrow(() -> ctx.fail(ErrorKind.NOT_FOUND, "ls.notFound", target));

        List<ListingEntry> entries = new ArrayList<>();
        if (resolved.node() instanceof DirectoryNode dir) {
            if (!ctx.can(dir, AccessKind.READ)) {
                throw ctx.fail(ErrorKind.PERMISSION_DENIED, "ls.permission", target);
            }
            ShellSession session = ctx.session();
            for (Map.Entry<String, Node> child : ctx.environment().tree().listChildren(dir).entrySet()) {
                String name = child.getKey();
                if (!showHidden && name.startsWith(".")) {
                    continue;
                }
                if (ctx.environment().gate().isChildHidden(session, resolved, name)) {
                    continue;
                }
                entries.add(toEntry(name, child.getValue()));
            }
            entries.sort(DIRECTORIES_FIRST);
        } else {
            entries.add(toEntry(resolved.name(), resolved.node()));
        }
        return CommandOutcome.of(ResultRecord.listing(new DirectoryListing(resolved.path(), longFormat, entries)));
    }

    /**
     * 无参数回到根目录；{@code -} 与上一个目录交换。只有解析成功且有执行权限时才修改会话。
     */
    CommandOutcome changeDirectory(CommandContext ctx) {
        ShellSession session = ctx.session();
        CommandLine line = ctx.line();
        if (!line.hasArgs()) {
            session.changeDirectory(VirtualFileTree.ROOT);
            return CommandOutcome.empty();
        }
        String target = line.arg(0);
        if (target.equals("-")) {
            String swapped = session.swapWithPrevious()
                    .orElseThrow(() -> ctx.fail(ErrorKind.INVALID_ARGUMENT, "cd.noPrevious"));
            return CommandOutcome.of(ResultRecord.system(swapped));
        }
        ResolvedPath resolved = ctx.resolveVisible(target)
                .orElseThrow(() -> ctx.fail(ErrorKind.NOT_FOUND, "cd.notFound", target));
        if (!resolved.node().isDirectory()) {
            throw ctx.fail(ErrorKind.NOT_FOUND, "cd.notDirectory", target);
        }
        if (!ctx.can(resolved.node(), AccessKind.EXECUTE)) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "cd.permission", target);
        }
        session.changeDirectory(resolved.path());
        return CommandOutcome.empty();
    }

    CommandOutcome printWorkingDirectory(CommandContext ctx) {
        ShellSession session = ctx.session();
        String home = "/home/" + session.actor();
        String cwd = session.cwd();
        return CommandOutcome.of(ResultRecord.success(
                VirtualFileTree.ROOT.equals(cwd) ? home : home + cwd.substring(VirtualFileTree.ROOT.length())));
    }

    private static ListingEntry toEntry(String name, Node node) {
        return new ListingEntry(name, node.isDirectory(), node.permissions().symbolic(),
                node.owner(), node.group(), node.modifiedAt());
    }
}
