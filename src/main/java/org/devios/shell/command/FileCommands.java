package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.fs.AccessKind;
import org.devios.shell.fs.DirectoryNode;
import org.devios.shell.fs.FileNode;
import org.devios.shell.fs.ResolvedPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * cat / touch / mkdir / chmod / chown / find / rm。
 * <p>
 * 会“修改”树的命令只做参数与权限校验，然后回显成功；树本身保持不变。
 */
public class FileCommands implements CommandModule {

    private static final Pattern OCTAL_MODE = Pattern.compile("[0-7]{3,4}");
    private static final Pattern SYMBOLIC_MODE =
            Pattern.compile("[ugoa]*[-+=][rwxXst]*(,[ugoa]*[-+=][rwxXst]*)*");

    private final Choreography choreography;

    public FileCommands(Choreography choreography) {
        this.choreography = choreography;
    }

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.CAT, this::cat);
        registry.put(CommandName.TOUCH, this::touch);
        registry.put(CommandName.MKDIR, this::mkdir);
        registry.put(CommandName.CHMOD, this::chmod);
        registry.put(CommandName.CHOWN, this::chown);
        registry.put(CommandName.FIND, this::find);
        registry.put(CommandName.RM, this::remove);
    }

    /**
     * 输出当前语言版本的内容；二进制文件改走下载流程。
     */
    CommandOutcome cat(CommandContext ctx) {
        String target = ctx.line().arg(0);
        if (target == null) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "cat.missing");
        }
        ResolvedPath resolved = ctx.resolveVisible(target)
                .filter(path -> path.node() instanceof FileNode)
                .orElseThrow(() -> ctx.fail(ErrorKind.NOT_FOUND, "cat.notFound", target));
        FileNode file = (FileNode) resolved.node();
        if (!ctx.can(file, AccessKind.READ)) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "cat.permission", target);
        }
        List<String> lines = file.linesFor(ctx.language());
        if (file.binary()) {
            return choreography.download(ctx.language(), resolved.name(), lines);
        }
        List<ResultRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            records.add(ResultRecord.success(line));
        }
        return CommandOutcome.of(records);
    }

    CommandOutcome touch(CommandContext ctx) {
        String name = ctx.line().arg(0);
        if (name == null) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "touch.missing");
        }
        DirectoryNode cwd = ctx.currentDirectory();
        if (!ctx.can(cwd, AccessKind.WRITE)) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "touch.permission", name);
        }
        return CommandOutcome.of(ResultRecord.success(ctx.text("touch.created", name)));
    }

    CommandOutcome mkdir(CommandContext ctx) {
        String name = ctx.line().arg(0);
        if (name == null) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "mkdir.missing");
        }
        if (ctx.resolveVisible(name).isPresent()) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "mkdir.exists", name);
        }
        DirectoryNode cwd = ctx.currentDirectory();
        if (!ctx.can(cwd, AccessKind.WRITE)) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "mkdir.permission", name);
        }
        return CommandOutcome.of(ResultRecord.success(ctx.text("mkdir.created", name)));
    }

    /**
     * 只有所有者（或已提权）才能修改权限；模式支持八进制与符号两种写法。
     */
    CommandOutcome chmod(CommandContext ctx) {
        CommandLine line = ctx.line();
        if (line.args().size() < 2) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "chmod.missing");
        }
        String mode = line.arg(0);
        String target = line.arg(1);
        if (!OCTAL_MODE.matcher(mode).matches() && !SYMBOLIC_MODE.matcher(mode).matches()) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "chmod.invalidMode", mode);
        }
        ResolvedPath resolved = ctx.resolveVisible(target)
                .orElseThrow(() -> ctx.fail(ErrorKind.NOT_FOUND, "chmod.notFound", target));
        if (!ctx.owns(resolved.node())) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "chmod.permission", target);
        }
        return CommandOutcome.of(ResultRecord.success(ctx.text("chmod.changed", target)));
    }

    /**
     * 修改所有者需要已提权。
     */
    CommandOutcome chown(CommandContext ctx) {
        CommandLine line = ctx.line();
        if (line.args().size() < 2) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "chown.missing");
        }
        String owner = line.arg(0);
        String target = line.arg(1);
        if (!ctx.session().isPrivileged()) {
            throw ctx.fail(ErrorKind.PERMISSION_DENIED, "chown.notPermitted");
        }
        ctx.resolveVisible(target)
                .orElseThrow(() -> ctx.fail(ErrorKind.NOT_FOUND, "chown.notFound", target));
        return CommandOutcome.of(ResultRecord.success(ctx.text("chown.changed", target, owner)));
    }

    CommandOutcome find(CommandContext ctx) {
        if (!ctx.line().hasArgs()) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "find.missing");
        }
        throw ctx.fail(ErrorKind.UNSUPPORTED, "find.unsupported");
    }

    /**
     * 普通的 rm 一律拦截。递归强制删除在分发器里就转去了诱饵流程，不会走到这里。
     */
    CommandOutcome remove(CommandContext ctx) {
        if (!ctx.line().hasArgs()) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "rm.missing");
        }
        throw ctx.fail(ErrorKind.PERMISSION_DENIED, "rm.intercepted");
    }
}
