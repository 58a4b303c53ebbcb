package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.session.Language;
import org.devios.shell.session.ShellSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * help / whoami / id / date / uname / echo / man / lang / theme / clear / exit / logout。
 */
public class SystemCommands implements CommandModule {

    private static final List<String> BASIC_HELP = List.of(
            "help", "ls", "cd", "cat", "pwd", "whoami", "date", "clear", "echo", "uname", "lang", "deviser", "exit");
    private static final List<String> FULL_HELP = List.of(
            "ls", "cd", "cat", "pwd", "whoami", "id", "date", "man", "echo", "uname", "find", "mkdir", "touch",
            "chmod", "chown", "sudo", "github", "theme", "lang", "clear", "exit");
    private static final List<String> SHORTCUTS = List.of("ctrlC", "ctrlL", "ctrlD", "arrows");

    private final ManualPages manualPages;
    private final Choreography choreography;

    public SystemCommands(ManualPages manualPages, Choreography choreography) {
        this.manualPages = manualPages;
        this.choreography = choreography;
    }

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.HELP, this::help);
        registry.put(CommandName.WHOAMI, ctx -> CommandOutcome.of(ResultRecord.success(ctx.session().displayUser())));
        registry.put(CommandName.ID, this::id);
        registry.put(CommandName.DATE, this::date);
        registry.put(CommandName.UNAME, this::uname);
        registry.put(CommandName.ECHO, ctx -> CommandOutcome.of(ResultRecord.success(ctx.line().argsJoined())));
        registry.put(CommandName.MAN, this::manual);
        registry.put(CommandName.LANG, this::language);
        registry.put(CommandName.THEME, this::theme);
        registry.put(CommandName.CLEAR, ctx -> CommandOutcome.clear());
        registry.put(CommandName.EXIT, ctx -> choreography.logout(ctx.language()));
        registry.put(CommandName.LOGOUT, ctx -> choreography.logout(ctx.language()));
    }

    /**
     * 受限模式只列基本命令并提示启动服务；完整模式列出全部命令与快捷键。
     */
    CommandOutcome help(CommandContext ctx) {
        List<ResultRecord> records = new ArrayList<>();
        if (!ctx.session().isFullFeatured()) {
            records.add(ResultRecord.system(ctx.text("help.basic.title")));
            BASIC_HELP.forEach(name -> records.add(ResultRecord.success(ctx.text("help.command." + name))));
            records.add(ResultRecord.info(ctx.text("help.basic.tip")));
            return CommandOutcome.of(records);
        }
        records.add(ResultRecord.system(ctx.text("help.full.title")));
        FULL_HELP.forEach(name -> records.add(ResultRecord.success(ctx.text("help.command." + name))));
        records.add(ResultRecord.info(ctx.text("help.shortcuts")));
        SHORTCUTS.forEach(key -> records.add(ResultRecord.info(ctx.text("help.shortcut." + key))));
        return CommandOutcome.of(records);
    }

    CommandOutcome id(CommandContext ctx) {
        ShellSession session = ctx.session();
        List<String> groups = new ArrayList<>(session.groups());
        String primaryGroup = groups.isEmpty() ? session.actor() : groups.get(0);
        return CommandOutcome.of(ResultRecord.success(ctx.text("id.format",
                session.isPrivileged() ? "0" : "1000",
                session.displayUser(),
                primaryGroup,
                String.join(",", groups))));
    }

    CommandOutcome date(CommandContext ctx) {
        return CommandOutcome.of(ResultRecord.success(now(ctx)));
    }

    CommandOutcome uname(CommandContext ctx) {
        CommandLine line = ctx.line();
        if (line.hasFlag("-a")) {
            return CommandOutcome.of(ResultRecord.success(ctx.text("uname.full", now(ctx))));
        }
        for (String arg : line.args()) {
            if (!arg.equals("-s")) {
                throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "uname.invalidOption", arg);
            }
        }
        return CommandOutcome.of(ResultRecord.success(ctx.text("uname.short")));
    }

    CommandOutcome manual(CommandContext ctx) {
        String page = ctx.line().arg(0);
        if (page == null) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "man.missing");
        }
        if (!manualPages.has(page)) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, "man.noEntry", page);
        }
        return CommandOutcome.of(manualPages.render(ctx, page));
    }

    /**
     * 无参数时显示当前语言；{@code zh}/{@code en} 切换语言。只改会话，不动树。
     */
    CommandOutcome language(CommandContext ctx) {
        String requested = ctx.line().arg(0);
        if (requested == null) {
            return CommandOutcome.of(
                    ResultRecord.info(ctx.text("lang.current")),
                    ResultRecord.info(ctx.text("lang.usage")));
        }
        Language target = Language.fromShortName(requested);
        if (target == null) {
            throw ctx.fail(ErrorKind.INVALID_ARGUMENT, List.of(ctx.text("lang.usage")), "lang.invalid", requested);
        }
        ctx.session().setLanguage(target);
        return choreography.languageSwitch(target);
    }

    CommandOutcome theme(CommandContext ctx) {
        ctx.session().toggleTheme();
        return CommandOutcome.of(ResultRecord.system(ctx.text("theme.changed")));
    }

    private static String now(CommandContext ctx) {
        return ctx.environment().messages().now(ctx.language(), ctx.environment().clock());
    }
}
