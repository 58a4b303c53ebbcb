package org.devios.shell.command;

import org.devios.shell.dto.ResultRecord;
import org.devios.shell.fs.VirtualFileTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * about / skills / projects / contact / github：作品集各分区的导航提示。
 */
public class PortfolioCommands implements CommandModule {

    private static final int GITHUB_LINES = 9;

    @Override
    public void registerInto(Map<CommandName, CommandHandler> registry) {
        registry.put(CommandName.ABOUT, ctx -> section(ctx, "about", "cat bio.txt"));
        registry.put(CommandName.SKILLS, ctx -> section(ctx, "skills", "cat frontend.txt"));
        registry.put(CommandName.PROJECTS, ctx -> section(ctx, "projects", "cd terminal-portfolio"));
        registry.put(CommandName.CONTACT, ctx -> section(ctx, "contact", "cat info.txt"));
        registry.put(CommandName.GITHUB, this::github);
    }

    /**
     * 不在该分区目录时提示 cd 过去；在目录内时显示标题和阅读方式。
     */
    CommandOutcome section(CommandContext ctx, String section, String example) {
        if (!ctx.session().cwd().equals(VirtualFileTree.ROOT + "/" + section)) {
            return CommandOutcome.of(
                    ResultRecord.info(ctx.text("nav.switch", section)),
                    ResultRecord.info(ctx.text("nav.useCd", section)));
        }
        return CommandOutcome.of(
                ResultRecord.info(ctx.text("section.title", ctx.text("section." + section))),
                ResultRecord.success(ctx.text("nav.useLs")),
                ResultRecord.success(ctx.text("nav.example", example)));
    }

    CommandOutcome github(CommandContext ctx) {
        List<ResultRecord> records = new ArrayList<>();
        records.add(ResultRecord.info(ctx.text("github.title")));
        for (int i = 1; i <= GITHUB_LINES; i++) {
            records.add(ResultRecord.success(ctx.text("github." + i)));
        }
        records.add(ResultRecord.system(ctx.text("github.more")));
        return CommandOutcome.of(records);
    }
}
