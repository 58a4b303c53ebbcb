package org.devios.shell.command;

import org.devios.shell.dto.ResultKind;
import org.devios.shell.dto.ResultRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * man 手册页。只收录 ls 与 cd；每行的文本来自消息资源，行的类型决定展示样式。
 */
public class ManualPages {

    private record Line(ResultKind kind, String code) {
    }

    private static final Map<String, List<Line>> PAGES = Map.of(
            "ls", List.of(
                    new Line(ResultKind.INFO, "man.ls.header"),
                    new Line(ResultKind.SYSTEM, "man.section.name"),
                    new Line(ResultKind.SUCCESS, "man.ls.name"),
                    new Line(ResultKind.SYSTEM, "man.section.synopsis"),
                    new Line(ResultKind.SUCCESS, "man.ls.synopsis"),
                    new Line(ResultKind.SYSTEM, "man.section.description"),
                    new Line(ResultKind.SUCCESS, "man.ls.description.1"),
                    new Line(ResultKind.SUCCESS, "man.ls.description.2"),
                    new Line(ResultKind.SYSTEM, "man.section.options"),
                    new Line(ResultKind.SUCCESS, "man.ls.option.all"),
                    new Line(ResultKind.SUCCESS, "man.ls.option.all.description"),
                    new Line(ResultKind.SUCCESS, "man.ls.option.long"),
                    new Line(ResultKind.INFO, "man.quit")),
            "cd", List.of(
                    new Line(ResultKind.INFO, "man.cd.header"),
                    new Line(ResultKind.SYSTEM, "man.section.name"),
                    new Line(ResultKind.SUCCESS, "man.cd.name"),
                    new Line(ResultKind.SYSTEM, "man.section.synopsis"),
                    new Line(ResultKind.SUCCESS, "man.cd.synopsis"),
                    new Line(ResultKind.SYSTEM, "man.section.description"),
                    new Line(ResultKind.SUCCESS, "man.cd.description.1"),
                    new Line(ResultKind.SUCCESS, "man.cd.description.2"),
                    new Line(ResultKind.INFO, "man.quit"))
    );

    public boolean has(String page) {
        return PAGES.containsKey(page);
    }

    public List<ResultRecord> render(CommandContext ctx, String page) {
        List<Line> lines = PAGES.get(page);
        if (lines == null) {
            throw new IllegalArgumentException("没有手册页：" + page);
        }
        List<ResultRecord> records = new ArrayList<>(lines.size());
        for (Line line : lines) {
            records.add(factory(line.kind()).apply(ctx.text(line.code())));
        }
        return records;
    }

    private static Function<String, ResultRecord> factory(ResultKind kind) {
        switch (kind) {
            case INFO:
                return ResultRecord::info;
            case SYSTEM:
                return ResultRecord::system;
            default:
                return ResultRecord::success;
        }
    }
}
