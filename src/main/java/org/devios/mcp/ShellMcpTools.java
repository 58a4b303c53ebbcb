package org.devios.mcp;

import org.devios.shell.ShellEngine;
import org.devios.shell.dto.ExecuteResult;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.dto.SessionSnapshot;
import org.devios.shell.dto.TranscriptEntry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * 虚拟终端 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>执行一行命令（{@code shell_execute}），返回第一批结果。</li>
 *   <li>查询会话状态（{@code shell_session}）与完整输出历史（{@code shell_transcript}）。</li>
 *   <li>键盘快捷键：Ctrl-C / Ctrl-D / Ctrl-L（{@code shell_interrupt} / {@code shell_end_of_input} / {@code shell_clear}）。</li>
 *   <li>历史导航（{@code shell_history}）。</li>
 * </ul>
 * 动画类命令（deviser start、下载、rm -rf）的后续输出是异步追加的，需要再调用 {@code shell_transcript} 获取。
 */
@Component
public class ShellMcpTools {

    private final ShellEngine engine;

    public ShellMcpTools(ShellEngine engine) {
        this.engine = engine;
    }

    @Tool(
            name = "shell_execute",
            description = "在虚拟终端中执行一行命令；等待 sudo 密码时，这一行会被当作密码处理且不回显。"
    )
    public ExecuteResult execute(
            @ToolParam(description = "命令行，例如 ls -la、cd about、cat bio.txt") String line
    ) {
        return engine.submit(line);
    }

    @Tool(
            name = "shell_session",
            description = "返回当前会话状态：用户、是否提权、当前目录、功能模式、语言、主题、是否在等待 sudo 密码、提示符。"
    )
    public SessionSnapshot session() {
        return engine.snapshot();
    }

    @Tool(
            name = "shell_transcript",
            description = "返回完整输出历史（包括定时脚本异步追加的内容）。"
    )
    public List<TranscriptEntry> transcript() {
        return engine.transcript();
    }

    @Tool(
            name = "shell_interrupt",
            description = "Ctrl-C：丢弃正在输入的内容并记录 ^C；已经在运行的动画不会被取消。"
    )
    public List<ResultRecord> interrupt(
            @ToolParam(required = false, description = "被中断时输入框里的内容") String pendingInput
    ) {
        return engine.interrupt(pendingInput);
    }

    @Tool(
            name = "shell_end_of_input",
            description = "Ctrl-D：输入为空时登出并重置会话；否则不做任何事。返回是否登出。"
    )
    public boolean endOfInput(
            @ToolParam(required = false, description = "当前输入框里的内容") String pendingInput
    ) {
        return engine.endOfInput(pendingInput);
    }

    @Tool(
            name = "shell_clear",
            description = "Ctrl-L：清空输出历史。"
    )
    public List<TranscriptEntry> clear() {
        engine.clearScreen();
        return engine.transcript();
    }

    /**
     * 方向参数大小写不敏感；其他取值视为参数错误。
     */
    @Tool(
            name = "shell_history",
            description = "浏览命令历史：up 取更早的一条，down 取更新的一条（越过最新一条返回空串）。没有可用历史时返回空串。"
    )
    public String history(
            @ToolParam(description = "方向：up 或 down") String direction
    ) {
        String normalized = direction == null ? "" : direction.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "up":
                return engine.historyPrevious().orElse("");
            case "down":
                return engine.historyNext().orElse("");
            default:
                throw new IllegalArgumentException("direction 只能是 up 或 down：" + direction);
        }
    }
}
